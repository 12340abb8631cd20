package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Checkpoint written when a run stops; a later resume starts from {@code resumeStage}.
 *
 * @param id          {@code R-yyyyMMdd'T'HHmmss}
 * @param trigger     why the run stopped
 * @param rollbackTo  last stage whose gate passed, or {@code STARTUP}
 * @param stateBefore pipeline state when the stop was decided
 * @param stateAfter  pipeline state after the stop
 * @param success     whether the rollback checkpoint was written
 * @param resumeStage stage a resumed run re-enters
 */
public record RecoveryRecord(
    @JsonProperty("id") String id,
    @JsonProperty("trigger") String trigger,
    @JsonProperty("rollback_to") String rollbackTo,
    @JsonProperty("state_before") String stateBefore,
    @JsonProperty("state_after") String stateAfter,
    @JsonProperty("success") boolean success,
    @JsonProperty("resume_stage") Stage resumeStage
) implements WorkflowRecord {
}
