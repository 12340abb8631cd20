package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Everything a fresh agent needs to pick up a stalled stage without replaying the run.
 */
public record HandoffContext(
    @JsonProperty("user_objective") @JsonAlias("objective") String userObjective,
    @JsonProperty("current_stage") String currentStage,
    @JsonProperty("completed_stages") List<String> completedStages,
    @JsonProperty("todos_remaining") @JsonAlias("pending_tasks") List<String> todosRemaining,
    @JsonProperty("evidence_collected") @JsonAlias("evidence_refs") List<String> evidenceCollected,
    @JsonProperty("blockers") List<String> blockers,
    @JsonProperty("assumptions") List<String> assumptions,
    @JsonProperty("memory_refs") List<String> memoryRefs
) implements Serializable {

    public HandoffContext {
        completedStages = completedStages == null ? List.of() : List.copyOf(completedStages);
        todosRemaining = todosRemaining == null ? List.of() : List.copyOf(todosRemaining);
        evidenceCollected = evidenceCollected == null ? List.of() : List.copyOf(evidenceCollected);
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        memoryRefs = memoryRefs == null ? List.of() : List.copyOf(memoryRefs);
    }
}
