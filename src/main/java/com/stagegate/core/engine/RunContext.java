package com.stagegate.core.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stagegate.core.collaborator.StageContext;
import com.stagegate.core.model.Stage;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of a run. Every step of the orchestrator yields a new instance;
 * the latest one is checkpointed to the key/value store.
 *
 * @param runId           run identifier
 * @param objective       user objective
 * @param runDir          run directory
 * @param state           current pipeline state
 * @param retryCount      attempts already spent on the current stage by the current agent
 * @param executingAgent  agent working the current stage
 * @param escalationCount escalations so far in the current stage
 * @param fabricationCount gates of the current stage that found a fabrication, kept across escalations
 * @param completedStages states whose gate passed, in order
 * @param resumeState     state a resumed run re-enters, set when the run aborts
 * @param startedAt       when the run was created
 */
public record RunContext(
    @JsonProperty("run_id") String runId,
    @JsonProperty("objective") String objective,
    @JsonProperty("run_dir") String runDir,
    @JsonProperty("state") PipelineState state,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("executing_agent") String executingAgent,
    @JsonProperty("escalation_count") int escalationCount,
    @JsonProperty("fabrication_count") int fabricationCount,
    @JsonProperty("completed_stages") List<PipelineState> completedStages,
    @JsonProperty("resume_state") PipelineState resumeState,
    @JsonProperty("started_at") Instant startedAt
) {

    public RunContext {
        completedStages = completedStages == null ? List.of() : List.copyOf(completedStages);
    }

    public static RunContext start(String runId, String objective, Path runDir, Instant now) {
        return new RunContext(runId, objective, runDir.toString(), PipelineState.STARTUP,
                0, null, 0, 0, List.of(), null, now);
    }

    @JsonIgnore
    public Path runPath() {
        return Path.of(runDir);
    }

    @JsonIgnore
    public Stage stage() {
        return state.stage().orElseThrow(() -> new IllegalStateException("No stage in state " + state));
    }

    public StageContext stageContext() {
        return new StageContext(runId, objective, stage(), runPath(), executingAgent, retryCount);
    }

    /** Gate passed: record the current state as completed and move on. */
    public RunContext advance(PipelineState next, String nextAgent) {
        var completed = new ArrayList<>(completedStages);
        if (state.stage().isPresent()) {
            completed.add(state);
        }
        return new RunContext(runId, objective, runDir, next, 0, nextAgent, 0, 0, completed, null, startedAt);
    }

    public RunContext nextAttempt() {
        return new RunContext(runId, objective, runDir, state, retryCount + 1, executingAgent,
                escalationCount, fabricationCount, completedStages, resumeState, startedAt);
    }

    public RunContext escalated(String agent) {
        return new RunContext(runId, objective, runDir, state, 0, agent,
                escalationCount + 1, fabricationCount, completedStages, resumeState, startedAt);
    }

    public RunContext aborted() {
        return new RunContext(runId, objective, runDir, PipelineState.ABORTED, retryCount, executingAgent,
                escalationCount, fabricationCount, completedStages, state, startedAt);
    }

    public RunContext fabricated() {
        return new RunContext(runId, objective, runDir, state, retryCount, executingAgent,
                escalationCount, fabricationCount + 1, completedStages, resumeState, startedAt);
    }

    /** Re-enter {@code state} with a fresh retry budget. */
    public RunContext resumedAt(PipelineState state, String agent) {
        return new RunContext(runId, objective, runDir, state, 0, agent, 0, 0, completedStages, null, startedAt);
    }

    @JsonIgnore
    public List<String> completedStageNames() {
        return completedStages.stream().map(s -> s.stage().map(Stage::gateName).orElse(s.name())).toList();
    }
}
