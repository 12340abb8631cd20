package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * The thirteen metadata fields every {@link Task} carries.
 *
 * @param objective         what the task is for
 * @param successCriteria   text that must appear in the evidence artifact
 * @param failCriteria      condition under which the task counts as failed
 * @param evidenceRequired  kind of artifact expected as proof
 * @param evidenceLocation  path of the proof artifact
 * @param responsibleAgent  agent model owning the work
 * @param workflowPath      the stage path the task follows
 * @param blockedBy         ids of tasks that must complete first
 * @param parallel          whether the task may run alongside its siblings
 * @param currentStage      stage that owns the task
 * @param instructionSet    instruction bundle handed to the executing agent
 * @param timeBudget        time allowance, e.g. {@code ≤60m}
 * @param reviewer          who reviews the result
 */
public record TaskMetadata(
    @JsonProperty("objective") String objective,
    @JsonProperty("success_criteria") String successCriteria,
    @JsonProperty("fail_criteria") String failCriteria,
    @JsonProperty("evidence_required") EvidenceType evidenceRequired,
    @JsonProperty("evidence_location") String evidenceLocation,
    @JsonProperty("agent_model") @JsonAlias("responsible_agent") String responsibleAgent,
    @JsonProperty("workflow") @JsonAlias("workflow_path") String workflowPath,
    @JsonProperty("blocked_by") List<String> blockedBy,
    @JsonProperty("parallel") boolean parallel,
    @JsonProperty("workflow_stage") @JsonAlias("current_stage") Stage currentStage,
    @JsonProperty("instructions_set") @JsonAlias("instruction_set") String instructionSet,
    @JsonProperty("time_budget") String timeBudget,
    @JsonProperty("reviewer") String reviewer
) implements Serializable {

    public static final int FIELD_COUNT = 13;

    public static final String DEFAULT_WORKFLOW = "PLAN→REVIEW→DISRUPT→IMPLEMENT→TEST→REVIEW→VALIDATE→LEARN";
    public static final String DEFAULT_TIME_BUDGET = "≤60m";

    public TaskMetadata {
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
    }
}
