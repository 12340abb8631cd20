package com.stagegate.core.qualitygate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stagegate.core.model.Stage;

import java.time.Instant;
import java.util.List;

/**
 * Result of one gate evaluation, as appended to the gate log.
 *
 * @param stage             stage occurrence evaluated
 * @param action            what the run does next
 * @param errors            every failed check, in evaluation order
 * @param checkedSchemas    schemas seen in the batch, in first-seen order
 * @param missingSchemas    required schemas with no record in the batch
 * @param provenEvidenceIds evidence whose artifacts substantiated their claims
 * @param retry             retry count the gate was evaluated at
 * @param timestamp         when the decision was made
 * @param report            remediation report, {@code null} on PROCEED
 */
public record GateDecision(
    @JsonProperty("stage") Stage stage,
    @JsonProperty("action") GateAction action,
    @JsonProperty("errors") List<GateError> errors,
    @JsonProperty("checked_schemas") List<String> checkedSchemas,
    @JsonProperty("missing_schemas") List<String> missingSchemas,
    @JsonProperty("proven_evidence") List<String> provenEvidenceIds,
    @JsonProperty("retry") int retry,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonIgnore String report
) {

    public GateDecision {
        errors = List.copyOf(errors);
        checkedSchemas = List.copyOf(checkedSchemas);
        missingSchemas = List.copyOf(missingSchemas);
        provenEvidenceIds = List.copyOf(provenEvidenceIds);
    }

    @JsonProperty("stage_instance")
    public String stageInstance() {
        return stage.instanceName();
    }

    @JsonIgnore
    public boolean proceeds() {
        return action == GateAction.PROCEED;
    }

    @JsonIgnore
    public List<String> errorMessages() {
        return errors.stream().map(GateError::render).toList();
    }

    public boolean hasError(GateErrorKind kind) {
        return errors.stream().anyMatch(e -> e.kind() == kind);
    }
}
