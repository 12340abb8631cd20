package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A reusable capability captured during LEARN.
 */
public record Skill(
    @JsonProperty("name") String name,
    @JsonProperty("source") String source,
    @JsonProperty("purpose") String purpose,
    @JsonProperty("interface") String interfaceSpec,
    @JsonProperty("tested") boolean tested,
    @JsonProperty("evidence_location") String evidenceLocation
) implements WorkflowRecord {
}
