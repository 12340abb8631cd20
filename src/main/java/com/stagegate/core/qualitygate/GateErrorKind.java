package com.stagegate.core.qualitygate;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a failed gate check.
 */
public enum GateErrorKind {
    /** A record breaks its schema's structural rules. */
    SCHEMA_VIOLATION("SchemaViolation"),
    /** A schema the stage requires has no record in the batch. */
    MISSING_SCHEMA("MissingSchema"),
    /** The artifact behind a verified claim does not exist. */
    MISSING_EVIDENCE("MissingEvidence"),
    /** The artifact exists but does not substantiate the claim. */
    UNPROVEN_CLAIM("UnprovenClaim"),
    /** A reviewer declined, failed or timed out. */
    EXTERNAL_REJECTION("ExternalRejection"),
    /** Task dependencies form a cycle; fatal. */
    DEPENDENCY_CYCLE("DependencyCycle"),
    /** A completion claim with no evidence at all. */
    FABRICATION("Fabrication");

    private final String label;

    GateErrorKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
