package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Proof that a claim holds, backed by an artifact on disk.
 * <p>
 * Ids follow {@code E-<STAGE>-<SESSION>-<SEQ>} with a three-digit sequence.
 * A record enters the store only after its verification passed and never changes afterwards.
 */
public record Evidence(
    @JsonProperty("id") String id,
    @JsonProperty("type") EvidenceType type,
    @JsonProperty("claim") String claim,
    @JsonProperty("location") String location,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("verified") boolean verified,
    @JsonProperty("verified_by") VerifiedBy verifiedBy
) implements WorkflowRecord {
}
