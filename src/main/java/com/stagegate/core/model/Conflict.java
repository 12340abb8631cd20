package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A disagreement surfaced while challenging assumptions. {@code resolution} stays empty
 * until the external reviewer settles it.
 *
 * @param id         {@code C-yyyyMMdd'T'HHmmss}
 * @param type       what the parties disagree about
 * @param parties    who disagrees
 * @param positions  one position per party
 * @param resolution reviewer's ruling, may be {@code null}
 */
public record Conflict(
    @JsonProperty("id") String id,
    @JsonProperty("type") ConflictType type,
    @JsonProperty("parties") List<String> parties,
    @JsonProperty("positions") List<String> positions,
    @JsonProperty("resolution") String resolution
) implements WorkflowRecord {

    public Conflict {
        parties = parties == null ? List.of() : List.copyOf(parties);
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
