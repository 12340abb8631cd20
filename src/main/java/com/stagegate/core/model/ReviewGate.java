package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a review stage as reported by the reviewing agent.
 */
public record ReviewGate(
    @JsonProperty("stage") Stage stage,
    @JsonProperty("agent") @JsonAlias("reviewing_agent") String agent,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("criteria_checked") List<String> criteriaChecked,
    @JsonProperty("approved") boolean approved,
    @JsonProperty("action") ReviewAction action
) implements WorkflowRecord {

    public ReviewGate {
        criteriaChecked = criteriaChecked == null ? List.of() : List.copyOf(criteriaChecked);
    }
}
