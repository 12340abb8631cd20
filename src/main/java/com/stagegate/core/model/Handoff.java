package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Written on escalation when a stage moves to a more capable agent.
 */
public record Handoff(
    @JsonProperty("from_agent") @JsonAlias("from") String fromAgent,
    @JsonProperty("to_agent") @JsonAlias("to") String toAgent,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("context") HandoffContext context,
    @JsonProperty("instructions") String instructions,
    @JsonProperty("deadline") Instant deadline
) implements WorkflowRecord {
}
