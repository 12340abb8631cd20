package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Per-run measurements, required by the TEST and LEARN gates.
 */
public record RunMetrics(
    @JsonProperty("workflow_id") String workflowId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("total_time_min") int totalTimeMin,
    @JsonProperty("stages") Map<String, Object> stages,
    @JsonProperty("agents") Map<String, Object> agents,
    @JsonProperty("evidence") Map<String, Object> evidence,
    @JsonProperty("quality") Map<String, Object> quality
) implements WorkflowRecord {

    public RunMetrics {
        stages = stages == null ? Map.of() : Map.copyOf(stages);
        agents = agents == null ? Map.of() : Map.copyOf(agents);
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
        quality = quality == null ? Map.of() : Map.copyOf(quality);
    }
}
