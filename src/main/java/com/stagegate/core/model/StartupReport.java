package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Result of the blocking startup checks.
 *
 * @param dependenciesVerified every configured dependency probe answered
 * @param schedulerActive      the liveness timer accepted a schedule
 * @param memoryOk             key/value round trip returned the written value
 * @param envReady             run directory layout exists
 * @param workflowDir          run directory
 * @param timestamp            when the checks ran
 */
public record StartupReport(
    @JsonProperty("mcp_verified") @JsonAlias("dependencies_verified") boolean dependenciesVerified,
    @JsonProperty("scheduler_active") boolean schedulerActive,
    @JsonProperty("memory_ok") boolean memoryOk,
    @JsonProperty("env_ready") boolean envReady,
    @JsonProperty("workflow_dir") String workflowDir,
    @JsonProperty("timestamp") Instant timestamp
) implements WorkflowRecord {

    public boolean passed() {
        return dependenciesVerified && schedulerActive && memoryOk && envReady;
    }
}
