package com.stagegate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer meters for gate decisions, task execution and run outcomes.
 */
@Service
public class StageGateMetrics {

    private final MeterRegistry registry;

    public StageGateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordGateDecision(String stage, String action) {
        Counter.builder("stagegate.gate.decisions")
                .tag("stage", stage)
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordGateErrors(String stage, int errorCount) {
        DistributionSummary.builder("stagegate.gate.errors")
                .tag("stage", stage)
                .register(registry)
                .record(errorCount);
    }

    public void recordTaskExecution(String stage, String status, long ms) {
        Timer.builder("stagegate.task.duration")
                .tag("stage", stage)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void incrementEscalations(String stage) {
        Counter.builder("stagegate.escalations.total")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String state) {
        Counter.builder("stagegate.runs.total")
                .tag("state", state)
                .register(registry)
                .increment();
    }
}
