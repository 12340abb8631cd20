package com.stagegate.core.health;

import com.stagegate.core.collaborator.DependencyProbe;
import com.stagegate.core.collaborator.KeyValueStore;
import com.stagegate.core.collaborator.LivenessTimer;
import com.stagegate.core.engine.RunLayout;
import com.stagegate.core.model.StartupReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link StartupValidator}.
 */
class StartupValidatorTest {

    @TempDir
    Path root;

    private Map<String, String> memory;
    private KeyValueStore keyValueStore;
    private LivenessTimer livenessTimer;
    private final Clock clock = Clock.fixed(Instant.parse("2025-01-15T10:30:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        memory = new HashMap<>();
        keyValueStore = new KeyValueStore() {
            @Override
            public Optional<String> get(String key) {
                return Optional.ofNullable(memory.get(key));
            }

            @Override
            public void put(String key, String value) {
                memory.put(key, value);
            }
        };
        livenessTimer = (interval, callback) -> () -> { };
    }

    private StartupValidator validator(DependencyProbe... probes) {
        return new StartupValidator(List.of(probes), keyValueStore, livenessTimer, root, clock);
    }

    @Test
    @DisplayName("passes and creates the run layout when every check is up")
    void allChecksPass() {
        Path runDir = root.resolve("R-1");

        StartupResult result = validator(() -> HealthStatus.up("dependency:registry", "HTTP 200"))
                .validate("R-1", runDir);

        assertTrue(result.passed());
        StartupReport report = result.report();
        assertTrue(report.dependenciesVerified());
        assertTrue(report.memoryOk());
        assertTrue(report.schedulerActive());
        assertTrue(report.envReady());
        assertEquals(runDir.toString(), report.workflowDir());
        assertEquals(clock.instant(), report.timestamp());
        assertTrue(RunLayout.isComplete(runDir));
        assertTrue(memory.containsKey("startup/R-1/probe"));
    }

    @Test
    @DisplayName("a down dependency fails the report but every check still runs")
    void dependencyDown() {
        StartupResult result = validator(() -> HealthStatus.down("dependency:registry", "Unreachable"))
                .validate("R-1", root.resolve("R-1"));

        assertFalse(result.passed());
        assertFalse(result.report().dependenciesVerified());
        assertEquals(4, result.checks().size());
        assertTrue(result.report().memoryOk());
    }

    @Test
    @DisplayName("a key/value store that loses writes fails the memory check")
    void memoryDown() {
        KeyValueStore forgetful = mock(KeyValueStore.class);
        when(forgetful.get(anyString())).thenReturn(Optional.empty());
        var validator = new StartupValidator(List.of(), forgetful, livenessTimer, root, clock);

        StartupResult result = validator.validate("R-1", root.resolve("R-1"));

        assertFalse(result.report().memoryOk());
        assertFalse(result.passed());
    }

    @Test
    @DisplayName("a scheduler that refuses registrations fails the scheduler check")
    void schedulerDown() {
        LivenessTimer broken = (interval, callback) -> {
            throw new IllegalStateException("executor shut down");
        };
        var validator = new StartupValidator(List.of(), keyValueStore, broken, root, clock);

        StartupResult result = validator.validate("R-1", root.resolve("R-1"));

        assertFalse(result.report().schedulerActive());
    }

    @Test
    @DisplayName("checkAll reports probes, memory, scheduler and run root")
    void checkAll() {
        List<HealthStatus> checks = validator(() -> HealthStatus.up("dependency:registry", "HTTP 200")).checkAll();

        assertEquals(List.of("dependency:registry", "memory", "scheduler", "environment"),
                checks.stream().map(HealthStatus::component).toList());
        assertTrue(checks.stream().allMatch(HealthStatus::isUp));
    }

    @Test
    @DisplayName("an unreachable HTTP dependency is reported down")
    void httpProbeUnreachable() {
        var probe = new HttpDependencyProbe("http://127.0.0.1:1/health", Duration.ofSeconds(2));

        HealthStatus status = probe.check();

        assertFalse(status.isUp());
        assertEquals("dependency:127.0.0.1", status.component());
    }

    @Test
    @DisplayName("StartupFailedException names the failing components")
    void failureMessage() {
        var checks = List.of(HealthStatus.up("memory", "ok"), HealthStatus.down("scheduler", "stopped"));
        var report = new StartupReport(true, false, true, true, "runs/R-1", clock.instant());

        var ex = new StartupFailedException(report, checks);

        assertEquals("Startup checks failed: [scheduler (stopped)]", ex.getMessage());
    }
}
