package com.stagegate.core.health;

import com.stagegate.core.collaborator.DependencyProbe;
import com.stagegate.core.collaborator.KeyValueStore;
import com.stagegate.core.collaborator.LivenessTimer;
import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.engine.RunLayout;
import com.stagegate.core.model.StartupReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Blocking checks run before PLAN: dependency probes, a key/value round trip,
 * the liveness scheduler and the run directory layout.
 */
@Service
public class StartupValidator {

    private static final Logger log = LoggerFactory.getLogger(StartupValidator.class);

    private final List<DependencyProbe> probes;
    private final KeyValueStore keyValueStore;
    private final LivenessTimer livenessTimer;
    private final Path runRoot;
    private final Clock clock;

    @Autowired
    public StartupValidator(@Autowired(required = false) List<DependencyProbe> probes,
                            KeyValueStore keyValueStore,
                            LivenessTimer livenessTimer,
                            StageGateProperties properties) {
        this(withConfiguredProbes(probes, properties), keyValueStore, livenessTimer,
                Path.of(properties.getRunRoot()), Clock.systemUTC());
    }

    public StartupValidator(List<DependencyProbe> probes, KeyValueStore keyValueStore,
                            LivenessTimer livenessTimer, Path runRoot, Clock clock) {
        this.probes = probes == null ? List.of() : List.copyOf(probes);
        this.keyValueStore = keyValueStore;
        this.livenessTimer = livenessTimer;
        this.runRoot = runRoot;
        this.clock = clock;
    }

    /**
     * Runs every check for {@code runId} and creates its directory layout.
     * The caller decides what a failed report means.
     */
    public StartupResult validate(String runId, Path runDir) {
        var checks = new ArrayList<HealthStatus>();

        // ── Dependencies ──
        boolean dependenciesOk = true;
        for (DependencyProbe probe : probes) {
            HealthStatus status = probe.check();
            checks.add(status);
            dependenciesOk &= status.isUp();
        }

        // ── Memory ──
        HealthStatus memory = checkMemory("startup/" + runId + "/probe");
        checks.add(memory);

        // ── Scheduler ──
        HealthStatus scheduler = checkScheduler();
        checks.add(scheduler);

        // ── Environment ──
        HealthStatus environment = prepareRunDirectory(runDir);
        checks.add(environment);

        var report = new StartupReport(dependenciesOk, scheduler.isUp(), memory.isUp(), environment.isUp(),
                runDir.toString(), clock.instant());
        if (report.passed()) {
            log.info("Startup checks passed for run {}", runId);
        } else {
            log.error("Startup checks failed for run {}: {}", runId, checks.stream()
                    .filter(c -> !c.isUp()).map(HealthStatus::component).toList());
        }
        return new StartupResult(report, checks);
    }

    /**
     * Same checks without creating a run; the run root is only tested for writability.
     */
    public List<HealthStatus> checkAll() {
        var checks = new ArrayList<HealthStatus>();
        probes.forEach(p -> checks.add(p.check()));
        checks.add(checkMemory("health/probe"));
        checks.add(checkScheduler());
        checks.add(checkRunRoot());
        return checks;
    }

    private HealthStatus checkMemory(String key) {
        String token = UUID.randomUUID().toString();
        try {
            keyValueStore.put(key, token);
            boolean matches = keyValueStore.get(key).map(token::equals).orElse(false);
            return matches
                    ? HealthStatus.up("memory", "Key/value round trip succeeded")
                    : HealthStatus.down("memory", "Key/value store returned a different value");
        } catch (Exception e) {
            log.warn("Key/value round trip failed: {}", e.getMessage());
            return HealthStatus.down("memory", "Key/value error: " + e.getMessage());
        }
    }

    private HealthStatus checkScheduler() {
        try (LivenessTimer.Registration ignored = livenessTimer.every(Duration.ofHours(1), () -> { })) {
            return HealthStatus.up("scheduler", "Liveness timer accepted a schedule");
        } catch (Exception e) {
            log.warn("Liveness timer unavailable: {}", e.getMessage());
            return HealthStatus.down("scheduler", "Liveness timer error: " + e.getMessage());
        }
    }

    private HealthStatus prepareRunDirectory(Path runDir) {
        try {
            RunLayout.create(runDir);
            return new HealthStatus("environment", HealthStatus.Status.UP,
                    "Run directory ready", Map.of("path", runDir.toString()));
        } catch (Exception e) {
            log.warn("Run directory {} unavailable: {}", runDir, e.getMessage());
            return HealthStatus.down("environment", e.getMessage());
        }
    }

    private HealthStatus checkRunRoot() {
        try {
            Files.createDirectories(runRoot);
            if (Files.isWritable(runRoot)) {
                return new HealthStatus("environment", HealthStatus.Status.UP,
                        "Run root writable", Map.of("path", runRoot.toString()));
            }
            return HealthStatus.down("environment", "Run root not writable: " + runRoot);
        } catch (Exception e) {
            return HealthStatus.down("environment", "Run root error: " + e.getMessage());
        }
    }

    private static List<DependencyProbe> withConfiguredProbes(List<DependencyProbe> beans,
                                                              StageGateProperties properties) {
        var all = new ArrayList<DependencyProbe>();
        if (beans != null) {
            all.addAll(beans);
        }
        Duration timeout = properties.getStartup().getProbeTimeout();
        for (String url : properties.getStartup().getProbes()) {
            all.add(new HttpDependencyProbe(url, timeout));
        }
        return all;
    }
}
