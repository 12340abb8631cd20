package com.stagegate.core.health;

import com.stagegate.core.StageGateException;
import com.stagegate.core.model.StartupReport;

import java.util.List;

public class StartupFailedException extends StageGateException {

    private final StartupReport report;
    private final List<HealthStatus> checks;

    public StartupFailedException(StartupReport report, List<HealthStatus> checks) {
        super("Startup checks failed: " + checks.stream()
                .filter(c -> !c.isUp())
                .map(c -> c.component() + " (" + c.detail() + ")")
                .toList());
        this.report = report;
        this.checks = List.copyOf(checks);
    }

    public StartupReport report() {
        return report;
    }

    public List<HealthStatus> checks() {
        return checks;
    }
}
