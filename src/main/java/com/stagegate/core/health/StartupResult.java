package com.stagegate.core.health;

import com.stagegate.core.model.StartupReport;

import java.util.List;

public record StartupResult(StartupReport report, List<HealthStatus> checks) {

    public StartupResult {
        checks = List.copyOf(checks);
    }

    public boolean passed() {
        return report.passed();
    }
}
