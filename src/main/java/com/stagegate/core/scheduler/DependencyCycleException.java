package com.stagegate.core.scheduler;

import com.stagegate.core.StageGateException;

import java.util.List;

/**
 * A batch whose {@code blocked_by} references form a cycle. Never retried.
 */
public class DependencyCycleException extends StageGateException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
