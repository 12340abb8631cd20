package com.stagegate.core.collaborator;

import com.stagegate.core.health.HealthStatus;

/**
 * Reachability check for one service the run depends on.
 */
public interface DependencyProbe {

    HealthStatus check();
}
