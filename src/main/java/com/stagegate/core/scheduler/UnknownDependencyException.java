package com.stagegate.core.scheduler;

import com.stagegate.core.StageGateException;

/**
 * A {@code blocked_by} entry that names no known task.
 */
public class UnknownDependencyException extends StageGateException {

    public UnknownDependencyException(String taskId, String missing) {
        super(String.format("Task %s is blocked by unknown task %s", taskId, missing));
    }
}
