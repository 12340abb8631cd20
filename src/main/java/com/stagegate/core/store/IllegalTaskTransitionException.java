package com.stagegate.core.store;

import com.stagegate.core.StageGateException;
import com.stagegate.core.model.TaskStatus;

public class IllegalTaskTransitionException extends StageGateException {

    public IllegalTaskTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super(String.format("Task %s cannot move from %s to %s", taskId, from.wireName(), to.wireName()));
    }
}
