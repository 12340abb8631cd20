package com.stagegate.core.collaborator;

import com.stagegate.core.model.Stage;
import com.stagegate.core.model.Task;

/**
 * Performs the actual work of a task. The engine only judges what comes back.
 */
public interface StageHandler {

    TaskOutcome execute(StageContext context, Task task);

    /**
     * Whether this handler takes tasks of {@code stage}; the registry picks the first match.
     */
    default boolean supports(Stage stage) {
        return true;
    }
}
