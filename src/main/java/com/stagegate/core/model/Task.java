package com.stagegate.core.model;

/**
 * A unit of work produced by PLAN and executed by the stage that owns it.
 * <p>
 * Four base fields plus a thirteen-field {@link TaskMetadata} block; the wire
 * {@code kind} is {@code todo}.
 *
 * @param id       unique identifier within the run
 * @param content  description of the work
 * @param status   current lifecycle status
 * @param priority scheduling priority
 * @param metadata objective, criteria, evidence expectations and routing
 */
public record Task(
    String id,
    String content,
    TaskStatus status,
    Priority priority,
    TaskMetadata metadata
) implements WorkflowRecord {

    public static final int BASE_FIELD_COUNT = 4;
    public static final int FIELD_COUNT = BASE_FIELD_COUNT + TaskMetadata.FIELD_COUNT;

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, content, newStatus, priority, metadata);
    }

    public boolean hasDependencies() {
        return metadata != null && metadata.blockedBy() != null && !metadata.blockedBy().isEmpty();
    }
}
