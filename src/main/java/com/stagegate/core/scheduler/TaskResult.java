package com.stagegate.core.scheduler;

import com.stagegate.core.model.EvidenceClaim;
import com.stagegate.core.model.TaskStatus;
import com.stagegate.core.model.WorkflowRecord;

import java.time.Instant;
import java.util.List;

/**
 * Execution log entry for one dispatched task.
 *
 * @param taskId         task identifier
 * @param status         status the task ended in
 * @param evidenceClaims proof offered by the handler
 * @param records        extra records produced by the handler
 * @param startedAt      when the handler was invoked, {@code null} if the task never ran
 * @param finishedAt     when the handler returned
 * @param error          failure detail, {@code null} on success
 */
public record TaskResult(
    String taskId,
    TaskStatus status,
    List<EvidenceClaim> evidenceClaims,
    List<WorkflowRecord> records,
    Instant startedAt,
    Instant finishedAt,
    String error
) {

    public TaskResult {
        evidenceClaims = evidenceClaims == null ? List.of() : List.copyOf(evidenceClaims);
        records = records == null ? List.of() : List.copyOf(records);
    }

    static TaskResult blocked(String taskId, String reason) {
        Instant now = Instant.now();
        return new TaskResult(taskId, TaskStatus.BLOCKED, List.of(), List.of(), null, now, reason);
    }

    public boolean completed() {
        return status == TaskStatus.COMPLETED;
    }
}
