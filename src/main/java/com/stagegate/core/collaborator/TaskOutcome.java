package com.stagegate.core.collaborator;

import com.stagegate.core.model.EvidenceClaim;
import com.stagegate.core.model.TaskStatus;
import com.stagegate.core.model.WorkflowRecord;

import java.util.List;

/**
 * What a {@link StageHandler} reports back for one task.
 *
 * @param status         final status, one of completed, failed or blocked
 * @param evidenceClaims artifacts offered as proof
 * @param records        additional control records the work produced (metrics, skills, ...)
 * @param detail         free-text explanation, used for failures
 */
public record TaskOutcome(
    TaskStatus status,
    List<EvidenceClaim> evidenceClaims,
    List<WorkflowRecord> records,
    String detail
) {

    public TaskOutcome {
        evidenceClaims = evidenceClaims == null ? List.of() : List.copyOf(evidenceClaims);
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static TaskOutcome completed(List<EvidenceClaim> claims, List<WorkflowRecord> records) {
        return new TaskOutcome(TaskStatus.COMPLETED, claims, records, null);
    }

    public static TaskOutcome failed(String detail) {
        return new TaskOutcome(TaskStatus.FAILED, List.of(), List.of(), detail);
    }
}
