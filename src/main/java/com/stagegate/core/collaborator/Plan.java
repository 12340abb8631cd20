package com.stagegate.core.collaborator;

import com.stagegate.core.model.EvidenceClaim;
import com.stagegate.core.model.Task;
import com.stagegate.core.model.WorkflowRecord;

import java.util.List;

/**
 * Output of the PLAN stage.
 *
 * @param tasks          every task of the run
 * @param evidenceClaims proof of the plan itself, usually the plan document
 * @param records        further records the planner produced
 */
public record Plan(
    List<Task> tasks,
    List<EvidenceClaim> evidenceClaims,
    List<WorkflowRecord> records
) {

    public Plan {
        tasks = List.copyOf(tasks);
        evidenceClaims = evidenceClaims == null ? List.of() : List.copyOf(evidenceClaims);
        records = records == null ? List.of() : List.copyOf(records);
    }
}
