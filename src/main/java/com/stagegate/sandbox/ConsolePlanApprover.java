package com.stagegate.sandbox;

import com.stagegate.core.collaborator.Plan;
import com.stagegate.core.collaborator.PlanApprover;
import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shows the plan and waits for a yes or no. There is no timeout; closed input rejects.
 * With {@code stagegate.plan.auto-approve} set the plan is accepted without asking.
 */
public class ConsolePlanApprover implements PlanApprover {

    private static final Logger log = LoggerFactory.getLogger(ConsolePlanApprover.class);

    private final ConsolePrompt prompt;
    private final StageGateProperties properties;

    public ConsolePlanApprover(ConsolePrompt prompt, StageGateProperties properties) {
        this.prompt = prompt;
        this.properties = properties;
    }

    @Override
    public boolean awaitApproval(Plan plan) {
        if (properties.getPlan().isAutoApprove()) {
            log.info("Plan with {} tasks auto-approved", plan.tasks().size());
            return true;
        }
        prompt.print("");
        prompt.print("Plan (" + plan.tasks().size() + " tasks):");
        for (Task task : plan.tasks()) {
            prompt.print(String.format("  %-8s %-9s %-8s %s", task.id(), task.metadata().currentStage(),
                    task.priority(), task.content()));
        }
        boolean approved = prompt.confirm("Approve plan?").orElse(false);
        log.info("Plan {}", approved ? "approved" : "rejected");
        return approved;
    }
}
