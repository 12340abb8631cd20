package com.stagegate.core.engine;

import com.stagegate.core.model.RecoveryRecord;
import com.stagegate.core.qualitygate.GateDecision;

import java.util.List;

/**
 * Final state of a run together with every gate decision it produced.
 *
 * @param context   last run context
 * @param decisions gate decisions in the order they were made
 * @param recovery  recovery record when the run aborted, otherwise {@code null}
 */
public record RunOutcome(RunContext context, List<GateDecision> decisions, RecoveryRecord recovery) {

    public RunOutcome {
        decisions = List.copyOf(decisions);
    }

    public boolean completed() {
        return context.state() == PipelineState.COMPLETE;
    }
}
