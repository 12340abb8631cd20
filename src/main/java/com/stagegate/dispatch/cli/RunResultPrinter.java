package com.stagegate.dispatch.cli;

import com.stagegate.core.engine.PipelineState;
import com.stagegate.core.engine.RunOutcome;
import com.stagegate.core.qualitygate.GateDecision;

/**
 * Shared summary for {@code run} and {@code resume}.
 */
final class RunResultPrinter {

    static final int EXIT_COMPLETE = 0;
    static final int EXIT_ABORTED = 1;
    static final int EXIT_STARTUP_FAILED = 2;

    private RunResultPrinter() {
    }

    static int print(RunOutcome outcome) {
        System.out.println();
        System.out.println("RUN " + outcome.context().runId());
        System.out.println("Directory: " + outcome.context().runDir());
        for (GateDecision decision : outcome.decisions()) {
            ConsoleOutput.gate(decision.stageInstance(), decision.action(), decision.errors().size());
        }
        System.out.println("──────────────────────────────────");
        if (outcome.completed()) {
            ConsoleOutput.success("Run completed: " + String.join(" → ", outcome.context().completedStageNames()));
            return EXIT_COMPLETE;
        }
        GateDecision last = outcome.decisions().isEmpty() ? null
                : outcome.decisions().get(outcome.decisions().size() - 1);
        if (last != null && last.report() != null) {
            ConsoleOutput.report(last.report());
        }
        PipelineState resume = outcome.context().resumeState();
        ConsoleOutput.error("Run aborted" + (outcome.recovery() != null
                ? " (" + outcome.recovery().trigger() + ", recovery " + outcome.recovery().id() + ")" : "")
                + (resume != null ? "; resume re-enters " + resume : ""));
        return EXIT_ABORTED;
    }
}
