package com.stagegate.core.qualitygate;

import com.stagegate.core.config.StageGateProperties;

import java.time.Duration;
import java.util.List;

/**
 * Thresholds that turn a list of errors into an action.
 *
 * @param maxRetry              retries allowed before a stage escalates
 * @param errorCeiling          error count above which a gate stops the run
 * @param fabricationRetryLimit earlier attempts of a stage from which a fabrication stops instead of escalating
 * @param reviewerTimeout       how long to wait for the external reviewer
 */
public record GatePolicy(
    int maxRetry,
    int errorCeiling,
    int fabricationRetryLimit,
    Duration reviewerTimeout
) {

    public static GatePolicy defaults() {
        return new GatePolicy(3, 10, 1, Duration.ofSeconds(300));
    }

    public static GatePolicy from(StageGateProperties properties) {
        var gate = properties.getGate();
        return new GatePolicy(gate.getMaxRetry(), gate.getErrorCeiling(),
                gate.getFabricationRetryLimit(), gate.getReviewerTimeout());
    }

    /**
     * Decision rule, in order: no errors proceeds; too many errors, a dependency cycle or
     * a repeated fabrication stops; a first fabrication or exhausted retries escalate;
     * anything else is revised.
     */
    public GateAction decide(List<GateError> errors, int retry) {
        return decide(errors, retry, 0);
    }

    /**
     * As {@link #decide(List, int)}, also counting fabrications already found in the stage.
     * Escalation resets {@code retry} but not that count.
     */
    public GateAction decide(List<GateError> errors, int retry, int priorFabrications) {
        if (errors.isEmpty()) {
            return GateAction.PROCEED;
        }
        if (errors.size() > errorCeiling) {
            return GateAction.STOP;
        }
        if (errors.stream().anyMatch(e -> e.kind() == GateErrorKind.DEPENDENCY_CYCLE)) {
            return GateAction.STOP;
        }
        boolean fabrication = errors.stream().anyMatch(e -> e.kind() == GateErrorKind.FABRICATION);
        if (fabrication) {
            int attempts = Math.max(retry, priorFabrications);
            return attempts >= fabricationRetryLimit ? GateAction.STOP : GateAction.ESCALATE;
        }
        if (retry >= maxRetry) {
            return GateAction.ESCALATE;
        }
        return GateAction.REVISE;
    }
}
