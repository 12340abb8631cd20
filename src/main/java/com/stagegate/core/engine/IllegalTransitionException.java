package com.stagegate.core.engine;

import com.stagegate.core.StageGateException;
import com.stagegate.core.qualitygate.GateAction;

public class IllegalTransitionException extends StageGateException {

    public IllegalTransitionException(PipelineState from, GateAction action) {
        super(String.format("No transition from %s on %s", from, action));
    }
}
