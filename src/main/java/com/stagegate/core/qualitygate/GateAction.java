package com.stagegate.core.qualitygate;

/**
 * The four outcomes of a gate. The ordinal doubles as the CLI exit code.
 */
public enum GateAction {
    PROCEED,
    REVISE,
    ESCALATE,
    STOP;

    public int exitCode() {
        return ordinal();
    }
}
