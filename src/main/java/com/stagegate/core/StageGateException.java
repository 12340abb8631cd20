package com.stagegate.core;

/**
 * Base class for failures the engine raises outside of gate decisions.
 */
public class StageGateException extends RuntimeException {

    public StageGateException(String message) {
        super(message);
    }

    public StageGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
