package com.stagegate.core.store;

import com.stagegate.core.StageGateException;

/**
 * Thrown when a record id is added twice; the store never overwrites.
 */
public class DuplicateRecordException extends StageGateException {

    public DuplicateRecordException(String message) {
        super(message);
    }
}
