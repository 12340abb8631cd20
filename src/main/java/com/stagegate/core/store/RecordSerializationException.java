package com.stagegate.core.store;

import com.stagegate.core.StageGateException;

public class RecordSerializationException extends StageGateException {

    public RecordSerializationException(String message) {
        super(message);
    }

    public RecordSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
