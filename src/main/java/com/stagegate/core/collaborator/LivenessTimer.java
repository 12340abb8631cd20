package com.stagegate.core.collaborator;

import java.time.Duration;

/**
 * Periodic callback used to re-check the gate of a running stage.
 */
public interface LivenessTimer {

    Registration every(Duration interval, Runnable callback);

    @FunctionalInterface
    interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
