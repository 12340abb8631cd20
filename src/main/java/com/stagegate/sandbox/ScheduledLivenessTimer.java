package com.stagegate.sandbox;

import com.stagegate.core.collaborator.LivenessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs liveness callbacks on one daemon thread. A failing callback is logged and keeps its schedule.
 */
public class ScheduledLivenessTimer implements LivenessTimer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledLivenessTimer.class);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "liveness-timer");
        t.setDaemon(true);
        return t;
    });

    @Override
    public Registration every(Duration interval, Runnable callback) {
        long millis = interval.toMillis();
        if (millis <= 0) {
            throw new IllegalArgumentException("Liveness interval must be positive: " + interval);
        }
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Liveness callback failed: {}", e.getMessage(), e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
