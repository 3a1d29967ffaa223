package com.iimsoft.timeline.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs only the last of a burst of calls, once the burst has been quiet for the delay.
 *
 * <p>Each call cancels the pending one and schedules itself again. Actions run on a single daemon thread.
 */
public class Debouncer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Debouncer.class);

    private final ScheduledExecutorService scheduler;
    private final long delayMillis;
    private ScheduledFuture<?> pending;

    public Debouncer(long delayMillis) {
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis must be >= 0");
        }
        this.delayMillis = delayMillis;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "timeline-debouncer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Ignored once the debouncer is closed.
     */
    public synchronized void call(Runnable action) {
        if (scheduler.isShutdown()) {
            LOGGER.debug("Debouncer closed, dropping call");
            return;
        }
        if (pending != null) {
            pending.cancel(false);
        }
        pending = scheduler.schedule(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                LOGGER.error("Debounced action failed", e);
            }
        }, delayMillis, TimeUnit.MILLISECONDS);
    }

    /** Drops the pending call, if any. */
    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    public boolean isClosed() {
        return scheduler.isShutdown();
    }

    @Override
    public synchronized void close() {
        cancel();
        scheduler.shutdownNow();
    }
}
