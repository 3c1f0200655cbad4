package com.llmcommittee.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cancellation signal shared by every backend call of one request. Callbacks registered after
 * cancellation run immediately.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final Object monitor = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    public boolean isCancelled() {
        return cancelled;
    }

    public void onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback is required");
        synchronized (monitor) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runQuietly(callback);
    }

    public void cancel() {
        List<Runnable> pending;
        synchronized (monitor) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            pending = List.copyOf(callbacks);
            callbacks.clear();
        }
        pending.forEach(CancellationToken::runQuietly);
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException ex) {
            log.warn("Cancellation callback failed", ex);
        }
    }
}
