package com.jeeves.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token threaded from a pipeline run down to every blocking LLM and
 * tool call. Cancelling runs the registered callbacks once, on the cancelling thread.
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private final CancellationSignal parent;

    public CancellationSignal() {
        this(null);
    }

    private CancellationSignal(CancellationSignal parent) {
        this.parent = parent;
    }

    /** A fresh signal that nobody cancels. */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /**
     * Child signal: cancelled when this one is, and cancellable on its own without affecting this
     * one. Used per stage so a timeout aborts only that stage.
     */
    public CancellationSignal child() {
        CancellationSignal child = new CancellationSignal(this);
        Registration r = onCancel(child::cancel);
        child.onCancel(r::remove);
        return child;
    }

    /** Cancels and runs callbacks; later calls do nothing. */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed: {}", e.getMessage(), e);
            }
        }
        callbacks.clear();
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    /**
     * @throws StageAbortedException with cause CANCELLED when cancelled
     */
    public void throwIfCancelled(String stage) {
        if (isCancelled()) {
            throw new StageAbortedException(stage, StageAbortedException.Cause.CANCELLED);
        }
    }

    /**
     * Registers a callback run on cancellation; runs it immediately when already cancelled.
     */
    public Registration onCancel(Runnable callback) {
        if (isCancelled()) {
            callback.run();
            return () -> { };
        }
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /** Handle for removing a cancellation callback. */
    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
