package com.jeeves.runtime;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Ordered, single-consumer sequence of {@link StageOutput} records. Iteration blocks until the
 * next record arrives and stops after the {@link StageOutput#END_STAGE} sentinel, which is
 * returned as the final element. Producers may publish from several threads.
 */
public final class StageOutputStream implements Iterable<StageOutput> {

    private final BlockingQueue<StageOutput> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;
    private volatile Throwable failure;

    void publish(StageOutput output) {
        if (closed) {
            throw new IllegalStateException("stage output stream is closed");
        }
        queue.add(output);
    }

    /** Publishes the end sentinel; later calls are ignored. */
    synchronized void close(boolean terminated) {
        if (closed) return;
        queue.add(StageOutput.end(terminated));
        closed = true;
    }

    void fail(Throwable cause) {
        this.failure = cause;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Exception that ended a background run early (for example a cancellation), if any. */
    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Iterator over the remaining records. The stream is consumable once: records returned by one
     * iterator are not seen by another.
     */
    @Override
    public Iterator<StageOutput> iterator() {
        return new Iterator<>() {
            private StageOutput next;
            private boolean finished;

            @Override
            public boolean hasNext() {
                if (next != null) return true;
                if (finished) return false;
                try {
                    next = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted while waiting for stage output", e);
                }
                return true;
            }

            @Override
            public StageOutput next() {
                if (!hasNext()) throw new NoSuchElementException();
                StageOutput out = next;
                next = null;
                if (out.isEnd()) finished = true;
                return out;
            }
        };
    }
}
