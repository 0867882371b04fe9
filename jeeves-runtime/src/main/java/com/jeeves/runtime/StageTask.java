package com.jeeves.runtime;

import com.jeeves.agent.Agent;
import com.jeeves.agent.AgentResult;
import com.jeeves.envelope.Envelope;
import com.jeeves.protocol.CancellationSignal;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One agent invocation on a worker thread. The timeout clock starts when the task starts running,
 * not when it is queued, so stages waiting for a free worker are not charged for the wait.
 */
final class StageTask implements Runnable {

    private final Agent agent;
    private final Envelope envelope;
    private final CancellationSignal signal;
    private final long timeoutNanos;
    private final BlockingQueue<StageTask> completions;
    private final CountDownLatch done = new CountDownLatch(1);
    private final AtomicBoolean claimed = new AtomicBoolean();

    /** Null until the task starts running. */
    private volatile Clock clock;
    private volatile AgentResult result;
    private volatile Throwable thrown;
    private volatile Future<?> future;

    StageTask(Agent agent, Envelope envelope, CancellationSignal signal, int timeoutSeconds,
              BlockingQueue<StageTask> completions) {
        this.agent = agent;
        this.envelope = envelope;
        this.signal = signal;
        this.timeoutNanos = timeoutSeconds > 0 ? TimeUnit.SECONDS.toNanos(timeoutSeconds) : 0L;
        this.completions = completions;
    }

    @Override
    public void run() {
        if (!claimed.compareAndSet(false, true)) {
            return;
        }
        long startNanos = System.nanoTime();
        clock = new Clock(startNanos, startNanos + timeoutNanos);
        try {
            result = agent.process(envelope, signal);
        } catch (RuntimeException | Error e) {
            thrown = e;
        } finally {
            done.countDown();
            completions.add(this);
        }
    }

    /**
     * Stops a task that has not started yet.
     *
     * @return true when the task will never run
     */
    boolean preventStart() {
        return claimed.compareAndSet(false, true);
    }

    /** Fires the stage's signal and interrupts its worker. */
    void cancel() {
        signal.cancel();
        Future<?> f = future;
        if (f != null) {
            f.cancel(true);
        }
    }

    /** Waits up to {@code millis} for the agent to return. */
    boolean awaitDone(long millis) throws InterruptedException {
        return done.await(millis, TimeUnit.MILLISECONDS);
    }

    boolean isDone() {
        return done.getCount() == 0;
    }

    /** Running and past its deadline. */
    boolean isExpired(long nowNanos) {
        Clock c = clock;
        return c != null && timeoutNanos > 0 && !isDone() && nowNanos - c.deadlineNanos() >= 0;
    }

    /** Nanos until the deadline; {@link Long#MAX_VALUE} when there is none yet. */
    long nanosUntilDeadline(long nowNanos) {
        Clock c = clock;
        if (c == null || timeoutNanos == 0) return Long.MAX_VALUE;
        return Math.max(0L, c.deadlineNanos() - nowNanos);
    }

    long elapsedMs() {
        Clock c = clock;
        return c != null ? (System.nanoTime() - c.startNanos()) / 1_000_000L : 0L;
    }

    void setFuture(Future<?> future) {
        this.future = future;
    }

    String stage() {
        return agent.getName();
    }

    AgentResult result() {
        return result;
    }

    Throwable thrown() {
        return thrown;
    }

    int timeoutSeconds() {
        return (int) TimeUnit.NANOSECONDS.toSeconds(timeoutNanos);
    }

    /** Start time and deadline, published together. */
    private record Clock(long startNanos, long deadlineNanos) {
    }
}
