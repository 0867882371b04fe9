package com.jeeves.runtime;

import com.jeeves.agent.Agent;
import com.jeeves.envelope.Envelope;
import com.jeeves.protocol.CancellationSignal;
import com.jeeves.protocol.StageAbortedException;
import com.jeeves.protocol.logging.StructuredLogger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs agents on the run's worker pool with per-stage timeouts and cancellation. A run creates
 * one {@link Round} per dispatch: a single stage in sequential mode, every ready stage in
 * parallel mode. {@link Round#awaitAll} is the barrier.
 */
final class StageExecutor {

    /** Longest pause between cancellation checks while waiting on a round. */
    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final ExecutorService pool;
    private final long abortGraceMillis;
    private final StructuredLogger log;

    StageExecutor(ExecutorService pool, long abortGraceMillis, StructuredLogger log) {
        this.pool = pool;
        this.abortGraceMillis = abortGraceMillis;
        this.log = log;
    }

    Round newRound(CancellationSignal runSignal) {
        return new Round(runSignal);
    }

    final class Round {

        private final CancellationSignal runSignal;
        private final BlockingQueue<StageTask> completions = new LinkedBlockingQueue<>();
        private final List<StageTask> tasks = new ArrayList<>();

        private Round(CancellationSignal runSignal) {
            this.runSignal = runSignal;
        }

        /** Queues {@code agent} against {@code envelope}; a timeout of 0 disables the deadline. */
        void submit(Agent agent, Envelope envelope, int timeoutSeconds) {
            StageTask task = new StageTask(agent, envelope, runSignal.child(), timeoutSeconds, completions);
            tasks.add(task);
            try {
                task.setFuture(pool.submit(task));
            } catch (RejectedExecutionException e) {
                // Pool already shut down: run on the caller so the round still settles.
                log.warn("stage_pool_rejected", "stage", agent.getName(), "error", e.getMessage());
                task.run();
            }
        }

        /**
         * Waits until every stage has settled: returned, timed out or been cancelled. Outcomes are
         * handed to {@code onSettled} and returned in settle order.
         */
        List<StageOutcome> awaitAll(Consumer<StageOutcome> onSettled) {
            Set<StageTask> pending = new LinkedHashSet<>(tasks);
            List<StageOutcome> outcomes = new ArrayList<>(tasks.size());
            while (!pending.isEmpty()) {
                if (runSignal.isCancelled()) {
                    abortAll(pending, StageAbortedException.Cause.CANCELLED, outcomes, onSettled);
                    break;
                }
                long now = System.nanoTime();
                long wait = POLL_NANOS;
                for (StageTask t : pending) {
                    wait = Math.min(wait, t.nanosUntilDeadline(now));
                }
                StageTask finished;
                try {
                    finished = completions.poll(wait, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    abortAll(pending, StageAbortedException.Cause.CANCELLED, outcomes, onSettled);
                    break;
                }
                if (finished != null && pending.remove(finished)) {
                    settle(outcomeOf(finished), outcomes, onSettled);
                }
                long after = System.nanoTime();
                List<StageTask> expired = new ArrayList<>();
                for (StageTask t : pending) {
                    if (t.isExpired(after)) expired.add(t);
                }
                for (StageTask t : expired) {
                    pending.remove(t);
                    log.warn("stage_timeout", "stage", t.stage(), "timeout_seconds", t.timeoutSeconds());
                    settle(abort(t, StageAbortedException.Cause.TIMED_OUT), outcomes, onSettled);
                }
            }
            return outcomes;
        }

        private void abortAll(Set<StageTask> pending, StageAbortedException.Cause cause,
                              List<StageOutcome> outcomes, Consumer<StageOutcome> onSettled) {
            for (StageTask t : pending) {
                t.cancel();
            }
            for (StageTask t : pending) {
                settle(abort(t, cause), outcomes, onSettled);
            }
            pending.clear();
        }

        private void settle(StageOutcome outcome, List<StageOutcome> outcomes, Consumer<StageOutcome> onSettled) {
            outcomes.add(outcome);
            if (onSettled != null) {
                onSettled.accept(outcome);
            }
        }
    }

    /**
     * Cancels a stage and gives the agent the grace period to finish its bookkeeping. A timed-out
     * stage reports {@code cause} whatever the agent did in the meantime; a cancelled stage whose
     * agent had already produced a result keeps that result.
     */
    private StageOutcome abort(StageTask task, StageAbortedException.Cause cause) {
        StageAbortedException aborted = new StageAbortedException(task.stage(), cause);
        if (task.preventStart()) {
            return StageOutcome.aborted(task.stage(), aborted, false, 0L);
        }
        task.cancel();
        boolean finished;
        try {
            finished = task.awaitDone(abortGraceMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = task.isDone();
        }
        if (!finished) {
            log.warn("stage_abandoned", "stage", task.stage(), "grace_ms", abortGraceMillis);
        } else if (cause == StageAbortedException.Cause.CANCELLED && task.result() != null) {
            return outcomeOf(task);
        }
        return StageOutcome.aborted(task.stage(), aborted, !finished, task.elapsedMs());
    }

    private static StageOutcome outcomeOf(StageTask task) {
        Throwable thrown = task.thrown();
        if (thrown instanceof StageAbortedException aborted) {
            return StageOutcome.aborted(task.stage(), aborted, false, task.elapsedMs());
        }
        if (thrown != null) {
            return StageOutcome.failed(task.stage(), thrown, task.elapsedMs());
        }
        if (task.result() == null) {
            return StageOutcome.failed(task.stage(),
                    new IllegalStateException("Stage " + task.stage() + " returned no result"), task.elapsedMs());
        }
        return StageOutcome.completed(task.stage(), task.result(), task.elapsedMs());
    }
}
