package com.jeeves.runtime;

import com.jeeves.agent.Agent;
import com.jeeves.agent.AgentHooks;
import com.jeeves.envelope.Envelope;
import com.jeeves.pipeline.config.AgentConfig;
import com.jeeves.protocol.CancellationSignal;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageTaskTest {

    private static final long ONE_SECOND = TimeUnit.SECONDS.toNanos(1);

    private static Agent blockingAgent(CountDownLatch entered, CountDownLatch release) {
        return Agent.builder(AgentConfig.builder("planner").stageOrder(1).build())
                .hooks(AgentHooks.builder().serviceHandler(env -> {
                    entered.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return Map.of("done", true);
                }).build())
                .build();
    }

    @Test
    void queuedTask_hasNoDeadline() {
        StageTask task = new StageTask(blockingAgent(new CountDownLatch(1), new CountDownLatch(0)),
                new Envelope(), new CancellationSignal(), 1, new LinkedBlockingQueue<>());
        long now = System.nanoTime();

        assertFalse(task.isExpired(now + 10 * ONE_SECOND));
        assertEquals(Long.MAX_VALUE, task.nanosUntilDeadline(now));
        assertEquals(0L, task.elapsedMs());
    }

    @Test
    void runningTask_expiresOnlyAfterDeadlineMeasuredFromStart() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        BlockingQueue<StageTask> completions = new LinkedBlockingQueue<>();
        StageTask task = new StageTask(blockingAgent(entered, release), new Envelope(),
                new CancellationSignal(), 1, completions);
        Thread worker = new Thread(task);
        worker.start();
        try {
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            long now = System.nanoTime();

            assertFalse(task.isExpired(now));
            long remaining = task.nanosUntilDeadline(now);
            assertTrue(remaining > 0 && remaining <= ONE_SECOND, "remaining=" + remaining);
            assertTrue(task.isExpired(now + ONE_SECOND));
        } finally {
            release.countDown();
            worker.join(5_000);
        }

        assertSame(task, completions.poll(5, TimeUnit.SECONDS));
        assertTrue(task.isDone());
        assertFalse(task.isExpired(System.nanoTime() + 10 * ONE_SECOND));
        assertEquals(true, task.result().output().get("done"));
    }
}
