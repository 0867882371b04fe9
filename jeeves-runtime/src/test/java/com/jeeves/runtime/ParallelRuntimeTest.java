package com.jeeves.runtime;

import com.jeeves.agent.AgentHooks;
import com.jeeves.envelope.Envelope;
import com.jeeves.envelope.InterruptKind;
import com.jeeves.envelope.InterruptResponse;
import com.jeeves.envelope.TerminalReason;
import com.jeeves.pipeline.config.AgentConfig;
import com.jeeves.pipeline.config.JoinStrategy;
import com.jeeves.pipeline.config.PipelineConfig;
import com.jeeves.pipeline.config.RunMode;
import com.jeeves.pipeline.config.Stages;
import com.jeeves.protocol.CancellationSignal;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParallelRuntimeTest {

    private static Envelope envelope() {
        return Envelope.create("compare flight prices", "u1", "s1", null, null, null);
    }

    private static PipelineConfig researchPipeline(boolean llm) {
        AgentConfig.Builder research = AgentConfig.builder("research").stageOrder(1);
        AgentConfig.Builder search = AgentConfig.builder("search").stageOrder(2);
        if (llm) {
            research.hasLlm(true).modelRole("research");
            search.hasLlm(true).modelRole("search");
        }
        return PipelineConfig.builder("research")
                .agent(research.build())
                .agent(search.build())
                .agent(AgentConfig.builder("summarize").stageOrder(3).requires("research", "search").build())
                .agentReviewResumeStage("research")
                .build();
    }

    private static AgentHooks summarizer() {
        return AgentHooks.builder().serviceHandler(env -> Map.of(
                "saw_research", env.hasOutput("research"),
                "saw_search", env.hasOutput("search"))).build();
    }

    @Test
    void runParallel_dispatchesReadyStagesTogetherAndMergesBranches() {
        CyclicBarrier bothRunning = new CyclicBarrier(2);
        RecordingMetrics metrics = new RecordingMetrics();
        PipelineRuntime runtime = PipelineRuntime.builder(researchPipeline(true))
                .llm((model, prompt, options, signal) -> {
                    bothRunning.await(5, TimeUnit.SECONDS);
                    return "{\"found\": true, \"source\": \"" + model + "\"}";
                })
                .hooks("summarize", summarizer())
                .metrics(metrics)
                .build();
        Envelope e = envelope();

        runtime.runParallel(e, null);

        assertFalse(e.isTerminated());
        assertTrue(e.isParallelMode());
        assertEquals(Stages.END, e.getCurrentStage());
        assertEquals(Set.of("research", "search", "summarize"), e.getCompletedStageSet());
        assertEquals(0, e.getActiveStageCount());
        assertEquals(2, e.getLlmCallCount());
        assertEquals(3, e.getAgentHopCount());
        assertEquals(3, e.getProcessingHistory().size());
        assertEquals("search", e.getOutput("search").get("source"));
        assertEquals(true, e.getOutput("summarize").get("saw_research"));
        assertEquals(true, e.getOutput("summarize").get("saw_search"));
        assertEquals(List.of("success"), metrics.pipelineStatuses);
    }

    @Test
    void runParallel_anyJoinStartsWithFirstDependency() {
        CyclicBarrier sameRound = new CyclicBarrier(2);
        PipelineConfig config = PipelineConfig.builder("join")
                .agent(AgentConfig.builder("fetch").stageOrder(1).build())
                .agent(AgentConfig.builder("enrich").stageOrder(2).requires("fetch").build())
                .agent(AgentConfig.builder("respond").stageOrder(3).requires("fetch", "enrich")
                        .joinStrategy(JoinStrategy.ANY).build())
                .build();
        PipelineRuntime runtime = PipelineRuntime.builder(config)
                .hooks("enrich", AgentHooks.builder().serviceHandler(env -> {
                    sameRound.await(5, TimeUnit.SECONDS);
                    return Map.of("enriched", true);
                }).build())
                .hooks("respond", AgentHooks.builder().serviceHandler(env -> {
                    sameRound.await(5, TimeUnit.SECONDS);
                    return Map.of("answered", true);
                }).build())
                .build();
        Envelope e = envelope();

        runtime.runParallel(e, null);

        assertFalse(e.isTerminated());
        assertEquals(Set.of("fetch", "enrich", "respond"), e.getCompletedStageSet());
        assertTrue(e.getErrors().isEmpty());
    }

    @Test
    void runParallel_allJoinWaitsForEveryDependency() {
        List<String> started = new CopyOnWriteArrayList<>();
        PipelineConfig config = PipelineConfig.builder("join")
                .agent(AgentConfig.builder("fetch").stageOrder(1).build())
                .agent(AgentConfig.builder("enrich").stageOrder(2).requires("fetch").build())
                .agent(AgentConfig.builder("respond").stageOrder(3).requires("fetch", "enrich").build())
                .build();
        PipelineRuntime.Builder builder = PipelineRuntime.builder(config);
        for (String stage : List.of("fetch", "enrich", "respond")) {
            builder.hooks(stage, AgentHooks.builder().serviceHandler(env -> {
                started.add(stage);
                return Map.of();
            }).build());
        }

        builder.build().runParallel(envelope(), null);

        assertEquals(List.of("fetch", "enrich", "respond"), started);
    }

    @Test
    void runParallel_failedStageTerminatesAfterRound() {
        AtomicInteger summaries = new AtomicInteger();
        PipelineRuntime runtime = PipelineRuntime.builder(researchPipeline(false))
                .hooks("search", AgentHooks.builder().serviceHandler(env -> {
                    throw new IllegalStateException("boom");
                }).build())
                .hooks("summarize", AgentHooks.builder().serviceHandler(env -> {
                    summaries.incrementAndGet();
                    return Map.of();
                }).build())
                .build();
        Envelope e = envelope();

        runtime.runParallel(e, null);

        assertTrue(e.isTerminated());
        assertEquals(TerminalReason.TOOL_FAILED_FATALLY, e.getTerminalReason().orElseThrow());
        assertEquals("service handler failed: boom", e.getTerminationReason().orElseThrow());
        assertTrue(e.isStageCompleted("research"));
        assertTrue(e.isStageFailed("search"));
        assertEquals(1, e.getErrors().size());
        assertEquals("search", e.getErrors().get(0).get("agent"));
        assertEquals(0, summaries.get());
        assertEquals(Stages.END, e.getCurrentStage());
    }

    @Test
    void runParallel_timedOutStageTerminatesRun() {
        PipelineConfig config = PipelineConfig.builder("slow")
                .agent(AgentConfig.builder("research").stageOrder(1).build())
                .agent(AgentConfig.builder("search").stageOrder(2).hasLlm(true).modelRole("search")
                        .timeoutSeconds(1).build())
                .build();
        PipelineRuntime runtime = PipelineRuntime.builder(config)
                .abortGraceMillis(2_000)
                .llm((model, prompt, options, signal) -> {
                    while (!signal.isCancelled()) {
                        Thread.sleep(10);
                    }
                    throw new IllegalStateException("stopped");
                })
                .build();
        Envelope e = envelope();

        runtime.runParallel(e, null);

        assertTrue(e.isTerminated());
        assertEquals("Stage search aborted: timed_out", e.getTerminationReason().orElseThrow());
        assertTrue(e.isStageCompleted("research"));
        assertTrue(e.isStageFailed("search"));
    }

    @Test
    void runParallel_cancelledSignalStopsBeforeFirstRound() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        RecordingMetrics metrics = new RecordingMetrics();
        PipelineRuntime runtime = PipelineRuntime.builder(researchPipeline(false)).metrics(metrics).build();
        Envelope e = envelope();

        assertThrows(PipelineCancelledException.class,
                () -> runtime.execute(e, RunOptions.builder().mode(RunMode.PARALLEL).signal(signal).build()));

        assertTrue(e.getProcessingHistory().isEmpty());
        assertEquals(Stages.END, e.getCurrentStage());
        assertEquals(List.of("cancelled"), metrics.pipelineStatuses);
    }

    @Test
    void runStreaming_parallelPublishesInCompletionOrder() {
        PipelineRuntime runtime = PipelineRuntime.builder(researchPipeline(false))
                .hooks("summarize", summarizer())
                .build();

        StageOutputStream stream = runtime.runStreaming(envelope(),
                RunOptions.builder().mode(RunMode.PARALLEL).build());

        List<String> stages = new ArrayList<>();
        for (StageOutput out : stream) stages.add(out.stage());
        assertEquals(4, stages.size());
        assertEquals(Set.of("research", "search"), Set.copyOf(stages.subList(0, 2)));
        assertEquals("summarize", stages.get(2));
        assertEquals(StageOutput.END_STAGE, stages.get(3));
    }

    @Test
    void runParallel_branchInterruptPausesRunAndResumeReopensStage() {
        AtomicInteger researchCalls = new AtomicInteger();
        RecordingMetrics metrics = new RecordingMetrics();
        PipelineRuntime runtime = PipelineRuntime.builder(researchPipeline(false))
                .metrics(metrics)
                .hooks("research", AgentHooks.builder().serviceHandler(env -> {
                    if (researchCalls.incrementAndGet() == 1) {
                        env.setInterrupt(InterruptKind.AGENT_REVIEW, "int_review");
                    }
                    return Map.of("found", true);
                }).build())
                .hooks("summarize", summarizer())
                .build();
        Envelope e = envelope();

        runtime.runParallel(e, null);

        assertTrue(e.hasPendingInterrupt());
        assertEquals(InterruptKind.AGENT_REVIEW, e.getInterruptKind().orElseThrow());
        assertEquals(Set.of("research", "search"), e.getCompletedStageSet());
        assertFalse(e.hasOutput("summarize"));

        runtime.resume(e, InterruptResponse.ofDecision("approve"), (String) null);

        assertFalse(e.hasPendingInterrupt());
        assertEquals(2, researchCalls.get());
        assertEquals(Set.of("research", "search", "summarize"), e.getCompletedStageSet());
        assertEquals(Stages.END, e.getCurrentStage());
        assertEquals(List.of("interrupted", "success"), metrics.pipelineStatuses);
    }
}
