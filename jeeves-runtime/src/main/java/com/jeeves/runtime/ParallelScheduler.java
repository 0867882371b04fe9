package com.jeeves.runtime;

import com.jeeves.agent.Agent;
import com.jeeves.envelope.Envelope;
import com.jeeves.envelope.ProcessingStatus;
import com.jeeves.envelope.TerminalReason;
import com.jeeves.pipeline.config.Stages;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the pipeline in dependency rounds. Each round dispatches every ready stage at once, each on
 * its own envelope copy, waits for all of them and then merges the copies back in completion
 * order. Routing targets are ignored; readiness alone decides what runs next.
 */
final class ParallelScheduler {

    private final RunContext ctx;

    ParallelScheduler(RunContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @throws PipelineCancelledException when the run's signal fires
     */
    void run() {
        Envelope env = ctx.envelope;
        env.setParallelMode(true);
        try {
            while (!env.isTerminated()) {
                if (ctx.signal().isCancelled()) {
                    ctx.log.info("pipeline_parallel_cancelled", "envelope_id", env.getEnvelopeId(),
                            "completed_stages", env.getCompletedStageCount());
                    throw new PipelineCancelledException(env, null);
                }
                if (!ctx.shouldContinue()) {
                    break;
                }
                List<String> ready = readyStages(env);
                if (ready.isEmpty()) {
                    break;
                }
                ctx.log.debug("parallel_batch", "envelope_id", env.getEnvelopeId(), "ready_stages", ready,
                        "completed", env.getCompletedStageCount());
                runRound(ready);
                ctx.checkpoint();
            }
        } finally {
            env.setCurrentStage(Stages.END);
        }
    }

    private List<String> readyStages(Envelope env) {
        Set<String> failed = env.getFailedStages().keySet();
        List<String> ready = new ArrayList<>();
        for (String stage : ctx.config.getReadyStages(env.getCompletedStageSet())) {
            if (!failed.contains(stage)) ready.add(stage);
        }
        return ready;
    }

    private void runRound(List<String> ready) {
        Envelope env = ctx.envelope;
        Map<String, StageBranch> branches = new LinkedHashMap<>();
        StageExecutor.Round round = ctx.executor.newRound(ctx.signal());
        for (String stage : ready) {
            Agent agent = ctx.agents.get(stage);
            StageBranch branch = StageBranch.fork(env, stage, agent.getConfig().getOutputKey());
            branches.put(stage, branch);
            env.startStage(stage);
            round.submit(agent, branch.envelope(), ctx.timeoutFor(agent.getConfig()));
        }

        List<StageOutcome> outcomes = round.awaitAll(outcome -> {
            StageBranch branch = branches.get(outcome.stage());
            Map<String, Object> output = outcome.abandoned() ? null : branch.output();
            ctx.publish(new StageOutput(outcome.stage(), output, outcome.error()));
        });

        String firstError = null;
        boolean cancelled = false;
        for (StageOutcome outcome : outcomes) {
            String stage = outcome.stage();
            StageBranch branch = branches.get(stage);
            if (outcome.abandoned()) {
                // The worker may still be writing to its copy; record the stage without reading it.
                Agent agent = ctx.agents.get(stage);
                env.recordAgentStart(stage, agent.getConfig().getStageOrder());
                env.recordAgentComplete(stage, ProcessingStatus.ERROR, outcome.error(), 0, outcome.durationMs());
            } else {
                branch.mergeInto(env);
            }
            if (outcome.isSuccess()) {
                env.completeStage(stage);
                ctx.log.debug("stage_completed", "envelope_id", env.getEnvelopeId(), "stage", stage);
            } else {
                env.failStage(stage, outcome.error());
                cancelled |= outcome.isCancelled();
                if (firstError == null) firstError = outcome.error();
                ctx.log.error("pipeline_agent_error", "envelope_id", env.getEnvelopeId(), "agent", stage,
                        "error", outcome.error());
            }
        }

        if (cancelled) {
            ctx.checkpoint();
            throw new PipelineCancelledException(env, null);
        }
        if (firstError != null) {
            env.terminate(firstError, TerminalReason.TOOL_FAILED_FATALLY);
        }
    }
}
