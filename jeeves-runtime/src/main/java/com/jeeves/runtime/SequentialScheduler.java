package com.jeeves.runtime;

import com.jeeves.agent.Agent;
import com.jeeves.agent.AgentResult;
import com.jeeves.envelope.Envelope;
import com.jeeves.envelope.InterruptKind;
import com.jeeves.envelope.InterruptOption;
import com.jeeves.envelope.ProcessingStatus;
import com.jeeves.envelope.TerminalReason;
import com.jeeves.pipeline.config.EdgeLimit;
import com.jeeves.pipeline.config.Stages;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Follows the routing target of each stage, one stage at a time, until the terminal stage, a
 * bound, an edge limit, an interrupt or a fatal failure stops the run.
 * <ul>
 *   <li>A target earlier in {@code stage_order} is a loop-back and starts a new iteration.</li>
 *   <li>Every other transition {@code from -> to} is counted; once a count exceeds its edge limit
 *       the run is forced to {@code end} with {@link TerminalReason#MAX_LOOP_EXCEEDED}.</li>
 *   <li>Routing to {@code clarification} or {@code confirmation} raises that interrupt.</li>
 * </ul>
 */
final class SequentialScheduler {

    static final String CLARIFICATION_QUESTION_FIELD = "clarification_question";
    static final String CONFIRMATION_MESSAGE_FIELD = "confirmation_message";

    private final RunContext ctx;
    private final Map<String, Integer> edgeTraversals = new HashMap<>();

    SequentialScheduler(RunContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @throws PipelineCancelledException when the run's signal fires
     */
    void run() {
        Envelope env = ctx.envelope;
        while (!Stages.END.equals(env.getCurrentStage()) && !env.isTerminated()) {
            if (ctx.signal().isCancelled()) {
                ctx.log.info("pipeline_cancelled", "envelope_id", env.getEnvelopeId(), "stage", env.getCurrentStage());
                throw new PipelineCancelledException(env, env.getCurrentStage());
            }
            if (!ctx.shouldContinue()) {
                break;
            }
            String stage = env.getCurrentStage();
            if (isInterruptStage(stage)) {
                raiseRoutedInterrupt(stage, null);
                break;
            }
            Agent agent = ctx.agents.get(stage);
            if (agent == null) {
                ctx.log.error("pipeline_unknown_stage", "envelope_id", env.getEnvelopeId(), "stage", stage);
                env.terminate("Unknown stage: " + stage, TerminalReason.TOOL_FAILED_FATALLY);
                break;
            }
            if (!runStage(agent)) {
                break;
            }
        }
    }

    /** @return false when the run must stop after this stage */
    private boolean runStage(Agent agent) {
        Envelope env = ctx.envelope;
        String stage = agent.getName();
        String outputKey = agent.getConfig().getOutputKey();

        env.startStage(stage);
        StageBranch branch = StageBranch.fork(env, stage, outputKey);
        StageExecutor.Round round = ctx.executor.newRound(ctx.signal());
        round.submit(agent, branch.envelope(), ctx.timeoutFor(agent.getConfig()));
        StageOutcome outcome = round.awaitAll(null).get(0);

        if (!outcome.abandoned()) {
            branch.mergeInto(env);
        }
        if (outcome.aborted() != null || outcome.failure() != null) {
            return handleAbortOrFailure(agent, outcome);
        }

        AgentResult result = outcome.result();
        env.setCurrentStage(branch.envelope().getCurrentStage());
        if (result.isSuccess()) {
            env.completeStage(stage);
        } else {
            env.failStage(stage, result.error());
        }

        boolean keepGoing = applyTransition(stage, env.getCurrentStage());
        Map<String, Object> output = env.getOutput(outputKey);
        if (keepGoing && isInterruptStage(env.getCurrentStage())) {
            raiseRoutedInterrupt(env.getCurrentStage(), output);
            keepGoing = false;
        }
        ctx.log.debug("stage_completed", "envelope_id", env.getEnvelopeId(), "stage", stage,
                "next_stage", env.getCurrentStage(), "success", result.isSuccess());
        ctx.publish(new StageOutput(stage, output, result.error()));
        ctx.checkpoint();
        return keepGoing;
    }

    /**
     * Counts the transition, detects loop-backs and enforces the edge limit.
     *
     * @return false when the edge limit forced the run to end
     */
    private boolean applyTransition(String from, String to) {
        Envelope env = ctx.envelope;
        if (to == null || to.equals(from) || Stages.END.equals(to)) {
            return true;
        }
        String edge = EdgeLimit.edgeKey(from, to);
        int traversals = edgeTraversals.merge(edge, 1, Integer::sum);

        int fromIndex = env.stageIndex(from);
        int toIndex = env.stageIndex(to);
        if (fromIndex >= 0 && toIndex >= 0 && toIndex < fromIndex) {
            env.incrementIteration(null);
            ctx.log.debug("iteration_incremented", "envelope_id", env.getEnvelopeId(),
                    "iteration", env.getIteration(), "edge", edge);
        }

        int limit = ctx.config.getEdgeLimit(from, to);
        if (limit > 0 && traversals > limit) {
            ctx.log.warn("edge_limit_exceeded", "envelope_id", env.getEnvelopeId(), "edge", edge,
                    "limit", limit, "traversals", traversals);
            ctx.metrics.recordEdgeLimitExceeded(ctx.config.getName(), edge);
            env.terminate("Edge limit exceeded: " + edge, TerminalReason.MAX_LOOP_EXCEEDED);
            env.setCurrentStage(Stages.END);
            return false;
        }
        return true;
    }

    private boolean handleAbortOrFailure(Agent agent, StageOutcome outcome) {
        Envelope env = ctx.envelope;
        String stage = agent.getName();
        String error = outcome.error();
        env.failStage(stage, error);
        if (outcome.abandoned()) {
            // The abandoned worker's own record stays on its copy.
            env.recordAgentStart(stage, agent.getConfig().getStageOrder());
            env.recordAgentComplete(stage, ProcessingStatus.ERROR, error, 0, outcome.durationMs());
        }
        ctx.publish(new StageOutput(stage, null, error));

        if (outcome.isCancelled()) {
            ctx.log.info("pipeline_cancelled", "envelope_id", env.getEnvelopeId(), "stage", stage);
            ctx.checkpoint();
            throw new PipelineCancelledException(env, stage);
        }
        if (outcome.isTimedOut()) {
            ctx.log.error("pipeline_stage_timeout", "envelope_id", env.getEnvelopeId(), "stage", stage,
                    "duration_ms", outcome.durationMs());
            env.terminate("Stage timed out: " + stage, TerminalReason.TOOL_FAILED_FATALLY);
        } else {
            ctx.log.error("pipeline_agent_error", "envelope_id", env.getEnvelopeId(), "agent", stage,
                    "error", error, outcome.failure());
            env.terminate(error, TerminalReason.TOOL_FAILED_FATALLY);
        }
        ctx.checkpoint();
        return false;
    }

    /**
     * Pauses the run with the interrupt matching a sentinel routing target. The question or
     * message comes from the routing stage's output when it provides one. An interrupt raised by
     * the agent itself is left alone.
     */
    private void raiseRoutedInterrupt(String sentinel, Map<String, Object> output) {
        Envelope env = ctx.envelope;
        if (env.hasPendingInterrupt()) {
            return;
        }
        List<InterruptOption> options = new ArrayList<>();
        InterruptKind kind;
        if (Stages.CLARIFICATION.equals(sentinel)) {
            kind = InterruptKind.CLARIFICATION;
            String question = stringField(output, CLARIFICATION_QUESTION_FIELD);
            if (question != null) options.add(InterruptOption.question(question));
        } else {
            kind = InterruptKind.CONFIRMATION;
            String message = stringField(output, CONFIRMATION_MESSAGE_FIELD);
            if (message != null) options.add(InterruptOption.message(message));
        }
        String id = "int_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        env.setInterrupt(kind, id, options.toArray(new InterruptOption[0]));
        ctx.log.info("pipeline_interrupt_raised", "envelope_id", env.getEnvelopeId(),
                "interrupt_kind", kind.getValue(), "interrupt_id", id);
    }

    private static boolean isInterruptStage(String stage) {
        return Stages.CLARIFICATION.equals(stage) || Stages.CONFIRMATION.equals(stage);
    }

    private static String stringField(Map<String, Object> output, String field) {
        if (output == null) return null;
        return output.get(field) instanceof String s && !s.isBlank() ? s : null;
    }
}
