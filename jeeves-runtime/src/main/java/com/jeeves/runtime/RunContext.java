package com.jeeves.runtime;

import com.jeeves.agent.Agent;
import com.jeeves.envelope.Envelope;
import com.jeeves.envelope.TerminalReason;
import com.jeeves.pipeline.config.AgentConfig;
import com.jeeves.pipeline.config.PipelineConfig;
import com.jeeves.protocol.CancellationSignal;
import com.jeeves.protocol.logging.StructuredLogger;
import com.jeeves.protocol.metrics.ExecutionMetrics;

import java.util.Map;

/**
 * Everything one run needs, shared by the sequential and parallel schedulers.
 */
final class RunContext {

    final PipelineConfig config;
    final Map<String, Agent> agents;
    final Envelope envelope;
    final RunOptions options;
    final StageOutputStream stream;
    final StageExecutor executor;
    final Checkpointer checkpointer;
    final ExecutionMetrics metrics;
    final StructuredLogger log;

    RunContext(PipelineConfig config,
               Map<String, Agent> agents,
               Envelope envelope,
               RunOptions options,
               StageOutputStream stream,
               StageExecutor executor,
               Checkpointer checkpointer,
               ExecutionMetrics metrics,
               StructuredLogger log) {
        this.config = config;
        this.agents = agents;
        this.envelope = envelope;
        this.options = options;
        this.stream = stream;
        this.executor = executor;
        this.checkpointer = checkpointer;
        this.metrics = metrics;
        this.log = log;
    }

    CancellationSignal signal() {
        return options.getSignal();
    }

    /**
     * Dispatch gate checked before every stage or round. An exhausted bound terminates the run
     * with the reason {@link Envelope#canContinue()} recorded.
     */
    boolean shouldContinue() {
        if (envelope.canContinue()) {
            return true;
        }
        if (envelope.isTerminated()) {
            return false;
        }
        if (envelope.hasPendingInterrupt()) {
            log.info("pipeline_interrupt", "envelope_id", envelope.getEnvelopeId(),
                    "interrupt_kind", envelope.getInterruptKind().map(k -> k.getValue()).orElse(null));
            return false;
        }
        TerminalReason reason = envelope.getTerminalReason().orElse(null);
        log.warn("pipeline_bounds_exceeded", "envelope_id", envelope.getEnvelopeId(),
                "terminal_reason", reason != null ? reason.getValue() : null,
                "iteration", envelope.getIteration(), "llm_calls", envelope.getLlmCallCount(),
                "agent_hops", envelope.getAgentHopCount());
        envelope.terminate("Bounds exceeded: " + (reason != null ? reason.getValue() : "unknown"), reason);
        return false;
    }

    /** {@code timeout_seconds} of the stage, else the pipeline default; 0 disables the timeout. */
    int timeoutFor(AgentConfig agent) {
        Integer own = agent.getTimeoutSeconds();
        return own != null ? own : config.getDefaultTimeoutSeconds();
    }

    void publish(StageOutput output) {
        if (stream != null) {
            stream.publish(output);
        }
    }

    void checkpoint() {
        checkpointer.save(options.getThreadId(), envelope);
    }
}
