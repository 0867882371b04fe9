package com.jeeves.runtime.service;

import com.jeeves.agent.Agent;
import com.jeeves.agent.AgentResult;
import com.jeeves.envelope.Envelope;
import com.jeeves.envelope.FlowInterrupt;
import com.jeeves.envelope.InterruptResponse;
import com.jeeves.envelope.TerminalReason;
import com.jeeves.pipeline.config.Stages;
import com.jeeves.protocol.CancellationSignal;
import com.jeeves.runtime.PipelineCancelledException;
import com.jeeves.runtime.PipelineRuntime;
import com.jeeves.runtime.RunOptions;
import com.jeeves.runtime.StageOutput;
import com.jeeves.runtime.StageOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Request-level operations over one {@link PipelineRuntime}: envelope lifecycle, bounds
 * inspection, event-reporting execution, single-agent execution and resume. A transport adapter
 * maps these calls one to one.
 */
public final class EngineService {

    private static final Logger log = LoggerFactory.getLogger(EngineService.class);

    private static final Set<TerminalReason> BOUND_REASONS = EnumSet.of(
            TerminalReason.MAX_ITERATIONS_EXCEEDED,
            TerminalReason.MAX_LLM_CALLS_EXCEEDED,
            TerminalReason.MAX_AGENT_HOPS_EXCEEDED,
            TerminalReason.MAX_LOOP_EXCEEDED);

    private final PipelineRuntime runtime;

    public EngineService(PipelineRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
    }

    public PipelineRuntime getRuntime() {
        return runtime;
    }

    /**
     * New envelope prepared for the runtime's pipeline. An explicit stage order replaces the
     * pipeline's and the first listed stage becomes current; bound overrides replace the pipeline
     * defaults.
     */
    public Envelope createEnvelope(CreateEnvelopeRequest request) {
        Objects.requireNonNull(request, "request");
        Envelope envelope = Envelope.create(request.getRawInput(), request.getUserId(), request.getSessionId(),
                request.getRequestId(), request.getMetadata(), null);
        runtime.initializeEnvelope(envelope);
        List<String> order = request.getStageOrder();
        if (order != null) {
            envelope.setStageOrder(order);
            envelope.setCurrentStage(order.isEmpty() ? Stages.END : order.get(0));
        }
        if (request.getMaxIterations() != null) envelope.setMaxIterations(request.getMaxIterations());
        if (request.getMaxLlmCalls() != null) envelope.setMaxLlmCalls(request.getMaxLlmCalls());
        if (request.getMaxAgentHops() != null) envelope.setMaxAgentHops(request.getMaxAgentHops());
        log.info("Envelope created | envelopeId={} | requestId={} | firstStage={}",
                envelope.getEnvelopeId(), envelope.getRequestId(), envelope.getCurrentStage());
        return envelope;
    }

    /**
     * Applies {@code patch} over the envelope's state dict and returns the rebuilt envelope. Keys
     * absent from the patch keep their values; the input envelope is not modified.
     *
     * @throws com.jeeves.envelope.EnvelopeStateException when the merged state is malformed
     */
    public Envelope updateEnvelope(Envelope envelope, Map<String, ?> patch) {
        Map<String, Object> state = envelope.toStateDict();
        if (patch != null) {
            state.putAll(patch);
        }
        Envelope updated = Envelope.fromStateDict(state);
        log.debug("Envelope updated | envelopeId={} | keys={}", updated.getEnvelopeId(),
                patch != null ? patch.keySet() : Set.of());
        return updated;
    }

    public Envelope cloneEnvelope(Envelope envelope) {
        return envelope.copy();
    }

    /**
     * Current bound status. Evaluating the bounds records the terminal reason of an exhausted
     * bound on the envelope, as the dispatch gate does.
     */
    public BoundsStatus checkBounds(Envelope envelope) {
        BoundsStatus status = BoundsStatus.of(envelope);
        log.debug("Bounds checked | envelopeId={} | canContinue={} | llmRemaining={} | hopsRemaining={}",
                envelope.getEnvelopeId(), status.canContinue(), status.remainingLlmCalls(),
                status.remainingAgentHops());
        return status;
    }

    /**
     * Runs the pipeline to completion and reports what happened as ordered events: one
     * {@code STAGE_COMPLETED} or {@code STAGE_FAILED} per finished stage in completion order, then
     * {@code INTERRUPT_RAISED} or {@code BOUNDS_EXCEEDED} when the run stopped for that reason,
     * then {@code PIPELINE_COMPLETED} with the run result. A cancelled run is reported the same
     * way, its last event carrying {@code cancelled: true}.
     *
     * @throws RuntimeException any other failure that ended the run
     */
    public List<ExecutionEvent> executePipeline(Envelope envelope, RunOptions options) {
        StageOutputStream outputs = runtime.runStreaming(envelope, options);
        List<ExecutionEvent> events = new ArrayList<>();
        for (StageOutput output : outputs) {
            if (output.isEnd()) break;
            events.add(stageEvent(output));
        }

        boolean cancelled = false;
        Throwable failure = outputs.getFailure().orElse(null);
        if (failure instanceof PipelineCancelledException cancel) {
            cancelled = true;
            log.info("Pipeline cancelled | envelopeId={} | stage={}", envelope.getEnvelopeId(), cancel.getStage());
        } else if (failure instanceof RuntimeException e) {
            throw e;
        } else if (failure instanceof Error e) {
            throw e;
        }

        long now = System.currentTimeMillis();
        if (envelope.hasPendingInterrupt()) {
            events.add(new ExecutionEvent(ExecutionEvent.Type.INTERRUPT_RAISED, envelope.getCurrentStage(), now,
                    interruptPayload(envelope.getInterrupt().orElse(null))));
        } else if (envelope.isTerminated() && envelope.getTerminalReason().map(BOUND_REASONS::contains).orElse(false)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("terminal_reason", envelope.getTerminalReason().get().getValue());
            payload.put("termination_reason", envelope.getTerminationReason().orElse(null));
            events.add(new ExecutionEvent(ExecutionEvent.Type.BOUNDS_EXCEEDED, envelope.getCurrentStage(), now, payload));
        }

        Map<String, Object> result = envelope.toResultDict();
        result.put("cancelled", cancelled);
        events.add(new ExecutionEvent(ExecutionEvent.Type.PIPELINE_COMPLETED, envelope.getCurrentStage(), now, result));
        log.info("Pipeline executed | envelopeId={} | events={} | terminated={} | cancelled={}",
                envelope.getEnvelopeId(), events.size(), envelope.isTerminated(), cancelled);
        return events;
    }

    /**
     * Runs the agent named {@code agentName} once against {@code envelope}, without routing
     * bookkeeping or bound checks.
     *
     * @throws IllegalArgumentException when the pipeline has no such agent
     */
    public AgentResult executeAgent(Envelope envelope, String agentName) {
        Agent agent = runtime.getAgent(agentName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + agentName));
        return agent.process(envelope, CancellationSignal.none());
    }

    /**
     * Answers the pending interrupt and continues the run.
     *
     * @throws com.jeeves.runtime.ResumeException when nothing is pending or no resume stage is configured
     */
    public Envelope resume(Envelope envelope, InterruptResponse response) {
        return runtime.resume(envelope, response, (String) null).envelope();
    }

    private static ExecutionEvent stageEvent(StageOutput output) {
        long now = System.currentTimeMillis();
        if (output.isSuccess()) {
            return new ExecutionEvent(ExecutionEvent.Type.STAGE_COMPLETED, output.stage(), now,
                    output.output() != null ? output.output() : Map.of());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", output.error());
        if (output.output() != null) {
            payload.put("output", output.output());
        }
        return new ExecutionEvent(ExecutionEvent.Type.STAGE_FAILED, output.stage(), now, payload);
    }

    private static Map<String, Object> interruptPayload(FlowInterrupt interrupt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (interrupt == null) return payload;
        payload.put("kind", interrupt.getKind().getValue());
        payload.put("id", interrupt.getId());
        interrupt.getQuestion().ifPresent(q -> payload.put("question", q));
        interrupt.getMessage().ifPresent(m -> payload.put("message", m));
        return payload;
    }
}
