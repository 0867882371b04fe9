package com.jeeves.runtime;

import com.jeeves.agent.Agent;
import com.jeeves.agent.AgentHooks;
import com.jeeves.envelope.Envelope;
import com.jeeves.envelope.InterruptKind;
import com.jeeves.envelope.InterruptResponse;
import com.jeeves.envelope.TerminalReason;
import com.jeeves.pipeline.config.AgentConfig;
import com.jeeves.pipeline.config.PipelineConfig;
import com.jeeves.pipeline.config.RunMode;
import com.jeeves.pipeline.config.Stages;
import com.jeeves.protocol.CancellationSignal;
import com.jeeves.protocol.EventContext;
import com.jeeves.protocol.LlmProvider;
import com.jeeves.protocol.LlmProviderFactory;
import com.jeeves.protocol.PersistenceAdapter;
import com.jeeves.protocol.PromptRegistry;
import com.jeeves.protocol.ToolExecutor;
import com.jeeves.protocol.logging.Slf4jStructuredLogger;
import com.jeeves.protocol.logging.StructuredLogger;
import com.jeeves.protocol.metrics.ExecutionMetrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes one pipeline definition. Construction validates the {@link PipelineConfig} and builds
 * every {@link Agent}; a runtime is then reusable and safe to share across concurrent runs, each
 * of which owns its envelope.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@link RunMode#SEQUENTIAL} follows routing targets (see {@link SequentialScheduler}).</li>
 *   <li>{@link RunMode#PARALLEL} runs dependency rounds (see {@link ParallelScheduler}).</li>
 *   <li>Streaming is either mode with per-stage outputs published to a {@link StageOutputStream}.</li>
 * </ul>
 * Worker threads live only for the duration of a run.
 */
public final class PipelineRuntime {

    static final long DEFAULT_ABORT_GRACE_MILLIS = 5_000L;

    private final PipelineConfig config;
    private final Map<String, Agent> agents;
    private final Checkpointer checkpointer;
    private final ExecutionMetrics metrics;
    private final StructuredLogger log;
    private final long abortGraceMillis;

    private PipelineRuntime(Builder b, Map<String, Agent> agents, StructuredLogger log) {
        this.config = b.config;
        this.agents = Collections.unmodifiableMap(agents);
        this.metrics = b.metrics != null ? b.metrics : ExecutionMetrics.NOOP;
        this.log = log;
        this.checkpointer = new Checkpointer(b.persistence, log);
        this.abortGraceMillis = b.abortGraceMillis;
    }

    public static Builder builder(PipelineConfig config) {
        return new Builder(config);
    }

    public PipelineConfig getConfig() {
        return config;
    }

    /** Agent for a stage. */
    public Optional<Agent> getAgent(String stage) {
        return Optional.ofNullable(agents.get(stage));
    }

    /**
     * Prepares an envelope that has not run yet: stage order and the first stage from the
     * configuration, bounds from the pipeline defaults. An envelope whose current stage is no
     * longer {@link Envelope#INITIAL_STAGE} is left as it is.
     */
    public void initializeEnvelope(Envelope envelope) {
        if (!Envelope.INITIAL_STAGE.equals(envelope.getCurrentStage())) {
            return;
        }
        envelope.setStageOrder(config.getStageOrder());
        envelope.setCurrentStage(config.getStageOrder().isEmpty() ? Stages.END : config.getStageOrder().get(0));
        envelope.setMaxIterations(config.getMaxIterations());
        envelope.setMaxLlmCalls(config.getMaxLlmCalls());
        envelope.setMaxAgentHops(config.getMaxAgentHops());
    }

    /**
     * Runs the pipeline against {@code envelope}, mutating it in place, until the terminal stage,
     * a bound, an interrupt or a fatal stage failure. Bound exhaustion and interrupts are normal
     * outcomes reported on the envelope.
     *
     * @throws PipelineCancelledException when the options' cancellation signal fires
     */
    public RunResult execute(Envelope envelope, RunOptions options) {
        RunOptions opts = options != null ? options : RunOptions.defaults();
        RunMode mode = opts.getMode() != null ? opts.getMode() : config.getDefaultRunMode();
        StageOutputStream stream = opts.isStream() ? new StageOutputStream() : null;
        return executeInto(envelope, opts, mode, stream);
    }

    /** Sequential run with optional checkpointing. */
    public Envelope run(Envelope envelope, String threadId) {
        return execute(envelope, RunOptions.builder().mode(RunMode.SEQUENTIAL).threadId(threadId).build()).envelope();
    }

    /** Parallel run with optional checkpointing. */
    public Envelope runParallel(Envelope envelope, String threadId) {
        return execute(envelope, RunOptions.builder().mode(RunMode.PARALLEL).threadId(threadId).build()).envelope();
    }

    /**
     * Starts a streamed run on a background thread and returns its output stream at once. The
     * envelope is mutated by the background run; read it after the end sentinel arrives. A
     * cancellation or unexpected failure is available from {@link StageOutputStream#getFailure()}.
     */
    public StageOutputStream runStreaming(Envelope envelope, RunOptions options) {
        RunOptions base = options != null ? options : RunOptions.defaults();
        RunMode mode = base.getMode() != null ? base.getMode() : config.getDefaultRunMode();
        RunOptions opts = base.toBuilder().stream(true).build();
        StageOutputStream stream = new StageOutputStream();
        Thread worker = new Thread(() -> {
            try {
                executeInto(envelope, opts, mode, stream);
            } catch (RuntimeException e) {
                log.warn("pipeline_streaming_failed", "envelope_id", envelope.getEnvelopeId(), "error", e.getMessage());
            } catch (Error e) {
                log.error("pipeline_streaming_failed", "envelope_id", envelope.getEnvelopeId(), "error", e.getMessage(), e);
            } finally {
                stream.close(envelope.isTerminated());
            }
        }, "jeeves-stream-" + config.getName());
        worker.setDaemon(true);
        worker.start();
        return stream;
    }

    /**
     * Resolves the pending interrupt with {@code response} and continues the run in the mode it
     * was started in. Clarification, confirmation and agent-review interrupts continue from the
     * pipeline's resume stage for that kind; other kinds continue from the current stage. A
     * denied confirmation terminates the run instead.
     *
     * @throws ResumeException when nothing is pending or no resume stage is configured
     */
    public RunResult resume(Envelope envelope, InterruptResponse response, RunOptions options) {
        if (!envelope.hasPendingInterrupt() || envelope.getInterrupt().isEmpty()) {
            throw new ResumeException(ResumeException.Reason.NO_PENDING_INTERRUPT, null,
                    "No pending interrupt to resume for envelope " + envelope.getEnvelopeId());
        }
        InterruptKind kind = envelope.getInterruptKind().orElseThrow();
        RunOptions base = options != null ? options : RunOptions.defaults();
        InterruptResponse answer = response != null ? response : InterruptResponse.ofText(null);

        if (kind == InterruptKind.CONFIRMATION && !answer.isApproved()) {
            envelope.resolveInterrupt(answer);
            envelope.terminate("User denied confirmation", TerminalReason.USER_CANCELLED);
            log.info("pipeline_confirmation_denied", "envelope_id", envelope.getEnvelopeId());
            checkpointer.save(base.getThreadId(), envelope);
            return new RunResult(envelope, closedStream(base, envelope));
        }

        String resumeStage = envelope.getCurrentStage();
        if (hasResumeSetting(kind)) {
            resumeStage = config.getResumeStage(kind.getValue()).orElseThrow(() -> new ResumeException(
                    ResumeException.Reason.RESUME_STAGE_NOT_CONFIGURED, kind.getValue(),
                    "Pipeline " + config.getName() + " has no resume stage for interrupt kind " + kind.getValue()));
        }

        envelope.resolveInterrupt(answer);
        envelope.setCurrentStage(resumeStage);
        RunMode mode = envelope.isParallelMode() ? RunMode.PARALLEL : RunMode.SEQUENTIAL;
        if (mode == RunMode.PARALLEL && agents.containsKey(resumeStage)) {
            // Re-open the stage so the next round dispatches it again.
            envelope.startStage(resumeStage);
        }
        log.info("pipeline_resumed", "envelope_id", envelope.getEnvelopeId(), "interrupt_kind", kind.getValue(),
                "resume_stage", resumeStage, "mode", mode.getValue());

        RunOptions opts = base.toBuilder().mode(mode).build();
        return executeInto(envelope, opts, mode, opts.isStream() ? new StageOutputStream() : null);
    }

    public RunResult resume(Envelope envelope, InterruptResponse response, String threadId) {
        return resume(envelope, response, RunOptions.builder().threadId(threadId).build());
    }

    /** Persisted state dict for {@code threadId}; empty when nothing is stored or persistence is off. */
    public Optional<Map<String, Object>> getState(String threadId) {
        return checkpointer.load(threadId);
    }

    /** Envelope rebuilt from the persisted state of {@code threadId}. */
    public Optional<Envelope> loadEnvelope(String threadId) {
        return getState(threadId).map(Envelope::fromStateDict);
    }

    private static boolean hasResumeSetting(InterruptKind kind) {
        return kind == InterruptKind.CLARIFICATION
                || kind == InterruptKind.CONFIRMATION
                || kind == InterruptKind.AGENT_REVIEW;
    }

    private static StageOutputStream closedStream(RunOptions options, Envelope envelope) {
        if (!options.isStream()) return null;
        StageOutputStream stream = new StageOutputStream();
        stream.close(envelope.isTerminated());
        return stream;
    }

    private RunResult executeInto(Envelope envelope, RunOptions opts, RunMode mode, StageOutputStream stream) {
        initializeEnvelope(envelope);
        boolean parallel = mode == RunMode.PARALLEL;
        if (parallel) {
            envelope.setParallelMode(true);
        }
        long start = System.nanoTime();
        log.info(parallel ? "pipeline_parallel_started" : "pipeline_started",
                "envelope_id", envelope.getEnvelopeId(), "request_id", envelope.getRequestId(),
                "mode", mode.getValue(), "stream", stream != null, "stage_order", envelope.getStageOrder());

        int workers = parallel ? config.getMaxParallelStages() : 1;
        ExecutorService pool = Executors.newFixedThreadPool(workers, stageThreads(config.getName()));
        RunContext ctx = new RunContext(config, agents, envelope, opts, stream,
                new StageExecutor(pool, abortGraceMillis, log), checkpointer, metrics, log);
        String status = "error";
        try {
            if (parallel) {
                new ParallelScheduler(ctx).run();
            } else {
                new SequentialScheduler(ctx).run();
            }
            status = envelope.hasPendingInterrupt() ? "interrupted" : envelope.isTerminated() ? "terminated" : "success";
            ctx.checkpoint();
            return new RunResult(envelope, stream);
        } catch (PipelineCancelledException e) {
            status = "cancelled";
            failStream(stream, e);
            throw e;
        } catch (RuntimeException | Error e) {
            failStream(stream, e);
            throw e;
        } finally {
            pool.shutdownNow();
            if (stream != null) {
                stream.close(envelope.isTerminated());
            }
            long durationMs = (System.nanoTime() - start) / 1_000_000L;
            metrics.recordPipelineExecution(config.getName(), status, durationMs);
            log.info(parallel ? "pipeline_parallel_completed" : "pipeline_completed",
                    "envelope_id", envelope.getEnvelopeId(), "final_stage", envelope.getCurrentStage(),
                    "terminated", envelope.isTerminated(), "status", status, "duration_ms", durationMs);
        }
    }

    private static void failStream(StageOutputStream stream, Throwable e) {
        if (stream != null) {
            stream.fail(e);
        }
    }

    private static ThreadFactory stageThreads(String pipeline) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "jeeves-" + pipeline + "-stage-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Collaborators for the runtime's agents. {@link #build()} fails when the pipeline does not
     * validate or an agent cannot be constructed.
     */
    public static final class Builder {
        private final PipelineConfig config;
        private LlmProviderFactory llmFactory;
        private ToolExecutor tools;
        private PromptRegistry promptRegistry;
        private final Map<String, AgentHooks> hooks = new LinkedHashMap<>();
        private boolean useMock;
        private EventContext events;
        private ExecutionMetrics metrics;
        private StructuredLogger logger;
        private PersistenceAdapter persistence;
        private long abortGraceMillis = DEFAULT_ABORT_GRACE_MILLIS;

        private Builder(PipelineConfig config) {
            this.config = config;
        }

        public Builder llmFactory(LlmProviderFactory llmFactory) {
            this.llmFactory = llmFactory;
            return this;
        }

        /** Serves every model role with one provider. */
        public Builder llm(LlmProvider provider) {
            this.llmFactory = provider != null ? LlmProviderFactory.of(provider) : null;
            return this;
        }

        public Builder tools(ToolExecutor tools) {
            this.tools = tools;
            return this;
        }

        public Builder promptRegistry(PromptRegistry promptRegistry) {
            this.promptRegistry = promptRegistry;
            return this;
        }

        public Builder hooks(String agentName, AgentHooks agentHooks) {
            this.hooks.put(agentName, agentHooks);
            return this;
        }

        public Builder useMock(boolean useMock) {
            this.useMock = useMock;
            return this;
        }

        public Builder events(EventContext events) {
            this.events = events;
            return this;
        }

        public Builder metrics(ExecutionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder logger(StructuredLogger logger) {
            this.logger = logger;
            return this;
        }

        public Builder persistence(PersistenceAdapter persistence) {
            this.persistence = persistence;
            return this;
        }

        /** How long a cancelled or timed-out stage gets to return before it is abandoned. */
        public Builder abortGraceMillis(long abortGraceMillis) {
            if (abortGraceMillis < 0) throw new IllegalArgumentException("abortGraceMillis must be >= 0");
            this.abortGraceMillis = abortGraceMillis;
            return this;
        }

        /**
         * @throws com.jeeves.pipeline.config.PipelineConfigException when the pipeline is invalid
         * @throws com.jeeves.agent.AgentConstructionException when an agent lacks a required collaborator
         */
        public PipelineRuntime build() {
            if (config == null) {
                throw new IllegalArgumentException("Pipeline config is required");
            }
            config.validate();
            StructuredLogger base = logger != null ? logger : Slf4jStructuredLogger.forClass(PipelineRuntime.class);
            StructuredLogger log = base.bind("pipeline", config.getName());

            Map<String, Agent> built = new LinkedHashMap<>();
            for (AgentConfig agentConfig : config.getAgents()) {
                LlmProvider llm = null;
                if (agentConfig.hasLlm() && agentConfig.getModelRole() != null && llmFactory != null) {
                    llm = llmFactory.forRole(agentConfig.getModelRole());
                }
                Agent agent = Agent.builder(agentConfig)
                        .llm(llm)
                        .tools(agentConfig.hasTools() ? tools : null)
                        .promptRegistry(promptRegistry)
                        .hooks(hooks.get(agentConfig.getName()))
                        .useMock(useMock)
                        .events(events)
                        .metrics(metrics)
                        .logger(base)
                        .build();
                built.put(agentConfig.getName(), agent);
            }
            log.info("runtime_agents_built", "agent_count", built.size(), "agents", config.getStageOrder());
            return new PipelineRuntime(this, built, log);
        }
    }
}
