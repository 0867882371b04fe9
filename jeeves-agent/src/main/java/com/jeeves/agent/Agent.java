package com.jeeves.agent;

import com.jeeves.envelope.Envelope;
import com.jeeves.envelope.ProcessingStatus;
import com.jeeves.pipeline.config.AgentConfig;
import com.jeeves.pipeline.config.PipelineConfigException;
import com.jeeves.protocol.CancellationSignal;
import com.jeeves.protocol.EventContext;
import com.jeeves.protocol.LlmProvider;
import com.jeeves.protocol.PromptRegistry;
import com.jeeves.protocol.StageAbortedException;
import com.jeeves.protocol.ToolExecutor;
import com.jeeves.protocol.ToolNotFoundException;
import com.jeeves.protocol.logging.Slf4jStructuredLogger;
import com.jeeves.protocol.logging.StructuredLogger;
import com.jeeves.protocol.metrics.ExecutionMetrics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Processing unit driven entirely by its {@link AgentConfig}. One call to {@link #process} runs
 * the fixed lifecycle: record start, pre-process hook, main processing (mock, LLM, tools or
 * service, first applicable), required-field validation, store output, post-process hook,
 * routing, record completion.
 * <p>
 * Thread-safe as long as its collaborators are: an agent holds no per-call state, so parallel
 * rounds may run several agents at once on separate envelope copies.
 */
public final class Agent {

    static final int DEFAULT_NUM_PREDICT = 2000;
    static final int DEFAULT_NUM_CTX = 16384;
    static final String DEFAULT_MODEL = "default";

    private final AgentConfig config;
    private final LlmProvider llm;
    private final ToolExecutor tools;
    private final PromptRegistry promptRegistry;
    private final AgentHooks hooks;
    private final boolean useMock;
    private final EventContext events;
    private final ExecutionMetrics metrics;
    private final StructuredLogger log;
    private final ToolAccessPolicy toolAccess;
    private final LenientJsonParser jsonParser = new LenientJsonParser();

    private Agent(Builder b) {
        this.config = b.config;
        this.llm = b.llm;
        this.tools = b.tools;
        this.promptRegistry = b.promptRegistry;
        this.hooks = b.hooks != null ? b.hooks : AgentHooks.NONE;
        this.useMock = b.useMock;
        this.events = b.events != null ? b.events : EventContext.NOOP;
        this.metrics = b.metrics != null ? b.metrics : ExecutionMetrics.NOOP;
        StructuredLogger base = b.logger != null ? b.logger : Slf4jStructuredLogger.forClass(Agent.class);
        this.log = base.bind("agent", config.getName());
        this.toolAccess = new ToolAccessPolicy(config);
    }

    public static Builder builder(AgentConfig config) {
        return new Builder(config);
    }

    public String getName() {
        return config.getName();
    }

    public AgentConfig getConfig() {
        return config;
    }

    /**
     * Runs one invocation against {@code envelope}, mutating it in place.
     *
     * @return outcome; a recoverable failure is reported here, not thrown
     * @throws StageAbortedException when {@code signal} fires or the calling thread is interrupted;
     *                               the processing record is finalized as an error first
     */
    public AgentResult process(Envelope envelope, CancellationSignal signal) {
        CancellationSignal cancel = signal != null ? signal : CancellationSignal.none();
        String name = config.getName();
        long start = System.nanoTime();
        int[] llmCalls = {0};

        envelope.recordAgentStart(name, config.getStageOrder());
        emitStarted();
        log.info("agent_started", "stage_order", config.getStageOrder());

        try {
            cancel.throwIfCancelled(name);
            if (hooks.getPreProcess() != null) {
                runHook(() -> hooks.getPreProcess().beforeProcess(envelope), "pre-process");
            }

            Map<String, Object> output = processWithRetries(envelope, cancel, llmCalls);
            validateOutput(output);
            envelope.setOutput(config.getOutputKey(), output);

            if (hooks.getPostProcess() != null) {
                runHook(() -> hooks.getPostProcess().afterProcess(envelope, output), "post-process");
            }

            String next = evaluateRouting(output);
            envelope.setCurrentStage(next);

            long durationMs = elapsedMs(start);
            envelope.recordAgentComplete(name, ProcessingStatus.SUCCESS, null, llmCalls[0], durationMs);
            log.info("agent_completed", "duration_ms", durationMs, "next_stage", next, "llm_calls", llmCalls[0]);
            recordMetrics("success", durationMs, llmCalls[0]);
            emitCompleted("success", durationMs, null);
            return AgentResult.success(name, next, output, llmCalls[0], durationMs);
        } catch (AgentProcessingException e) {
            return handleError(envelope, e, llmCalls[0], elapsedMs(start));
        } catch (StageAbortedException e) {
            long durationMs = elapsedMs(start);
            envelope.recordAgentComplete(name, ProcessingStatus.ERROR, e.getMessage(), llmCalls[0], durationMs);
            log.warn("agent_aborted", "duration_ms", durationMs, "cause", e.getAbortCause());
            recordMetrics("error", durationMs, llmCalls[0]);
            emitCompleted("error", durationMs, e.getMessage());
            throw e;
        }
    }

    private Map<String, Object> processWithRetries(Envelope envelope, CancellationSignal signal, int[] llmCalls) {
        int attempts = 1 + config.getMaxRetries();
        for (int attempt = 1; ; attempt++) {
            signal.throwIfCancelled(config.getName());
            try {
                return processOnce(envelope, signal, llmCalls);
            } catch (AgentProcessingException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.warn("agent_retry", "attempt", attempt, "max_attempts", attempts,
                        "error_type", e.getErrorType(), "error", e.getMessage());
            }
        }
    }

    private Map<String, Object> processOnce(Envelope envelope, CancellationSignal signal, int[] llmCalls) {
        OutputHandler mock = hooks.getMockHandler();
        if (useMock && mock != null) {
            return produce(mock, envelope, "mock handler");
        }
        if (config.hasLlm()) {
            llmCalls[0]++;
            return llmProcess(envelope, signal);
        }
        if (config.hasTools()) {
            return toolProcess(envelope, signal);
        }
        OutputHandler service = hooks.getServiceHandler();
        return service != null ? produce(service, envelope, "service handler") : new LinkedHashMap<>();
    }

    private Map<String, Object> llmProcess(Envelope envelope, CancellationSignal signal) {
        String prompt = buildPrompt(envelope);
        Map<String, Object> options = buildLlmOptions();
        String model = config.getModelRole() != null ? config.getModelRole() : DEFAULT_MODEL;

        String response;
        try {
            response = llm.generate(model, prompt, options, signal);
        } catch (Exception e) {
            throw abortedOr(e, signal, () -> new AgentProcessingException(config.getName(),
                    AgentProcessingException.LLM_ERROR, "llm generation failed: " + e.getMessage(), e));
        }
        log.debug("agent_llm_response", "response_length", response != null ? response.length() : 0,
                "response_preview", truncate(response, 200));

        return jsonParser.parse(response).orElseThrow(() -> new AgentProcessingException(config.getName(),
                AgentProcessingException.PARSE_ERROR, "json parsing failed: no valid JSON object found in response"));
    }

    Map<String, Object> buildLlmOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("num_predict", config.getMaxTokens() != null ? config.getMaxTokens() : DEFAULT_NUM_PREDICT);
        options.put("num_ctx", DEFAULT_NUM_CTX);
        if (config.getTemperature() != null) {
            options.put("temperature", config.getTemperature());
        }
        if (config.getGeneration() != null) {
            options.putAll(config.getGeneration().toOptions());
        }
        return options;
    }

    String buildPrompt(Envelope envelope) {
        if (promptRegistry != null && config.getPromptKey() != null) {
            try {
                Optional<String> prompt = promptRegistry.get(config.getPromptKey(), promptContext(envelope));
                if (prompt.isPresent()) {
                    return prompt.get();
                }
                log.warn("agent_prompt_missing", "key", config.getPromptKey());
            } catch (RuntimeException e) {
                log.warn("agent_prompt_registry_error", "key", config.getPromptKey(), "error", e.getMessage());
            }
        }
        return "Process this request: " + envelope.getRawInput();
    }

    private static Map<String, Object> promptContext(Envelope envelope) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("raw_input", envelope.getRawInput());
        context.put("user_id", envelope.getUserId());
        context.put("session_id", envelope.getSessionId());
        context.putAll(envelope.getOutputs());
        return context;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toolProcess(Envelope envelope, CancellationSignal signal) {
        Map<String, Object> plan = envelope.getOutput(Envelope.PLAN_OUTPUT_KEY);
        List<Map<String, Object>> results = new ArrayList<>();
        long totalTimeMs = 0;

        Object stepsValue = plan != null ? plan.get("steps") : null;
        List<?> steps = stepsValue instanceof List<?> l ? l : List.of();
        for (int i = 0; i < steps.size(); i++) {
            if (!(steps.get(i) instanceof Map<?, ?> rawStep)) {
                continue;
            }
            signal.throwIfCancelled(config.getName());
            Map<String, Object> step = (Map<String, Object>) rawStep;
            String toolName = step.get("tool") instanceof String s ? s : null;
            Map<String, Object> params = step.get("parameters") instanceof Map<?, ?> p
                    ? new LinkedHashMap<>((Map<String, Object>) p)
                    : new LinkedHashMap<>();
            String stepId = step.get("step_id") instanceof String s ? s : "step_" + i;

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("step_id", stepId);
            entry.put("tool", toolName);
            if (toolName == null || !toolAccess.canAccess(toolName)) {
                entry.put("status", "error");
                entry.put("error", "Tool access denied: " + toolName);
                results.add(entry);
                continue;
            }

            entry.put("parameters", params);
            long stepStart = System.nanoTime();
            try {
                Map<String, Object> result = tools.execute(toolName, params, signal);
                long execMs = elapsedMs(stepStart);
                totalTimeMs += execMs;
                entry.put("status", "success");
                entry.put("data", result != null && result.containsKey("data") ? result.get("data") : result);
                entry.put("execution_time_ms", execMs);
            } catch (Exception e) {
                long execMs = elapsedMs(stepStart);
                totalTimeMs += execMs;
                RuntimeException aborted = abortedOr(e, signal, () -> null);
                if (aborted != null) {
                    throw aborted;
                }
                entry.put("status", "error");
                entry.put("error", Map.of(
                        "message", String.valueOf(e.getMessage()),
                        "type", e instanceof ToolNotFoundException ? "ToolNotFound" : "ExecutionError"));
                entry.put("execution_time_ms", execMs);
                log.warn("agent_tool_failed", "step_id", stepId, "tool", toolName, "error", e.getMessage());
            }
            results.add(entry);
        }

        boolean allSucceeded = results.stream().allMatch(r -> "success".equals(r.get("status")));
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("results", results);
        output.put("total_time_ms", totalTimeMs);
        output.put("all_succeeded", allSucceeded);
        return output;
    }

    private void validateOutput(Map<String, Object> output) {
        for (String field : config.getRequiredOutputFields()) {
            if (!output.containsKey(field)) {
                throw new AgentProcessingException(config.getName(), AgentProcessingException.VALIDATION_ERROR,
                        "agent '" + config.getName() + "' output missing required field: " + field);
            }
        }
    }

    private String evaluateRouting(Map<String, Object> output) {
        String next = config.route(output);
        log.debug("agent_routing", "next_stage", next);
        return next;
    }

    /**
     * Records the failure, then routes to {@code error_next} when configured or stores the error
     * output and applies normal routing to it.
     */
    private AgentResult handleError(Envelope envelope, AgentProcessingException e, int llmCalls, long durationMs) {
        String name = config.getName();
        envelope.addError(name, e.getMessage(), e.getErrorType());
        envelope.recordAgentComplete(name, ProcessingStatus.ERROR, e.getMessage(), llmCalls, durationMs);

        Map<String, Object> errorOutput = null;
        String next;
        if (config.getErrorNext() != null) {
            next = config.getErrorNext();
        } else {
            errorOutput = new LinkedHashMap<>();
            errorOutput.put("error", true);
            errorOutput.put("error_message", e.getMessage());
            errorOutput.put("error_type", e.getErrorType());
            envelope.setOutput(config.getOutputKey(), errorOutput);
            next = config.route(errorOutput);
        }
        envelope.setCurrentStage(next);

        log.error("agent_failed", "error_type", e.getErrorType(), "error", e.getMessage(),
                "duration_ms", durationMs, "next_stage", next);
        recordMetrics("error", durationMs, llmCalls);
        emitCompleted("error", durationMs, e.getMessage());
        return AgentResult.failure(name, next, errorOutput, e.getMessage(), e.getErrorType(), llmCalls, durationMs);
    }

    private Map<String, Object> produce(OutputHandler handler, Envelope envelope, String what) {
        Map<String, Object> output;
        try {
            output = handler.produce(envelope);
        } catch (Exception e) {
            throw abortedOr(e, CancellationSignal.none(), () -> new AgentProcessingException(config.getName(),
                    AgentProcessingException.PROCESSING_ERROR, what + " failed: " + e.getMessage(), e));
        }
        return output != null ? new LinkedHashMap<>(output) : new LinkedHashMap<>();
    }

    private void runHook(HookCall call, String what) {
        try {
            call.run();
        } catch (Exception e) {
            throw abortedOr(e, CancellationSignal.none(), () -> new AgentProcessingException(config.getName(),
                    AgentProcessingException.HOOK_ERROR, what + " hook failed: " + e.getMessage(), e));
        }
    }

    /**
     * Maps a collaborator failure: aborts (explicit, interrupt or fired signal) become
     * {@link StageAbortedException}; anything else is whatever {@code otherwise} supplies.
     */
    private RuntimeException abortedOr(Exception e, CancellationSignal signal,
                                       Supplier<RuntimeException> otherwise) {
        if (e instanceof StageAbortedException aborted) {
            return aborted;
        }
        if (e instanceof AgentProcessingException processing) {
            return processing;
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new StageAbortedException(config.getName(), StageAbortedException.Cause.CANCELLED, e);
        }
        if (signal.isCancelled()) {
            return new StageAbortedException(config.getName(), StageAbortedException.Cause.CANCELLED, e);
        }
        return otherwise.get();
    }

    private void recordMetrics(String status, long durationMs, int llmCalls) {
        metrics.recordAgentExecution(config.getName(), status, durationMs);
        metrics.recordLlmCalls(config.getName(), llmCalls);
    }

    private void emitStarted() {
        try {
            events.agentStarted(config.getName());
        } catch (RuntimeException e) {
            log.warn("agent_event_failed", "event", "agent_started", "error", e.getMessage());
        }
    }

    private void emitCompleted(String status, long durationMs, String error) {
        try {
            events.agentCompleted(config.getName(), status, durationMs, error);
        } catch (RuntimeException e) {
            log.warn("agent_event_failed", "event", "agent_completed", "error", e.getMessage());
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static String truncate(String s, int maxLen) {
        if (s == null || s.length() <= maxLen) return s;
        return s.substring(0, maxLen) + "...";
    }

    @FunctionalInterface
    private interface HookCall {
        void run() throws Exception;
    }

    /**
     * Assembles an agent and checks it can run: the configuration must validate, an LLM agent
     * needs a provider and a tool agent needs an executor.
     */
    public static final class Builder {
        private final AgentConfig config;
        private LlmProvider llm;
        private ToolExecutor tools;
        private PromptRegistry promptRegistry;
        private AgentHooks hooks;
        private boolean useMock;
        private EventContext events;
        private ExecutionMetrics metrics;
        private StructuredLogger logger;

        private Builder(AgentConfig config) {
            this.config = config;
        }

        public Builder llm(LlmProvider llm) {
            this.llm = llm;
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

        public Builder hooks(AgentHooks hooks) {
            this.hooks = hooks;
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

        /**
         * @throws AgentConstructionException when the configuration is invalid or a capability lacks its collaborator
         */
        public Agent build() {
            if (config == null) {
                throw new AgentConstructionException(null, "Agent config is required");
            }
            try {
                config.validate();
            } catch (PipelineConfigException e) {
                throw new AgentConstructionException(config.getName(), e.getMessage(), e);
            }
            if (config.hasLlm() && llm == null) {
                throw new AgentConstructionException(config.getName(),
                        "agent '" + config.getName() + "' has_llm=true but no llm_provider");
            }
            if (config.hasTools() && tools == null) {
                throw new AgentConstructionException(config.getName(),
                        "agent '" + config.getName() + "' has_tools=true but no tool_executor");
            }
            return new Agent(this);
        }
    }
}
