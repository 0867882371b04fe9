package com.jeeves.envelope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Mutable state container threaded through one pipeline run.
 * <ul>
 *   <li><b>Outputs</b>: one structured value per agent output key; any agent may write any key.</li>
 *   <li><b>Bounds</b>: iteration, LLM call and agent hop counters with their maxima. Counters only
 *       grow during a run; {@link #canContinue()} is the single check that turns an exhausted bound
 *       into a {@link TerminalReason}.</li>
 *   <li><b>Stage sets</b>: active, completed and failed stage names. The three sets are mutually
 *       exclusive and guarded by one lock because parallel rounds update them from several threads.</li>
 *   <li><b>Goals</b>: multi-stage goal bookkeeping ({@link #initializeGoals}, {@link #advanceStage}).</li>
 *   <li><b>Interrupt</b>: a single slot; see {@link #setInterrupt}, {@link #resolveInterrupt}.</li>
 *   <li><b>Audit</b>: processing history, errors and timestamps.</li>
 * </ul>
 * {@link #toStateDict()} / {@link #fromStateDict(Map)} is the persisted form; {@link #copy()} is a
 * fully independent deep copy used for checkpoints and parallel workers.
 */
public final class Envelope {

    private static final Logger log = LoggerFactory.getLogger(Envelope.class);

    public static final String DEFAULT_USER_ID = "anonymous";
    public static final String INITIAL_STAGE = "start";
    public static final int DEFAULT_MAX_ITERATIONS = 3;
    public static final int DEFAULT_MAX_LLM_CALLS = 10;
    public static final int DEFAULT_MAX_AGENT_HOPS = 21;
    public static final int DEFAULT_MAX_STAGES = 5;

    public static final String GOAL_PENDING = "pending";
    public static final String GOAL_SATISFIED = "satisfied";

    /** Output key holding the current plan; archived on retry and referenced by stage snapshots. */
    public static final String PLAN_OUTPUT_KEY = "plan";
    /** Output key whose {@code final_response} string is the run's answer. */
    public static final String INTEGRATION_OUTPUT_KEY = "integration";

    /**
     * Output keys discarded when {@link #advanceStage} moves to the next goal stage. Fixed naming
     * convention of the planning pipelines; not derived from configuration.
     */
    public static final List<String> STAGE_SCOPED_OUTPUT_KEYS = List.of("plan", "execution", "critic");
    /** Output keys discarded by {@link #incrementIteration} before a retry loop. */
    public static final List<String> RETRY_SCOPED_OUTPUT_KEYS =
            List.of("plan", "arbiter", "execution", "synthesizer", "critic");

    private String envelopeId;
    private String requestId;
    private String userId;
    private String sessionId;
    private String rawInput;
    private Instant receivedAt;
    private Instant createdAt;
    private Instant completedAt;

    private final Map<String, Map<String, Object>> outputs = new LinkedHashMap<>();

    private String currentStage;
    private final List<String> stageOrder = new ArrayList<>();
    private int iteration;
    private int maxIterations;

    private int llmCallCount;
    private int maxLlmCalls;
    private int agentHopCount;
    private int maxAgentHops;
    private TerminalReason terminalReason;

    private final Object stageLock = new Object();
    private final Set<String> activeStages = new LinkedHashSet<>();
    private final Set<String> completedStageSet = new LinkedHashSet<>();
    private final Map<String, String> failedStages = new LinkedHashMap<>();
    private boolean parallelMode;

    private boolean terminated;
    private String terminationReason;

    private boolean interruptPending;
    private FlowInterrupt interrupt;

    private final List<Map<String, Object>> completedStages = new ArrayList<>();
    private int currentStageNumber;
    private int maxStages;
    private final List<String> allGoals = new ArrayList<>();
    private final List<String> remainingGoals = new ArrayList<>();
    private final Map<String, String> goalCompletionStatus = new LinkedHashMap<>();

    private final List<Map<String, Object>> priorPlans = new ArrayList<>();
    private final List<String> loopFeedback = new ArrayList<>();

    private final List<ProcessingRecord> processingHistory = new ArrayList<>();
    private final List<Map<String, Object>> errors = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    /** Creates an envelope with generated ids and default bounds. */
    public Envelope() {
        Instant now = Timestamps.now();
        this.envelopeId = newId("env_");
        this.requestId = newId("req_");
        this.userId = DEFAULT_USER_ID;
        this.sessionId = newId("sess_");
        this.rawInput = "";
        this.receivedAt = now;
        this.createdAt = now;
        this.currentStage = INITIAL_STAGE;
        this.maxIterations = DEFAULT_MAX_ITERATIONS;
        this.maxLlmCalls = DEFAULT_MAX_LLM_CALLS;
        this.maxAgentHops = DEFAULT_MAX_AGENT_HOPS;
        this.currentStageNumber = 1;
        this.maxStages = DEFAULT_MAX_STAGES;
    }

    /**
     * Creates an envelope for a user request. Null arguments keep the defaults.
     */
    public static Envelope create(String rawInput,
                                  String userId,
                                  String sessionId,
                                  String requestId,
                                  Map<String, ?> metadata,
                                  List<String> stageOrder) {
        Envelope e = new Envelope();
        if (rawInput != null) e.rawInput = rawInput;
        if (userId != null && !userId.isBlank()) e.userId = userId;
        if (sessionId != null && !sessionId.isBlank()) e.sessionId = sessionId;
        if (requestId != null && !requestId.isBlank()) e.requestId = requestId;
        if (metadata != null) e.metadata.putAll(DeepCopy.copyMap(metadata));
        if (stageOrder != null) e.stageOrder.addAll(stageOrder);
        return e;
    }

    private static String newId(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    // ---------------------------------------------------------------------------------------
    // Outputs
    // ---------------------------------------------------------------------------------------

    /** Stored output for {@code key}, or null. The returned map is the stored instance. */
    public Map<String, Object> getOutput(String key) {
        return outputs.get(key);
    }

    public void setOutput(String key, Map<String, Object> value) {
        outputs.put(key, value);
    }

    public boolean hasOutput(String key) {
        return outputs.containsKey(key);
    }

    public void removeOutput(String key) {
        outputs.remove(key);
    }

    /** Unmodifiable view of all outputs in insertion order. */
    public Map<String, Map<String, Object>> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    // ---------------------------------------------------------------------------------------
    // Processing history and bounds counters
    // ---------------------------------------------------------------------------------------

    /** Appends a running record for {@code agent} and counts one agent hop. */
    public void recordAgentStart(String agent, int stageOrderIndex) {
        processingHistory.add(ProcessingRecord.running(agent, stageOrderIndex, Timestamps.now()));
        agentHopCount++;
    }

    /**
     * Finalizes the most recent running record of {@code agent} and adds {@code llmCalls} to the
     * envelope's LLM call count. The count is added even when no running record is found.
     */
    public void recordAgentComplete(String agent, ProcessingStatus status, String error, int llmCalls, long durationMs) {
        boolean found = false;
        for (int i = processingHistory.size() - 1; i >= 0; i--) {
            ProcessingRecord r = processingHistory.get(i);
            if (r.getAgent().equals(agent) && r.isRunning()) {
                r.complete(status, error, llmCalls, durationMs, Timestamps.now());
                found = true;
                break;
            }
        }
        if (!found && log.isDebugEnabled()) {
            log.debug("recordAgentComplete without running record | agent={} status={}", agent, status);
        }
        addLlmCalls(llmCalls);
    }

    /** Appends an already finalized record (used when merging parallel branches). */
    public void appendProcessingRecord(ProcessingRecord record) {
        processingHistory.add(record.copy());
    }

    public void addLlmCalls(int calls) {
        if (calls < 0) throw new IllegalArgumentException("llm calls must not be negative: " + calls);
        llmCallCount += calls;
    }

    public void addAgentHops(int hops) {
        if (hops < 0) throw new IllegalArgumentException("agent hops must not be negative: " + hops);
        agentHopCount += hops;
    }

    public List<ProcessingRecord> getProcessingHistory() {
        return Collections.unmodifiableList(processingHistory);
    }

    /** Sum of recorded durations. */
    public long totalProcessingTimeMs() {
        long total = 0;
        for (ProcessingRecord r : processingHistory) {
            total += r.getDurationMs();
        }
        return total;
    }

    // ---------------------------------------------------------------------------------------
    // Control flow
    // ---------------------------------------------------------------------------------------

    /**
     * Whether another stage may be dispatched. Checks, in order: terminated, pending interrupt,
     * iterations, LLM calls, agent hops. An exhausted bound sets the matching terminal reason; the
     * first failing check wins.
     */
    public boolean canContinue() {
        if (terminated) return false;
        if (interruptPending) return false;
        if (iteration > maxIterations) {
            terminalReason = TerminalReason.MAX_ITERATIONS_EXCEEDED;
            return false;
        }
        if (llmCallCount >= maxLlmCalls) {
            terminalReason = TerminalReason.MAX_LLM_CALLS_EXCEEDED;
            return false;
        }
        if (agentHopCount >= maxAgentHops) {
            terminalReason = TerminalReason.MAX_AGENT_HOPS_EXCEEDED;
            return false;
        }
        return true;
    }

    /**
     * Marks the run terminated and stamps {@code completed_at}. A null {@code reason} keeps any
     * terminal reason already recorded.
     */
    public void terminate(String message, TerminalReason reason) {
        terminated = true;
        terminationReason = message;
        if (reason != null) {
            terminalReason = reason;
        }
        completedAt = Timestamps.now();
    }

    // ---------------------------------------------------------------------------------------
    // Interrupts
    // ---------------------------------------------------------------------------------------

    /** Raises an interrupt, replacing any previous one, and pauses the run. */
    public void setInterrupt(InterruptKind kind, String id, InterruptOption... options) {
        FlowInterrupt created = new FlowInterrupt(kind, id, null, null, null, null, Timestamps.now(), null);
        if (options != null) {
            for (InterruptOption option : options) {
                created = option.apply(created);
            }
        }
        interrupt = created;
        interruptPending = true;
    }

    /** Installs an interrupt raised on another copy of this run (parallel merge) and pauses the run. */
    public void adoptInterrupt(FlowInterrupt raised) {
        interrupt = Objects.requireNonNull(raised, "raised");
        interruptPending = raised.getResponse().isEmpty();
    }

    /**
     * Attaches the response (stamped with the receipt time) and clears the pending flag. The
     * interrupt itself is kept for audit.
     */
    public void resolveInterrupt(InterruptResponse response) {
        if (interrupt != null) {
            interrupt = interrupt.withResponse(response.withReceivedAt(Timestamps.now()));
        }
        interruptPending = false;
    }

    /** Discards the interrupt entirely. */
    public void clearInterrupt() {
        interruptPending = false;
        interrupt = null;
    }

    public boolean hasPendingInterrupt() {
        return interruptPending && interrupt != null;
    }

    public boolean isInterruptPending() {
        return interruptPending;
    }

    public Optional<FlowInterrupt> getInterrupt() {
        return Optional.ofNullable(interrupt);
    }

    public Optional<InterruptKind> getInterruptKind() {
        return interrupt == null ? Optional.empty() : Optional.of(interrupt.getKind());
    }

    // ---------------------------------------------------------------------------------------
    // Stage sets
    // ---------------------------------------------------------------------------------------

    public void startStage(String stage) {
        synchronized (stageLock) {
            completedStageSet.remove(stage);
            failedStages.remove(stage);
            activeStages.add(stage);
        }
    }

    public void completeStage(String stage) {
        synchronized (stageLock) {
            activeStages.remove(stage);
            failedStages.remove(stage);
            completedStageSet.add(stage);
        }
    }

    public void failStage(String stage, String error) {
        synchronized (stageLock) {
            activeStages.remove(stage);
            completedStageSet.remove(stage);
            failedStages.put(stage, error != null ? error : "");
        }
    }

    public boolean isStageCompleted(String stage) {
        synchronized (stageLock) {
            return completedStageSet.contains(stage);
        }
    }

    public boolean isStageActive(String stage) {
        synchronized (stageLock) {
            return activeStages.contains(stage);
        }
    }

    public boolean isStageFailed(String stage) {
        synchronized (stageLock) {
            return failedStages.containsKey(stage);
        }
    }

    public Optional<String> getStageError(String stage) {
        synchronized (stageLock) {
            return Optional.ofNullable(failedStages.get(stage));
        }
    }

    public int getActiveStageCount() {
        synchronized (stageLock) {
            return activeStages.size();
        }
    }

    public int getCompletedStageCount() {
        synchronized (stageLock) {
            return completedStageSet.size();
        }
    }

    /** True when every stage of {@code stage_order} is completed; false for an empty order. */
    public boolean allStagesComplete() {
        if (stageOrder.isEmpty()) return false;
        synchronized (stageLock) {
            return completedStageSet.containsAll(stageOrder);
        }
    }

    public boolean hasFailures() {
        synchronized (stageLock) {
            return !failedStages.isEmpty();
        }
    }

    /** Snapshot of the completed set. */
    public Set<String> getCompletedStageSet() {
        synchronized (stageLock) {
            return new LinkedHashSet<>(completedStageSet);
        }
    }

    public Set<String> getActiveStages() {
        synchronized (stageLock) {
            return new LinkedHashSet<>(activeStages);
        }
    }

    public Map<String, String> getFailedStages() {
        synchronized (stageLock) {
            return new LinkedHashMap<>(failedStages);
        }
    }

    // ---------------------------------------------------------------------------------------
    // Goals and multi-stage execution
    // ---------------------------------------------------------------------------------------

    /** Replaces goal tracking with {@code goals}, all pending. */
    public void initializeGoals(List<String> goals) {
        allGoals.clear();
        remainingGoals.clear();
        goalCompletionStatus.clear();
        for (String goal : goals) {
            allGoals.add(goal);
            remainingGoals.add(goal);
            goalCompletionStatus.put(goal, GOAL_PENDING);
        }
    }

    /**
     * Marks the given goals satisfied and records a snapshot of the finished stage.
     *
     * @return true when goals remain and the stage limit allows another stage; the stage number is
     *         then incremented and the {@link #STAGE_SCOPED_OUTPUT_KEYS} outputs are cleared
     */
    public boolean advanceStage(List<String> satisfiedGoals, Map<String, ?> stageSummary) {
        List<String> satisfied = satisfiedGoals != null ? new ArrayList<>(satisfiedGoals) : new ArrayList<>();
        for (String goal : satisfied) {
            goalCompletionStatus.put(goal, GOAL_SATISFIED);
            remainingGoals.removeIf(goal::equals);
        }

        Map<String, Object> plan = outputs.get(PLAN_OUTPUT_KEY);
        Object planId = plan != null ? plan.get("plan_id") : null;

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("stage_number", currentStageNumber);
        snapshot.put("satisfied_goals", satisfied);
        snapshot.put("summary", DeepCopy.copyMap(stageSummary));
        snapshot.put("plan_id", DeepCopy.copyValue(planId));
        completedStages.add(snapshot);

        if (remainingGoals.isEmpty()) return false;
        if (currentStageNumber >= maxStages) return false;

        currentStageNumber++;
        for (String key : STAGE_SCOPED_OUTPUT_KEYS) {
            outputs.remove(key);
        }
        return true;
    }

    /** Accumulated goal context for prompts of the next stage. */
    public Map<String, Object> getStageContext() {
        List<String> satisfied = new ArrayList<>();
        for (Map.Entry<String, String> e : goalCompletionStatus.entrySet()) {
            if (GOAL_SATISFIED.equals(e.getValue())) {
                satisfied.add(e.getKey());
            }
        }
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("current_stage", currentStageNumber);
        ctx.put("completed_stages", DeepCopy.copyMapList(completedStages));
        ctx.put("remaining_goals", new ArrayList<>(remainingGoals));
        ctx.put("goal_completion_status", new LinkedHashMap<>(goalCompletionStatus));
        ctx.put("satisfied_goals", satisfied);
        return ctx;
    }

    // ---------------------------------------------------------------------------------------
    // Retry loop
    // ---------------------------------------------------------------------------------------

    /**
     * Starts another loop iteration: increments {@code iteration}, records {@code feedback} when
     * non-null, archives a copy of the current plan and clears {@link #RETRY_SCOPED_OUTPUT_KEYS}.
     */
    public void incrementIteration(String feedback) {
        iteration++;
        if (feedback != null) {
            loopFeedback.add(feedback);
        }
        Map<String, Object> plan = outputs.get(PLAN_OUTPUT_KEY);
        if (plan != null) {
            priorPlans.add(DeepCopy.copyMap(plan));
        }
        for (String key : RETRY_SCOPED_OUTPUT_KEYS) {
            outputs.remove(key);
        }
    }

    // ---------------------------------------------------------------------------------------
    // Errors, metadata, results
    // ---------------------------------------------------------------------------------------

    /** Appends an {@code {agent, error, error_type, timestamp}} entry. */
    public void addError(String agent, String error, String errorType) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("agent", agent);
        entry.put("error", error);
        entry.put("error_type", errorType);
        entry.put("timestamp", Timestamps.format(Timestamps.now()));
        errors.add(entry);
    }

    /** Appends a copy of an error entry produced elsewhere (parallel merge). */
    public void appendError(Map<String, ?> entry) {
        errors.add(DeepCopy.copyMap(entry));
    }

    public List<Map<String, Object>> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    /**
     * Text to show the user: the pending clarification question or confirmation message, else the
     * string {@code final_response} of the integration output.
     */
    public Optional<String> getFinalResponse() {
        if (interruptPending && interrupt != null) {
            if (interrupt.getKind() == InterruptKind.CLARIFICATION && interrupt.getQuestion().isPresent()) {
                return interrupt.getQuestion();
            }
            if (interrupt.getKind() == InterruptKind.CONFIRMATION && interrupt.getMessage().isPresent()) {
                return interrupt.getMessage();
            }
        }
        Map<String, Object> integration = outputs.get(INTEGRATION_OUTPUT_KEY);
        if (integration != null && integration.get("final_response") instanceof String s) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    /** Summary dictionary for API responses. */
    public Map<String, Object> toResultDict() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("envelope_id", envelopeId);
        result.put("request_id", requestId);
        result.put("user_id", userId);
        result.put("session_id", sessionId);
        result.put("current_stage", currentStage);
        result.put("terminated", terminated);
        result.put("termination_reason", terminationReason);
        result.put("terminal_reason", terminalReason != null ? terminalReason.getValue() : null);
        result.put("response", getFinalResponse().orElse(null));
        result.put("interrupt_pending", interruptPending);
        result.put("iteration", iteration);
        result.put("llm_call_count", llmCallCount);
        result.put("agent_hop_count", agentHopCount);
        result.put("processing_time_ms", totalProcessingTimeMs());
        result.put("errors", DeepCopy.copyMapList(errors));
        if (interrupt != null) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("kind", interrupt.getKind().getValue());
            summary.put("id", interrupt.getId());
            summary.put("question", interrupt.getQuestion().orElse(null));
            summary.put("message", interrupt.getMessage().orElse(null));
            summary.put("created_at", Timestamps.format(interrupt.getCreatedAt()));
            result.put("interrupt", summary);
            if (interrupt.getKind() == InterruptKind.CLARIFICATION) {
                result.put("clarification_needed", interruptPending);
                result.put("clarification_question", interrupt.getQuestion().orElse(null));
            }
            if (interrupt.getKind() == InterruptKind.CONFIRMATION) {
                result.put("confirmation_needed", interruptPending);
                result.put("confirmation_message", interrupt.getMessage().orElse(null));
                result.put("confirmation_id", interrupt.getId());
            }
        }
        return result;
    }

    // ---------------------------------------------------------------------------------------
    // Copy and state dict
    // ---------------------------------------------------------------------------------------

    /**
     * Fully independent deep copy: no map, list or record instance is shared with this envelope.
     */
    public Envelope copy() {
        return fromStateDict(toStateDict());
    }

    /** Persisted form of every field. See {@link EnvelopeStateCodec} for the JSON form. */
    public Map<String, Object> toStateDict() {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("envelope_id", envelopeId);
        d.put("request_id", requestId);
        d.put("user_id", userId);
        d.put("session_id", sessionId);
        d.put("raw_input", rawInput);
        d.put("received_at", Timestamps.format(receivedAt));
        d.put("created_at", Timestamps.format(createdAt));
        d.put("completed_at", Timestamps.format(completedAt));

        Map<String, Object> outs = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> e : outputs.entrySet()) {
            outs.put(e.getKey(), DeepCopy.copyMap(e.getValue()));
        }
        d.put("outputs", outs);

        d.put("current_stage", currentStage);
        d.put("stage_order", new ArrayList<>(stageOrder));
        d.put("iteration", iteration);
        d.put("max_iterations", maxIterations);
        d.put("llm_call_count", llmCallCount);
        d.put("max_llm_calls", maxLlmCalls);
        d.put("agent_hop_count", agentHopCount);
        d.put("max_agent_hops", maxAgentHops);
        d.put("terminal_reason", terminalReason != null ? terminalReason.getValue() : null);

        synchronized (stageLock) {
            d.put("active_stages", new ArrayList<>(activeStages));
            d.put("completed_stage_set", new ArrayList<>(completedStageSet));
            d.put("failed_stages", new LinkedHashMap<>(failedStages));
        }
        d.put("parallel_mode", parallelMode);

        d.put("terminated", terminated);
        d.put("termination_reason", terminationReason);
        d.put("interrupt_pending", interruptPending);
        d.put("interrupt", interrupt != null ? interruptToDict(interrupt) : null);

        d.put("completed_stages", DeepCopy.copyMapList(completedStages));
        d.put("current_stage_number", currentStageNumber);
        d.put("max_stages", maxStages);
        d.put("all_goals", new ArrayList<>(allGoals));
        d.put("remaining_goals", new ArrayList<>(remainingGoals));
        d.put("goal_completion_status", new LinkedHashMap<>(goalCompletionStatus));
        d.put("prior_plans", DeepCopy.copyMapList(priorPlans));
        d.put("loop_feedback", new ArrayList<>(loopFeedback));

        List<Map<String, Object>> history = new ArrayList<>(processingHistory.size());
        for (ProcessingRecord r : processingHistory) {
            history.add(recordToDict(r));
        }
        d.put("processing_history", history);
        d.put("errors", DeepCopy.copyMapList(errors));
        d.put("metadata", DeepCopy.copyMap(metadata));
        return d;
    }

    private static Map<String, Object> interruptToDict(FlowInterrupt i) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("kind", i.getKind().getValue());
        m.put("id", i.getId());
        m.put("question", i.getQuestion().orElse(null));
        m.put("message", i.getMessage().orElse(null));
        m.put("data", i.getData());
        m.put("created_at", Timestamps.format(i.getCreatedAt()));
        m.put("expires_at", Timestamps.format(i.getExpiresAt().orElse(null)));
        if (i.getResponse().isPresent()) {
            InterruptResponse r = i.getResponse().get();
            Map<String, Object> rm = new LinkedHashMap<>();
            rm.put("text", r.getText().orElse(null));
            rm.put("approved", r.getApproved().orElse(null));
            rm.put("decision", r.getDecision().orElse(null));
            rm.put("data", r.getData());
            rm.put("received_at", Timestamps.format(r.getReceivedAt()));
            m.put("response", rm);
        } else {
            m.put("response", null);
        }
        return m;
    }

    private static Map<String, Object> recordToDict(ProcessingRecord r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("agent", r.getAgent());
        m.put("stage_order", r.getStageOrder());
        m.put("started_at", Timestamps.format(r.getStartedAt()));
        m.put("completed_at", Timestamps.format(r.getCompletedAt().orElse(null)));
        m.put("duration_ms", r.getDurationMs());
        m.put("status", r.getStatus().getValue());
        m.put("error", r.getError().orElse(null));
        m.put("llm_calls", r.getLlmCalls());
        return m;
    }

    /**
     * Rebuilds an envelope from {@link #toStateDict()} output. Missing keys keep their defaults;
     * the legacy keys {@code dag_mode} and {@code critic_feedback} are accepted, and stage sets may
     * be lists or {@code {stage: true}} maps.
     *
     * @throws EnvelopeStateException when a present value has the wrong shape
     */
    public static Envelope fromStateDict(Map<String, ?> state) {
        if (state == null) throw new EnvelopeStateException("state dict is null");
        Envelope e = new Envelope();
        e.envelopeId = StateValues.string(state, "envelope_id", e.envelopeId);
        e.requestId = StateValues.string(state, "request_id", e.requestId);
        e.userId = StateValues.string(state, "user_id", e.userId);
        e.sessionId = StateValues.string(state, "session_id", e.sessionId);
        e.rawInput = StateValues.string(state, "raw_input", e.rawInput);
        if (state.get("received_at") != null) e.receivedAt = StateValues.instant(state, "received_at");
        if (state.get("created_at") != null) e.createdAt = StateValues.instant(state, "created_at");
        e.completedAt = StateValues.instant(state, "completed_at");

        Map<String, Object> outs = StateValues.map(state, "outputs");
        if (outs != null) {
            for (Map.Entry<String, Object> o : outs.entrySet()) {
                if (o.getValue() instanceof Map<?, ?>) {
                    e.outputs.put(o.getKey(), StateValues.map(outs, o.getKey()));
                } else if (o.getValue() != null) {
                    throw new EnvelopeStateException("outputs." + o.getKey(), "expected an object");
                }
            }
        }

        e.currentStage = StateValues.string(state, "current_stage", e.currentStage);
        e.stageOrder.addAll(StateValues.stringList(state, "stage_order"));
        e.iteration = StateValues.intValue(state, "iteration", 0);
        e.maxIterations = StateValues.intValue(state, "max_iterations", e.maxIterations);
        e.llmCallCount = StateValues.intValue(state, "llm_call_count", 0);
        e.maxLlmCalls = StateValues.intValue(state, "max_llm_calls", e.maxLlmCalls);
        e.agentHopCount = StateValues.intValue(state, "agent_hop_count", 0);
        e.maxAgentHops = StateValues.intValue(state, "max_agent_hops", e.maxAgentHops);
        String reason = StateValues.string(state, "terminal_reason", null);
        e.terminalReason = reason != null ? TerminalReason.fromValue(reason) : null;

        e.activeStages.addAll(StateValues.stringSet(state, "active_stages"));
        e.completedStageSet.addAll(StateValues.stringSet(state, "completed_stage_set"));
        e.failedStages.putAll(StateValues.stringMap(state, "failed_stages"));
        requireDisjoint(e.activeStages, e.completedStageSet, "completed_stage_set", "active");
        requireDisjoint(e.activeStages, e.failedStages.keySet(), "failed_stages", "active");
        requireDisjoint(e.completedStageSet, e.failedStages.keySet(), "failed_stages", "completed");
        e.parallelMode = StateValues.bool(state, "parallel_mode", StateValues.bool(state, "dag_mode", false));

        e.terminated = StateValues.bool(state, "terminated", false);
        e.terminationReason = StateValues.string(state, "termination_reason", null);
        e.interruptPending = StateValues.bool(state, "interrupt_pending", false);
        Map<String, Object> interruptDict = StateValues.map(state, "interrupt");
        e.interrupt = interruptDict != null ? interruptFromDict(interruptDict) : null;

        e.completedStages.addAll(StateValues.mapList(state, "completed_stages"));
        e.currentStageNumber = StateValues.intValue(state, "current_stage_number", e.currentStageNumber);
        e.maxStages = StateValues.intValue(state, "max_stages", e.maxStages);
        e.allGoals.addAll(StateValues.stringList(state, "all_goals"));
        e.remainingGoals.addAll(StateValues.stringList(state, "remaining_goals"));
        e.goalCompletionStatus.putAll(StateValues.stringMap(state, "goal_completion_status"));
        e.priorPlans.addAll(StateValues.mapList(state, "prior_plans"));
        if (state.containsKey("loop_feedback")) {
            e.loopFeedback.addAll(StateValues.stringList(state, "loop_feedback"));
        } else {
            e.loopFeedback.addAll(StateValues.stringList(state, "critic_feedback"));
        }

        for (Map<String, Object> r : StateValues.mapList(state, "processing_history")) {
            e.processingHistory.add(recordFromDict(r));
        }
        e.errors.addAll(StateValues.mapList(state, "errors"));
        Map<String, Object> meta = StateValues.map(state, "metadata");
        if (meta != null) e.metadata.putAll(meta);
        return e;
    }

    /** A stage is in at most one of the active, completed and failed sets. */
    private static void requireDisjoint(Set<String> first, Set<String> second, String field, String firstState) {
        for (String stage : second) {
            if (first.contains(stage)) {
                throw new EnvelopeStateException(field, "stage '" + stage + "' is also " + firstState);
            }
        }
    }

    private static FlowInterrupt interruptFromDict(Map<String, Object> m) {
        String kind = StateValues.string(m, "kind", null);
        if (kind == null) throw new EnvelopeStateException("interrupt.kind", "missing");
        InterruptResponse response = null;
        Map<String, Object> rm = StateValues.map(m, "response");
        if (rm != null) {
            response = new InterruptResponse(
                    StateValues.string(rm, "text", null),
                    StateValues.optionalBool(rm, "approved"),
                    StateValues.string(rm, "decision", null),
                    StateValues.map(rm, "data"),
                    StateValues.instant(rm, "received_at"));
        }
        return new FlowInterrupt(
                InterruptKind.fromValue(kind),
                StateValues.string(m, "id", ""),
                StateValues.string(m, "question", null),
                StateValues.string(m, "message", null),
                StateValues.map(m, "data"),
                response,
                StateValues.instant(m, "created_at"),
                StateValues.instant(m, "expires_at"));
    }

    private static ProcessingRecord recordFromDict(Map<String, Object> m) {
        String agent = StateValues.string(m, "agent", null);
        if (agent == null) throw new EnvelopeStateException("processing_history.agent", "missing");
        String status = StateValues.string(m, "status", ProcessingStatus.RUNNING.getValue());
        return new ProcessingRecord(
                agent,
                StateValues.intValue(m, "stage_order", 0),
                StateValues.instant(m, "started_at"),
                StateValues.instant(m, "completed_at"),
                StateValues.longValue(m, "duration_ms", 0L),
                ProcessingStatus.fromValue(status),
                StateValues.string(m, "error", null),
                StateValues.intValue(m, "llm_calls", 0));
    }

    // ---------------------------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------------------------

    public String getEnvelopeId() {
        return envelopeId;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getUserId() {
        return userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getRawInput() {
        return rawInput;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public String getCurrentStage() {
        return currentStage;
    }

    public void setCurrentStage(String currentStage) {
        this.currentStage = currentStage;
    }

    public List<String> getStageOrder() {
        return Collections.unmodifiableList(stageOrder);
    }

    public void setStageOrder(List<String> order) {
        stageOrder.clear();
        if (order != null) stageOrder.addAll(order);
    }

    /** Position of {@code stage} in {@code stage_order}, or -1. */
    public int stageIndex(String stage) {
        return stageOrder.indexOf(stage);
    }

    public int getIteration() {
        return iteration;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public int getLlmCallCount() {
        return llmCallCount;
    }

    public int getMaxLlmCalls() {
        return maxLlmCalls;
    }

    public void setMaxLlmCalls(int maxLlmCalls) {
        this.maxLlmCalls = maxLlmCalls;
    }

    public int getAgentHopCount() {
        return agentHopCount;
    }

    public int getMaxAgentHops() {
        return maxAgentHops;
    }

    public void setMaxAgentHops(int maxAgentHops) {
        this.maxAgentHops = maxAgentHops;
    }

    public Optional<TerminalReason> getTerminalReason() {
        return Optional.ofNullable(terminalReason);
    }

    public boolean isParallelMode() {
        return parallelMode;
    }

    public void setParallelMode(boolean parallelMode) {
        this.parallelMode = parallelMode;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public Optional<String> getTerminationReason() {
        return Optional.ofNullable(terminationReason);
    }

    public List<Map<String, Object>> getCompletedStages() {
        return Collections.unmodifiableList(completedStages);
    }

    public int getCurrentStageNumber() {
        return currentStageNumber;
    }

    public int getMaxStages() {
        return maxStages;
    }

    public void setMaxStages(int maxStages) {
        this.maxStages = maxStages;
    }

    public List<String> getAllGoals() {
        return Collections.unmodifiableList(allGoals);
    }

    public List<String> getRemainingGoals() {
        return Collections.unmodifiableList(remainingGoals);
    }

    public Map<String, String> getGoalCompletionStatus() {
        return Collections.unmodifiableMap(goalCompletionStatus);
    }

    public List<Map<String, Object>> getPriorPlans() {
        return Collections.unmodifiableList(priorPlans);
    }

    public List<String> getLoopFeedback() {
        return Collections.unmodifiableList(loopFeedback);
    }

    @Override
    public String toString() {
        return "Envelope{id=" + envelopeId + ", stage=" + currentStage + ", iteration=" + iteration
                + ", llmCalls=" + llmCallCount + ", hops=" + agentHopCount + ", terminated=" + terminated
                + ", interruptPending=" + interruptPending + "}";
    }
}
