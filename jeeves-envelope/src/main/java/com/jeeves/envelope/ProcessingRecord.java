package com.jeeves.envelope;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Audit entry for one agent invocation. Created as {@link ProcessingStatus#RUNNING} by
 * {@link Envelope#recordAgentStart} and finalized once by {@link Envelope#recordAgentComplete}.
 */
public final class ProcessingRecord {

    private final String agent;
    private final int stageOrder;
    private final Instant startedAt;
    private Instant completedAt;
    private long durationMs;
    private ProcessingStatus status;
    private String error;
    private int llmCalls;

    public ProcessingRecord(String agent,
                            int stageOrder,
                            Instant startedAt,
                            Instant completedAt,
                            long durationMs,
                            ProcessingStatus status,
                            String error,
                            int llmCalls) {
        this.agent = Objects.requireNonNull(agent, "agent");
        this.stageOrder = stageOrder;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.durationMs = durationMs;
        this.status = status != null ? status : ProcessingStatus.RUNNING;
        this.error = error;
        this.llmCalls = llmCalls;
    }

    static ProcessingRecord running(String agent, int stageOrder, Instant startedAt) {
        return new ProcessingRecord(agent, stageOrder, startedAt, null, 0, ProcessingStatus.RUNNING, null, 0);
    }

    /**
     * Finalizes a running record. A non-positive {@code reportedDurationMs} is replaced by the
     * time elapsed between start and completion.
     */
    void complete(ProcessingStatus newStatus, String errorMessage, int calls, long reportedDurationMs, Instant at) {
        this.completedAt = at;
        this.status = newStatus;
        this.error = errorMessage;
        this.llmCalls = calls;
        if (reportedDurationMs > 0) {
            this.durationMs = reportedDurationMs;
        } else if (startedAt != null) {
            this.durationMs = Math.max(0, Duration.between(startedAt, at).toMillis());
        }
    }

    public ProcessingRecord copy() {
        return new ProcessingRecord(agent, stageOrder, startedAt, completedAt, durationMs, status, error, llmCalls);
    }

    public String getAgent() {
        return agent;
    }

    public int getStageOrder() {
        return stageOrder;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public long getDurationMs() {
        return durationMs;
    }

    public ProcessingStatus getStatus() {
        return status;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public int getLlmCalls() {
        return llmCalls;
    }

    public boolean isRunning() {
        return status == ProcessingStatus.RUNNING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcessingRecord that = (ProcessingRecord) o;
        return stageOrder == that.stageOrder
                && durationMs == that.durationMs
                && llmCalls == that.llmCalls
                && agent.equals(that.agent)
                && Objects.equals(startedAt, that.startedAt)
                && Objects.equals(completedAt, that.completedAt)
                && status == that.status
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(agent, stageOrder, startedAt, completedAt, durationMs, status, error, llmCalls);
    }

    @Override
    public String toString() {
        return "ProcessingRecord{agent=" + agent + ", status=" + status + ", durationMs=" + durationMs
                + ", llmCalls=" + llmCalls + "}";
    }
}
