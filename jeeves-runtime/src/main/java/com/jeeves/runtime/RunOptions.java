package com.jeeves.runtime;

import com.jeeves.pipeline.config.RunMode;
import com.jeeves.protocol.CancellationSignal;

/**
 * How one call to {@link PipelineRuntime#execute} runs.
 */
public final class RunOptions {

    private final RunMode mode;
    private final boolean stream;
    private final String threadId;
    private final CancellationSignal signal;

    private RunOptions(Builder b) {
        this.mode = b.mode;
        this.stream = b.stream;
        this.threadId = b.threadId;
        this.signal = b.signal != null ? b.signal : CancellationSignal.none();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Pipeline default mode, no streaming, no persistence. */
    public static RunOptions defaults() {
        return builder().build();
    }

    /** Run mode; null means the pipeline's {@code default_run_mode}. */
    public RunMode getMode() {
        return mode;
    }

    public boolean isStream() {
        return stream;
    }

    /** Persistence thread id; null or blank disables checkpointing. */
    public String getThreadId() {
        return threadId;
    }

    public CancellationSignal getSignal() {
        return signal;
    }

    boolean hasThreadId() {
        return threadId != null && !threadId.isBlank();
    }

    Builder toBuilder() {
        return builder().mode(mode).stream(stream).threadId(threadId).signal(signal);
    }

    @Override
    public String toString() {
        return "RunOptions{mode=" + mode + ", stream=" + stream + ", threadId=" + threadId + "}";
    }

    public static final class Builder {
        private RunMode mode;
        private boolean stream;
        private String threadId;
        private CancellationSignal signal;

        public Builder mode(RunMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder threadId(String threadId) {
            this.threadId = threadId;
            return this;
        }

        public Builder signal(CancellationSignal signal) {
            this.signal = signal;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}
