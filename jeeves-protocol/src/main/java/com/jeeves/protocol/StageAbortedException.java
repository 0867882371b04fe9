package com.jeeves.protocol;

/**
 * Infrastructure aborted an in-flight stage. Distinct from a failure reported by the LLM or
 * the tool itself.
 */
public class StageAbortedException extends RuntimeException {

    public enum Cause {
        CANCELLED,
        TIMED_OUT
    }

    private final String stage;
    private final Cause abortCause;

    public StageAbortedException(String stage, Cause abortCause) {
        this(stage, abortCause, null);
    }

    public StageAbortedException(String stage, Cause abortCause, Throwable cause) {
        super("Stage " + stage + " aborted: " + abortCause.name().toLowerCase(), cause);
        this.stage = stage;
        this.abortCause = abortCause;
    }

    public String getStage() {
        return stage;
    }

    public Cause getAbortCause() {
        return abortCause;
    }
}
