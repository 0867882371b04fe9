package com.jeeves.runtime;

import com.jeeves.envelope.Envelope;

/**
 * The run's cancellation signal fired. Completed stages keep their outputs; the aborted stage is
 * recorded as failed.
 */
public class PipelineCancelledException extends RuntimeException {

    private final transient Envelope envelope;
    private final String stage;

    public PipelineCancelledException(Envelope envelope, String stage) {
        super("Pipeline cancelled" + (stage != null ? " at stage " + stage : ""));
        this.envelope = envelope;
        this.stage = stage;
    }

    /** Stage that was running or about to run; may be null. */
    public String getStage() {
        return stage;
    }

    /** Envelope as it stood when the run stopped. */
    public Envelope getEnvelope() {
        return envelope;
    }
}
