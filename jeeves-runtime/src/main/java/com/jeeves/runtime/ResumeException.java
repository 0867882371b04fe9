package com.jeeves.runtime;

/**
 * Resume request that cannot be honored. The envelope is left unchanged.
 */
public class ResumeException extends IllegalStateException {

    public enum Reason {
        /** The envelope has no pending interrupt. */
        NO_PENDING_INTERRUPT,
        /** The pipeline names no resume stage for the interrupt's kind. */
        RESUME_STAGE_NOT_CONFIGURED
    }

    private final Reason reason;
    private final String interruptKind;

    public ResumeException(Reason reason, String interruptKind, String message) {
        super(message);
        this.reason = reason;
        this.interruptKind = interruptKind;
    }

    public Reason getReason() {
        return reason;
    }

    /** Kind of the interrupt being resumed; null when there was none. */
    public String getInterruptKind() {
        return interruptKind;
    }
}
