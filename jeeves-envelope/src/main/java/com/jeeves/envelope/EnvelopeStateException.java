package com.jeeves.envelope;

/**
 * Thrown when a state dict or its JSON form cannot be turned back into an {@link Envelope}.
 */
public class EnvelopeStateException extends IllegalArgumentException {

    private final String field;

    public EnvelopeStateException(String message) {
        super(message);
        this.field = null;
    }

    public EnvelopeStateException(String message, Throwable cause) {
        super(message, cause);
        this.field = null;
    }

    public EnvelopeStateException(String field, String message) {
        super("Invalid state field '" + field + "': " + message);
        this.field = field;
    }

    /** State dict key that failed to decode; null when the failure is not tied to one key. */
    public String getField() {
        return field;
    }
}
