package com.jeeves.protocol;

/**
 * LLM backend failure (unreachable server, rejected request, malformed response envelope).
 */
public class LlmProviderException extends RuntimeException {

    private final String model;

    public LlmProviderException(String model, String message) {
        this(model, message, null);
    }

    public LlmProviderException(String model, String message, Throwable cause) {
        super(message, cause);
        this.model = model;
    }

    public String getModel() {
        return model;
    }
}
