package com.jeeves.agent;

/**
 * Recoverable failure of one agent invocation. Recorded in the envelope's errors and routed;
 * never aborts the run by itself.
 */
public class AgentProcessingException extends RuntimeException {

    public static final String PROCESSING_ERROR = "ProcessingError";
    public static final String VALIDATION_ERROR = "ValidationError";
    public static final String LLM_ERROR = "LlmError";
    public static final String PARSE_ERROR = "ParseError";
    public static final String HOOK_ERROR = "HookError";

    private final String agentName;
    private final String errorType;

    public AgentProcessingException(String agentName, String errorType, String message) {
        this(agentName, errorType, message, null);
    }

    public AgentProcessingException(String agentName, String errorType, String message, Throwable cause) {
        super(message, cause);
        this.agentName = agentName;
        this.errorType = errorType != null ? errorType : PROCESSING_ERROR;
    }

    public String getAgentName() {
        return agentName;
    }

    /** One of the {@code *_ERROR} constants. */
    public String getErrorType() {
        return errorType;
    }
}
