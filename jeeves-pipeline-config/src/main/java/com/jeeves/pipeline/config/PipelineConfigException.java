package com.jeeves.pipeline.config;

/**
 * Invalid agent or pipeline configuration. Fatal at build time: a runtime cannot be constructed
 * from a configuration that raises this.
 */
public class PipelineConfigException extends IllegalStateException {

    private final String agentName;
    private final String field;

    public PipelineConfigException(String message) {
        this(null, null, message);
    }

    public PipelineConfigException(String agentName, String field, String message) {
        super(message);
        this.agentName = agentName;
        this.field = field;
    }

    public PipelineConfigException(String message, Throwable cause) {
        super(message, cause);
        this.agentName = null;
        this.field = null;
    }

    /** Agent whose configuration is invalid; null for pipeline-level problems. */
    public String getAgentName() {
        return agentName;
    }

    /** Offending configuration key, e.g. {@code routing_rules}; may be null. */
    public String getField() {
        return field;
    }
}
