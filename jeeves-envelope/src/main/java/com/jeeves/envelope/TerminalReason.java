package com.jeeves.envelope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Cause recorded when a run stops. Wire values are lower snake case and are part of the
 * persisted state format.
 */
public enum TerminalReason {
    /** Run reached the terminal stage normally. */
    COMPLETED("completed"),
    /** {@code iteration} went past {@code max_iterations}. */
    MAX_ITERATIONS_EXCEEDED("max_iterations_exceeded"),
    /** {@code llm_call_count} reached {@code max_llm_calls}. */
    MAX_LLM_CALLS_EXCEEDED("max_llm_calls_exceeded"),
    /** {@code agent_hop_count} reached {@code max_agent_hops}. */
    MAX_AGENT_HOPS_EXCEEDED("max_agent_hops_exceeded"),
    /** A stage-to-stage edge was traversed more often than its edge limit. */
    MAX_LOOP_EXCEEDED("max_loop_exceeded"),
    /** Caller cancelled the run or denied a confirmation. */
    USER_CANCELLED("user_cancelled"),
    /** A stage failed in a way the pipeline could not route around. */
    TOOL_FAILED_FATALLY("tool_failed_fatally"),
    /** The LLM provider failed in a way the pipeline could not route around. */
    LLM_FAILED_FATALLY("llm_failed_fatally"),
    /** A policy hook rejected the run. */
    POLICY_VIOLATION("policy_violation");

    private final String value;

    TerminalReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TerminalReason fromValue(String value) {
        if (value == null) return null;
        for (TerminalReason r : values()) {
            if (r.value.equalsIgnoreCase(value) || r.name().equalsIgnoreCase(value)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unknown terminal reason: " + value);
    }
}
