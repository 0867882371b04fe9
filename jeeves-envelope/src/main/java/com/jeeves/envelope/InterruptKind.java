package com.jeeves.envelope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a flow interrupt. Only clarification, confirmation and agent review have configurable
 * resume stages; the remaining kinds resume at the stage that was current when the run paused.
 */
public enum InterruptKind {
    CLARIFICATION("clarification"),
    CONFIRMATION("confirmation"),
    AGENT_REVIEW("agent_review"),
    CHECKPOINT("checkpoint"),
    RESOURCE_EXHAUSTED("resource_exhausted"),
    TIMEOUT("timeout"),
    SYSTEM_ERROR("system_error");

    private final String value;

    InterruptKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static InterruptKind fromValue(String value) {
        if (value == null) return null;
        for (InterruptKind k : values()) {
            if (k.value.equalsIgnoreCase(value) || k.name().equalsIgnoreCase(value)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown interrupt kind: " + value);
    }
}
