package com.jeeves.pipeline.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the runtime schedules stages.
 */
public enum RunMode {
    /** One stage at a time, following each agent's routing decision. */
    SEQUENTIAL("sequential"),
    /** Rounds of dependency-ready stages dispatched concurrently. */
    PARALLEL("parallel");

    private final String value;

    RunMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RunMode fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        for (RunMode m : values()) {
            if (m.value.equalsIgnoreCase(value.trim()) || m.name().equalsIgnoreCase(value.trim())) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown run mode: " + value);
    }
}
