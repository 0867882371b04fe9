package com.jeeves.pipeline.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When a stage with several {@code requires} dependencies becomes ready.
 */
public enum JoinStrategy {
    /** Every required stage has completed. */
    ALL,
    /** At least one required stage has completed. */
    ANY;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static JoinStrategy fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        return JoinStrategy.valueOf(value.trim().toUpperCase());
    }
}
