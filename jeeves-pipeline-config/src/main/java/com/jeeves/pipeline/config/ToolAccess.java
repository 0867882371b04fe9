package com.jeeves.pipeline.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tool access level of an agent. {@link #NONE} denies every tool and {@link #ALL} allows every
 * tool; {@link #READ} and {@link #WRITE} defer to the agent's allow-list when one is configured.
 */
public enum ToolAccess {
    NONE,
    READ,
    WRITE,
    ALL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ToolAccess fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        return ToolAccess.valueOf(value.trim().toUpperCase());
    }
}
