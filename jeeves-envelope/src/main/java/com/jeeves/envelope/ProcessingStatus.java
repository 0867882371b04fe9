package com.jeeves.envelope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of one {@link ProcessingRecord}.
 */
public enum ProcessingStatus {
    /** Agent started and has not completed yet. */
    RUNNING("running"),
    /** Agent produced a valid output. */
    SUCCESS("success"),
    /** Agent failed; the record carries the error message. */
    ERROR("error"),
    /** Agent was not run. */
    SKIPPED("skipped");

    private final String value;

    ProcessingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ProcessingStatus fromValue(String value) {
        if (value == null) return null;
        for (ProcessingStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown processing status: " + value);
    }
}
