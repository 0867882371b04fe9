package com.jeeves.protocol.logging;

/**
 * Leveled logger taking an event name plus alternating key/value pairs, e.g.
 * {@code log.info("stage_completed", "stage", "planner", "duration_ms", 42)}.
 */
public interface StructuredLogger {

    void debug(String event, Object... keyValues);

    void info(String event, Object... keyValues);

    void warn(String event, Object... keyValues);

    void error(String event, Object... keyValues);

    /**
     * Child logger whose lines are prefixed with the given fields in addition to this logger's.
     */
    StructuredLogger bind(Object... keyValues);
}
