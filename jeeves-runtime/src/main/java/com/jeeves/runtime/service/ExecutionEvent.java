package com.jeeves.runtime.service;

import java.util.Map;

/**
 * One event of {@link EngineService#executePipeline}.
 *
 * @param type        event type
 * @param stage       stage the event is about; the final stage for run-level events
 * @param timestampMs wall-clock time the event was produced
 * @param payload     stage output, error details or the run result, depending on the type
 */
public record ExecutionEvent(Type type, String stage, long timestampMs, Map<String, Object> payload) {

    public enum Type {
        STAGE_COMPLETED,
        STAGE_FAILED,
        INTERRUPT_RAISED,
        BOUNDS_EXCEEDED,
        /** Always the last event of a run. */
        PIPELINE_COMPLETED
    }

    public ExecutionEvent {
        payload = payload != null ? payload : Map.of();
    }
}
