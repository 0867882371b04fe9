package com.jeeves.agent;

import java.util.Map;

/**
 * Outcome of one {@link Agent#process} call.
 *
 * @param stage      agent name
 * @param nextStage  routing decision (also written to the envelope's current stage)
 * @param output     stored output; the error output when the agent failed without {@code error_next},
 *                   null when it failed and routed to {@code error_next}
 * @param error      failure message; null on success
 * @param errorType  failure category, see {@link AgentProcessingException}; null on success
 * @param llmCalls   LLM calls made, retries included
 * @param durationMs wall time of the call
 */
public record AgentResult(
        String stage,
        String nextStage,
        Map<String, Object> output,
        String error,
        String errorType,
        int llmCalls,
        long durationMs
) {

    public boolean isSuccess() {
        return error == null;
    }

    static AgentResult success(String stage, String nextStage, Map<String, Object> output, int llmCalls, long durationMs) {
        return new AgentResult(stage, nextStage, output, null, null, llmCalls, durationMs);
    }

    static AgentResult failure(String stage, String nextStage, Map<String, Object> output, String error,
                               String errorType, int llmCalls, long durationMs) {
        return new AgentResult(stage, nextStage, output, error, errorType, llmCalls, durationMs);
    }
}
