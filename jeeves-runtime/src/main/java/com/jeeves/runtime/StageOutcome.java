package com.jeeves.runtime;

import com.jeeves.agent.AgentResult;
import com.jeeves.protocol.StageAbortedException;

/**
 * How a dispatched stage ended. Exactly one of {@code result}, {@code aborted} and
 * {@code failure} is set.
 *
 * @param stage     stage name
 * @param result    the agent's result (success or recoverable failure)
 * @param aborted   cancellation or timeout
 * @param failure   unexpected exception escaping the agent
 * @param abandoned the agent did not return within the abort grace period and may still be running
 * @param durationMs wall time since the stage started
 */
record StageOutcome(
        String stage,
        AgentResult result,
        StageAbortedException aborted,
        Throwable failure,
        boolean abandoned,
        long durationMs
) {

    static StageOutcome completed(String stage, AgentResult result, long durationMs) {
        return new StageOutcome(stage, result, null, null, false, durationMs);
    }

    static StageOutcome aborted(String stage, StageAbortedException aborted, boolean abandoned, long durationMs) {
        return new StageOutcome(stage, null, aborted, null, abandoned, durationMs);
    }

    static StageOutcome failed(String stage, Throwable failure, long durationMs) {
        return new StageOutcome(stage, null, null, failure, false, durationMs);
    }

    boolean isSuccess() {
        return result != null && result.isSuccess();
    }

    boolean isCancelled() {
        return aborted != null && aborted.getAbortCause() == StageAbortedException.Cause.CANCELLED;
    }

    boolean isTimedOut() {
        return aborted != null && aborted.getAbortCause() == StageAbortedException.Cause.TIMED_OUT;
    }

    /** Failure message; null on success. */
    String error() {
        if (result != null) return result.error();
        if (aborted != null) return aborted.getMessage();
        if (failure != null) {
            return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        }
        return null;
    }
}
