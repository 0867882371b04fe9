package com.jeeves.runtime;

import com.jeeves.envelope.Envelope;

/**
 * Outcome of {@link PipelineRuntime#execute}.
 *
 * @param envelope the run's envelope (the same instance that was passed in)
 * @param outputs  per-stage outputs, already closed; null unless the run was streamed
 */
public record RunResult(Envelope envelope, StageOutputStream outputs) {
}
