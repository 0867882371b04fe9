package com.jeeves.runtime.service;

import com.jeeves.envelope.Envelope;
import com.jeeves.envelope.TerminalReason;

/**
 * Result of {@link EngineService#checkBounds}. Remaining counts never go below zero.
 *
 * @param terminalReason set only when the envelope cannot continue and a reason is recorded
 */
public record BoundsStatus(
        boolean canContinue,
        TerminalReason terminalReason,
        int remainingLlmCalls,
        int remainingAgentHops,
        int remainingIterations
) {

    static BoundsStatus of(Envelope envelope) {
        boolean canContinue = envelope.canContinue();
        return new BoundsStatus(
                canContinue,
                canContinue ? null : envelope.getTerminalReason().orElse(null),
                Math.max(0, envelope.getMaxLlmCalls() - envelope.getLlmCallCount()),
                Math.max(0, envelope.getMaxAgentHops() - envelope.getAgentHopCount()),
                Math.max(0, envelope.getMaxIterations() - envelope.getIteration()));
    }
}
