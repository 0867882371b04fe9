package com.jeeves.agent;

import com.jeeves.envelope.Envelope;

/**
 * Runs before main processing. May mutate the envelope; throwing fails the invocation with
 * {@link AgentProcessingException#HOOK_ERROR}.
 */
@FunctionalInterface
public interface PreProcessHook {

    void beforeProcess(Envelope envelope) throws Exception;
}
