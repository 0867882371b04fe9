package com.jeeves.agent;

import com.jeeves.envelope.Envelope;

import java.util.Map;

/**
 * Runs after the output is stored and before routing. May re-validate and reject the output
 * by throwing.
 */
@FunctionalInterface
public interface PostProcessHook {

    void afterProcess(Envelope envelope, Map<String, Object> output) throws Exception;
}
