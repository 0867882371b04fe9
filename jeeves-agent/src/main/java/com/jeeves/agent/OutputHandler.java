package com.jeeves.agent;

import com.jeeves.envelope.Envelope;

import java.util.Map;

/**
 * Produces an agent's output without an LLM or tools. Used for mock output and for the main
 * step of service agents.
 */
@FunctionalInterface
public interface OutputHandler {

    Map<String, Object> produce(Envelope envelope) throws Exception;
}
