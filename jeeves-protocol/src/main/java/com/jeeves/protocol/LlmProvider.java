package com.jeeves.protocol;

import java.util.Map;

/**
 * Contract for a text-generation backend. Agents depend on this only; adapters for concrete
 * model servers are supplied by the caller.
 */
@FunctionalInterface
public interface LlmProvider {

    /**
     * Generates a completion.
     *
     * @param model   model or role name (e.g. {@code planner}, {@code default})
     * @param prompt  full prompt text
     * @param options generation options (e.g. {@code temperature}, {@code num_predict}, {@code top_p})
     * @param signal  fires when the run is cancelled or the stage timed out; implementations that
     *                block should stop waiting and throw {@link StageAbortedException}
     * @return raw completion text
     * @throws Exception on provider failure ({@link LlmProviderException} preferred)
     */
    String generate(String model, String prompt, Map<String, Object> options, CancellationSignal signal)
            throws Exception;

    /** Convenience: generate without a cancellation signal. */
    default String generate(String model, String prompt, Map<String, Object> options) throws Exception {
        return generate(model, prompt, options, CancellationSignal.none());
    }
}
