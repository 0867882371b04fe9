package com.jeeves.protocol.metrics;

/**
 * Collector for execution metrics, injected into the runtime and every agent.
 */
public interface ExecutionMetrics {

    /** Records nothing. */
    ExecutionMetrics NOOP = new ExecutionMetrics() {
        @Override
        public void recordAgentExecution(String agent, String status, long durationMs) {
        }

        @Override
        public void recordPipelineExecution(String pipeline, String status, long durationMs) {
        }

        @Override
        public void recordLlmCalls(String agent, int count) {
        }

        @Override
        public void recordEdgeLimitExceeded(String pipeline, String edge) {
        }
    };

    /** @param status {@code success} or {@code error} */
    void recordAgentExecution(String agent, String status, long durationMs);

    /** @param status {@code success}, {@code terminated}, {@code interrupted}, {@code cancelled} or {@code error} */
    void recordPipelineExecution(String pipeline, String status, long durationMs);

    void recordLlmCalls(String agent, int count);

    /** @param edge transition key, e.g. {@code critic->planner} */
    void recordEdgeLimitExceeded(String pipeline, String edge);
}
