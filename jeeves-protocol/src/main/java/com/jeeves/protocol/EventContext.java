package com.jeeves.protocol;

/**
 * Receives agent lifecycle events. Implementations must be thread-safe: parallel rounds emit
 * from several workers at once.
 */
public interface EventContext {

    /** Discards every event. */
    EventContext NOOP = new EventContext() {
        @Override
        public void agentStarted(String agent) {
        }

        @Override
        public void agentCompleted(String agent, String status, long durationMs, String error) {
        }
    };

    void agentStarted(String agent);

    /**
     * @param status {@code success} or {@code error}
     * @param error  error message; null on success
     */
    void agentCompleted(String agent, String status, long durationMs, String error);
}
