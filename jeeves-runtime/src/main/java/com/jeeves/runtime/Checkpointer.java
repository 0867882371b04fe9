package com.jeeves.runtime;

import com.jeeves.envelope.Envelope;
import com.jeeves.protocol.PersistenceAdapter;
import com.jeeves.protocol.logging.StructuredLogger;

import java.util.Map;
import java.util.Optional;

/**
 * Saves and loads envelope state through an optional {@link PersistenceAdapter}. Save failures
 * are logged and never fail the run.
 */
final class Checkpointer {

    private final PersistenceAdapter adapter;
    private final StructuredLogger log;

    Checkpointer(PersistenceAdapter adapter, StructuredLogger log) {
        this.adapter = adapter;
        this.log = log;
    }

    boolean isEnabled() {
        return adapter != null;
    }

    void save(String threadId, Envelope envelope) {
        if (adapter == null || threadId == null || threadId.isBlank()) {
            return;
        }
        try {
            adapter.saveState(threadId, envelope.toStateDict());
        } catch (RuntimeException e) {
            log.warn("state_persist_error", "thread_id", threadId, "envelope_id", envelope.getEnvelopeId(),
                    "error", e.getMessage());
        }
    }

    Optional<Map<String, Object>> load(String threadId) {
        if (adapter == null || threadId == null || threadId.isBlank()) {
            return Optional.empty();
        }
        return adapter.loadState(threadId);
    }
}
