package com.jeeves.protocol;

import java.util.Map;
import java.util.Optional;

/**
 * Checkpoint store keyed by thread id. The state is exactly an envelope state dict.
 */
public interface PersistenceAdapter {

    void saveState(String threadId, Map<String, Object> state);

    Optional<Map<String, Object>> loadState(String threadId);
}
