package com.jeeves.runtime.persistence;

import com.jeeves.envelope.DeepCopy;
import com.jeeves.protocol.PersistenceAdapter;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link PersistenceAdapter}. Useful for tests and single-process deployments; state is
 * lost when the process exits. Stored and returned states are deep copies.
 */
public final class InMemoryPersistenceAdapter implements PersistenceAdapter {

    private final Map<String, Map<String, Object>> store = new ConcurrentHashMap<>();

    @Override
    public void saveState(String threadId, Map<String, Object> state) {
        store.put(threadId, DeepCopy.copyMap(state));
    }

    @Override
    public Optional<Map<String, Object>> loadState(String threadId) {
        Map<String, Object> state = store.get(threadId);
        return state == null ? Optional.empty() : Optional.of(DeepCopy.copyMap(state));
    }

    public boolean contains(String threadId) {
        return store.containsKey(threadId);
    }

    public Set<String> threadIds() {
        return Set.copyOf(store.keySet());
    }

    public void delete(String threadId) {
        store.remove(threadId);
    }
}
