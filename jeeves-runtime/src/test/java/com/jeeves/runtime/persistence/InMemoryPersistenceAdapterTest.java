package com.jeeves.runtime.persistence;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryPersistenceAdapterTest {

    @Test
    void saveState_storesIndependentCopy() {
        InMemoryPersistenceAdapter adapter = new InMemoryPersistenceAdapter();
        List<Object> order = new ArrayList<>(List.of("planner"));
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("current_stage", "planner");
        state.put("stage_order", order);

        adapter.saveState("t1", state);
        order.add("executor");
        state.put("current_stage", "executor");

        Map<String, Object> loaded = adapter.loadState("t1").orElseThrow();
        assertEquals("planner", loaded.get("current_stage"));
        assertEquals(List.of("planner"), loaded.get("stage_order"));
    }

    @Test
    void loadState_returnsCopyEachTime() {
        InMemoryPersistenceAdapter adapter = new InMemoryPersistenceAdapter();
        adapter.saveState("t1", Map.of("iteration", 1));

        adapter.loadState("t1").orElseThrow().put("iteration", 9);

        assertEquals(1, adapter.loadState("t1").orElseThrow().get("iteration"));
    }

    @Test
    void delete_removesThread() {
        InMemoryPersistenceAdapter adapter = new InMemoryPersistenceAdapter();
        adapter.saveState("t1", Map.of());
        adapter.saveState("t2", Map.of());

        adapter.delete("t1");

        assertFalse(adapter.contains("t1"));
        assertTrue(adapter.loadState("t1").isEmpty());
        assertEquals(Set.of("t2"), adapter.threadIds());
    }
}
