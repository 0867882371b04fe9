package com.jeeves.pipeline.config;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adjacency view over {@code requires} and {@code after} edges (dependency -> dependent).
 * {@code runs_with} is a scheduling hint and contributes no edge.
 */
final class DependencyGraph {

    private final Map<String, List<String>> dependents = new LinkedHashMap<>();
    private final Map<String, Integer> inDegree = new LinkedHashMap<>();

    DependencyGraph(List<AgentConfig> agents) {
        for (AgentConfig a : agents) {
            dependents.putIfAbsent(a.getName(), new ArrayList<>());
            inDegree.putIfAbsent(a.getName(), 0);
        }
        for (AgentConfig a : agents) {
            List<String> deps = new ArrayList<>(a.getRequires());
            for (String s : a.getAfter()) {
                if (!deps.contains(s)) deps.add(s);
            }
            for (String dep : deps) {
                if (!dependents.containsKey(dep)) continue;
                dependents.get(dep).add(a.getName());
                inDegree.merge(a.getName(), 1, Integer::sum);
            }
        }
    }

    List<String> dependentsOf(String stage) {
        return List.copyOf(dependents.getOrDefault(stage, List.of()));
    }

    /**
     * Kahn's algorithm; ties resolve in declaration order.
     *
     * @throws PipelineConfigException when the graph has a cycle
     */
    List<String> topologicalOrder() {
        Map<String, Integer> remaining = new LinkedHashMap<>(inDegree);
        Deque<String> queue = new ArrayDeque<>();
        remaining.forEach((stage, degree) -> {
            if (degree == 0) queue.add(stage);
        });
        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String stage = queue.poll();
            order.add(stage);
            for (String next : dependents.get(stage)) {
                int d = remaining.merge(next, -1, Integer::sum);
                if (d == 0) queue.add(next);
            }
        }
        if (order.size() != remaining.size()) {
            List<String> cyclic = new ArrayList<>();
            remaining.forEach((stage, degree) -> {
                if (!order.contains(stage)) cyclic.add(stage);
            });
            throw new PipelineConfigException(null, "requires", "Dependency cycle among stages " + cyclic);
        }
        return order;
    }
}
