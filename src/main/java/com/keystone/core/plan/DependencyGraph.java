package com.keystone.core.plan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Step dependency graph with Kahn's topological sort.
 */
final class DependencyGraph {

    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();

    void addStep(String stepId, Collection<String> dependsOn) {
        if (dependencies.containsKey(stepId)) {
            throw new InvalidPlanException("Duplicate step ID: " + stepId);
        }
        dependencies.put(stepId, new TreeSet<>(dependsOn));
    }

    /**
     * Returns the step IDs in a dependency-respecting order.
     *
     * @throws InvalidPlanException       if a dependency names an unknown step
     * @throws CyclicDependencyException  if the graph has a cycle
     */
    List<String> topologicalOrder() {
        var inDegree = new HashMap<String, Integer>();
        var dependents = new HashMap<String, List<String>>();
        for (var entry : dependencies.entrySet()) {
            inDegree.putIfAbsent(entry.getKey(), 0);
            for (String dep : entry.getValue()) {
                if (!dependencies.containsKey(dep)) {
                    throw new InvalidPlanException("Step " + entry.getKey() + " depends on unknown step " + dep);
                }
                if (dep.equals(entry.getKey())) {
                    throw new CyclicDependencyException(List.of(dep, dep));
                }
                inDegree.merge(entry.getKey(), 1, Integer::sum);
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(entry.getKey());
            }
        }

        var ready = new ArrayDeque<String>();
        for (String id : dependencies.keySet()) {
            if (inDegree.get(id) == 0) ready.add(id);
        }
        var order = new ArrayList<String>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() < dependencies.size()) {
            throw new CyclicDependencyException(findCycle(inDegree));
        }
        return order;
    }

    // walks dependency edges among the unsorted nodes until one repeats
    private List<String> findCycle(Map<String, Integer> inDegree) {
        String start = dependencies.keySet().stream()
                .filter(id -> inDegree.get(id) > 0)
                .findFirst()
                .orElseThrow();
        var path = new ArrayList<String>();
        String current = start;
        while (!path.contains(current)) {
            path.add(current);
            current = dependencies.get(current).stream()
                    .filter(dep -> inDegree.get(dep) > 0)
                    .findFirst()
                    .orElseThrow();
        }
        var cycle = new ArrayList<>(path.subList(path.indexOf(current), path.size()));
        cycle.add(current);
        return cycle;
    }
}
