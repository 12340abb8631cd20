package com.stagegate.core.scheduler;

import com.stagegate.core.model.Task;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency structure of one task batch.
 * <p>
 * Edges to tasks outside the batch are external: they are not ordered here, only
 * checked against the caller's set of known ids.
 */
public final class DependencyGraph {

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, List<String>> internalDeps = new LinkedHashMap<>();
    private final Map<String, List<String>> externalDeps = new LinkedHashMap<>();

    private DependencyGraph() {
    }

    /**
     * @param batch     tasks of the stage, in plan order
     * @param knownIds  ids of tasks outside the batch that dependencies may reference
     * @throws UnknownDependencyException if a reference resolves nowhere
     */
    public static DependencyGraph of(List<Task> batch, Collection<String> knownIds) {
        var graph = new DependencyGraph();
        for (Task task : batch) {
            graph.tasks.put(task.id(), task);
        }
        for (Task task : batch) {
            var internal = new ArrayList<String>();
            var external = new ArrayList<String>();
            for (String dep : task.metadata().blockedBy()) {
                if (graph.tasks.containsKey(dep)) {
                    internal.add(dep);
                } else if (knownIds.contains(dep)) {
                    external.add(dep);
                } else {
                    throw new UnknownDependencyException(task.id(), dep);
                }
            }
            graph.internalDeps.put(task.id(), internal);
            graph.externalDeps.put(task.id(), external);
        }
        return graph;
    }

    /** Tasks with no dependency inside the batch. */
    public List<Task> independent() {
        return tasks.values().stream()
                .filter(t -> internalDeps.get(t.id()).isEmpty())
                .toList();
    }

    public List<String> internalDependencies(String taskId) {
        return internalDeps.getOrDefault(taskId, List.of());
    }

    public List<String> externalDependencies(String taskId) {
        return externalDeps.getOrDefault(taskId, List.of());
    }

    /**
     * Kahn's algorithm; ties keep batch order so the result is stable.
     *
     * @throws DependencyCycleException if the batch is not a DAG
     */
    public List<Task> topologicalOrder() {
        var remaining = new HashMap<String, Integer>();
        var dependents = new HashMap<String, List<String>>();
        for (String id : tasks.keySet()) {
            remaining.put(id, internalDeps.get(id).size());
            for (String dep : internalDeps.get(id)) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(id);
            }
        }

        var order = new ArrayList<Task>(tasks.size());
        var emitted = new HashSet<String>();
        boolean progress = true;
        while (progress) {
            progress = false;
            for (String id : tasks.keySet()) {
                if (!emitted.contains(id) && remaining.get(id) == 0) {
                    emitted.add(id);
                    order.add(tasks.get(id));
                    for (String child : dependents.getOrDefault(id, List.of())) {
                        remaining.merge(child, -1, Integer::sum);
                    }
                    progress = true;
                    break;
                }
            }
        }

        if (order.size() != tasks.size()) {
            throw new DependencyCycleException(findCycle(emitted));
        }
        return order;
    }

    private List<String> findCycle(Set<String> acyclic) {
        for (String start : tasks.keySet()) {
            if (acyclic.contains(start)) {
                continue;
            }
            var path = new ArrayList<String>();
            var onPath = new HashSet<String>();
            String current = start;
            while (current != null && onPath.add(current)) {
                path.add(current);
                String next = null;
                for (String dep : internalDeps.get(current)) {
                    if (!acyclic.contains(dep)) {
                        next = dep;
                        break;
                    }
                }
                current = next;
            }
            if (current != null) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(current), path.size()));
                cycle.add(current);
                return cycle;
            }
        }
        return List.copyOf(tasks.keySet());
    }
}
