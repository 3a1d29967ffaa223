package com.iimsoft.timeline.service;

import com.iimsoft.timeline.domain.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency adjacency of the chart's tasks.
 *
 * <p>The forward map lists, for every task id, the tasks that depend on it. The ancestor map lists the
 * dependencies of every task; {@link #ancestors(String)} closes it transitively. Both traversals are
 * iterative and keep a visited set, so cyclic input terminates.
 *
 * <p>The graph is rebuilt as a whole by {@link #build(List)}; there is no incremental update.
 */
public class DependencyGraph {

    private final Map<String, List<String>> dependents = new LinkedHashMap<>();
    private final Map<String, List<String>> parents = new LinkedHashMap<>();

    public DependencyGraph() {
    }

    public DependencyGraph(List<Task> tasks) {
        build(tasks);
    }

    public void build(List<Task> tasks) {
        dependents.clear();
        parents.clear();
        for (Task t : tasks) {
            for (String d : t.getDependencies()) {
                dependents.computeIfAbsent(d, k -> new ArrayList<>()).add(t.getId());
                parents.computeIfAbsent(t.getId(), k -> new ArrayList<>()).add(d);
            }
        }
    }

    /** Direct dependents of {@code id}. */
    public List<String> dependents(String id) {
        return Collections.unmodifiableList(dependents.getOrDefault(id, Collections.emptyList()));
    }

    public boolean hasDescendants(String id) {
        return !dependents.getOrDefault(id, Collections.emptyList()).isEmpty();
    }

    /**
     * Every task reachable through the forward map, breadth first, excluding {@code id} itself.
     */
    public Set<String> descendants(String id) {
        return closure(id, dependents);
    }

    /**
     * Every transitive dependency of {@code id}, breadth first, excluding {@code id} itself.
     */
    public List<String> ancestors(String id) {
        return new ArrayList<>(closure(id, parents));
    }

    private static Set<String> closure(String id, Map<String, List<String>> edges) {
        Set<String> out = new LinkedHashSet<>();
        Set<String> seen = new LinkedHashSet<>();
        seen.add(id);
        Deque<String> toProcess = new ArrayDeque<>();
        toProcess.add(id);
        while (!toProcess.isEmpty()) {
            String current = toProcess.poll();
            for (String next : edges.getOrDefault(current, Collections.emptyList())) {
                if (seen.add(next)) {
                    out.add(next);
                    toProcess.add(next);
                }
            }
        }
        return out;
    }
}
