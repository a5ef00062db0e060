package com.rapid.analyzer.graph;

import java.util.*;

/**
 * Directed call edges between qualified procedure names. Cycles are allowed.
 */
public class CallGraph {

    private final Map<String, SortedSet<String>> edges = new LinkedHashMap<>();

    /**
     * @return true if the edge was new
     */
    public boolean addEdge(String caller, String callee) {
        return edges.computeIfAbsent(caller, k -> new TreeSet<>()).add(callee);
    }

    public SortedSet<String> callees(String caller) {
        SortedSet<String> callees = edges.get(caller);
        return callees == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(callees);
    }

    /**
     * Procedures with at least one outgoing edge, in the order they were first seen.
     */
    public Set<String> callers() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    public boolean hasEdge(String caller, String callee) {
        return callees(caller).contains(callee);
    }

    public int edgeCount() {
        return edges.values().stream().mapToInt(Set::size).sum();
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    public Map<String, SortedSet<String>> asMap() {
        return Collections.unmodifiableMap(edges);
    }
}
