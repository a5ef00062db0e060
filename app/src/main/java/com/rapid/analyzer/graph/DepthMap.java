package com.rapid.analyzer.graph;

import java.util.*;

/**
 * Shortest call distance from the nearest entry point.
 * A procedure without an entry was not reached.
 */
public class DepthMap {

    private final Map<String, Integer> depths;
    private final List<String> entryPoints;

    DepthMap(Map<String, Integer> depths, List<String> entryPoints) {
        this.depths = Collections.unmodifiableMap(new LinkedHashMap<>(depths));
        this.entryPoints = List.copyOf(entryPoints);
    }

    public static DepthMap empty() {
        return new DepthMap(Map.of(), List.of());
    }

    /**
     * Depths as given; entry points are the procedures at depth 0.
     */
    public static DepthMap of(Map<String, Integer> depths) {
        List<String> entries = depths.entrySet().stream()
                .filter(e -> e.getValue() == 0)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
        return new DepthMap(depths, entries);
    }

    public OptionalInt depthOf(String qualifiedName) {
        Integer depth = depths.get(qualifiedName);
        return depth == null ? OptionalInt.empty() : OptionalInt.of(depth);
    }

    public boolean isReachable(String qualifiedName) {
        return depths.containsKey(qualifiedName);
    }

    public List<String> entryPoints() {
        return entryPoints;
    }

    public boolean isEmpty() {
        return depths.isEmpty();
    }

    public int size() {
        return depths.size();
    }

    public Map<String, Integer> asMap() {
        return depths;
    }
}
