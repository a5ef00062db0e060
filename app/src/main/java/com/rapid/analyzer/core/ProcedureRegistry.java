package com.rapid.analyzer.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

/**
 * Project-wide table of procedures keyed by qualified name, with a secondary index
 * from lowercase bare name to every qualified name that shares it.
 */
public class ProcedureRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProcedureRegistry.class);

    private final Map<String, Procedure> byQualifiedName = new LinkedHashMap<>();
    private final Map<String, SortedSet<String>> byBareName = new TreeMap<>();

    public void register(Procedure procedure) {
        Procedure previous = byQualifiedName.put(procedure.qualifiedName(), procedure);
        if (previous != null && previous != procedure) {
            log.warn("Procedure {} defined again in {} (previous definition in {} is replaced)",
                    procedure.qualifiedName(), procedure.file(), previous.file());
        }
        byBareName.computeIfAbsent(bareKey(procedure.name()), k -> new TreeSet<>())
                .add(procedure.qualifiedName());
    }

    public void registerAll(Collection<Procedure> procedures) {
        procedures.forEach(this::register);
    }

    public Optional<Procedure> get(String qualifiedName) {
        return Optional.ofNullable(byQualifiedName.get(qualifiedName));
    }

    public boolean contains(String qualifiedName) {
        return byQualifiedName.containsKey(qualifiedName);
    }

    /**
     * All procedures in registration order.
     */
    public Collection<Procedure> all() {
        return Collections.unmodifiableCollection(byQualifiedName.values());
    }

    /**
     * Sorted qualified names for a bare name, matched case-insensitively.
     */
    public SortedSet<String> qualifiedNamesFor(String bareName) {
        SortedSet<String> names = byBareName.get(bareKey(bareName));
        return names == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(names);
    }

    /**
     * Lowercase bare names in lexicographic order.
     */
    public Set<String> bareNames() {
        return Collections.unmodifiableSet(byBareName.keySet());
    }

    public List<Procedure> proceduresIn(Path file) {
        return byQualifiedName.values().stream()
                .filter(p -> p.file().equals(file))
                .toList();
    }

    public int size() {
        return byQualifiedName.size();
    }

    static String bareKey(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
