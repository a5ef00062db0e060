package com.rapid.analyzer.graph;

import com.rapid.analyzer.core.AnalyzerConfig.DynamicDispatchMode;
import com.rapid.analyzer.core.Procedure;
import com.rapid.analyzer.core.ProcedureRegistry;
import com.rapid.analyzer.scanner.LineClassification;
import com.rapid.analyzer.scanner.LineClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Second pass: links every procedure to the procedures its body mentions.
 * <p>
 * A static reference links to every module's procedure with that bare name.
 * {@code CallByVar "Prefix", n} links to procedures whose name starts with the prefix,
 * either all of them or one representative depending on {@link DynamicDispatchMode}.
 */
public class CallGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(CallGraphBuilder.class);

    private final LineClassifier classifier;
    private final DynamicDispatchMode dispatchMode;

    public CallGraphBuilder(LineClassifier classifier, DynamicDispatchMode dispatchMode) {
        this.classifier = Objects.requireNonNull(classifier);
        this.dispatchMode = Objects.requireNonNull(dispatchMode);
    }

    public CallGraph build(ProcedureRegistry registry) {
        CallGraph graph = new CallGraph();

        for (Procedure procedure : registry.all()) {
            String caller = procedure.qualifiedName();
            for (String line : procedure.bodyLines()) {
                LineClassification c = classifier.classify(line);
                if (!c.isCode() || c.displayOnly()) {
                    continue;
                }

                for (String identifier : c.identifiers()) {
                    for (String callee : registry.qualifiedNamesFor(identifier)) {
                        if (graph.addEdge(caller, callee)) {
                            log.trace("  Static call: {} -> {} (from '{}')", caller, callee, identifier);
                        }
                    }
                }

                if (c.dynamicPrefix() != null) {
                    Set<String> targets = resolveDynamic(c.dynamicPrefix(), registry);
                    if (targets.isEmpty()) {
                        log.debug("  CallByVar '{}' in {} has no matching procedures", c.dynamicPrefix(), caller);
                    }
                    for (String callee : targets) {
                        if (graph.addEdge(caller, callee)) {
                            log.trace("  CallByVar '{}' treated as call: {} -> {}", c.dynamicPrefix(), caller, callee);
                        }
                    }
                }
            }
        }

        log.debug("Call graph: {} callers, {} edges", graph.callers().size(), graph.edgeCount());
        return graph;
    }

    /**
     * Qualified names a CallByVar prefix may reach.
     */
    public SortedSet<String> resolveDynamic(String prefix, ProcedureRegistry registry) {
        String lowerPrefix = prefix.toLowerCase(Locale.ROOT);
        SortedSet<String> targets = new TreeSet<>();

        // bareNames() is sorted, so the first match is the lexicographically first name
        for (String bareName : registry.bareNames()) {
            if (!bareName.startsWith(lowerPrefix)) {
                continue;
            }
            SortedSet<String> qualified = registry.qualifiedNamesFor(bareName);
            if (dispatchMode == DynamicDispatchMode.FIRST_VARIANT) {
                targets.add(qualified.first());
                return targets;
            }
            targets.addAll(qualified);
        }
        return targets;
    }
}
