package com.rapid.analyzer.graph;

import com.rapid.analyzer.core.Procedure;
import com.rapid.analyzer.core.ProcedureRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Breadth-first search from every MAIN procedure at once.
 * Each procedure keeps the depth at which it was first reached, so recursion cannot inflate it.
 */
public class ReachabilityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityAnalyzer.class);

    public DepthMap analyze(CallGraph graph, ProcedureRegistry registry) {
        List<String> entryPoints = findEntryPoints(graph, registry);
        if (entryPoints.isEmpty()) {
            log.info("No MAIN procedure found, call depths are unknown");
            return DepthMap.empty();
        }

        Map<String, Integer> depth = new LinkedHashMap<>();
        Queue<String> queue = new ArrayDeque<>();
        for (String entry : entryPoints) {
            depth.put(entry, 0);
            queue.add(entry);
        }

        while (!queue.isEmpty()) {
            String node = queue.poll();
            int nodeDepth = depth.get(node);
            for (String callee : graph.callees(node)) {
                if (!depth.containsKey(callee)) {
                    depth.put(callee, nodeDepth + 1);
                    queue.add(callee);
                }
            }
        }

        if (log.isDebugEnabled()) {
            depth.forEach((proc, d) -> log.debug("  {} -> depth {}", proc, d));
        }
        return new DepthMap(depth, entryPoints);
    }

    /**
     * MAIN procedures from the registry plus any MAIN-named caller in the graph, sorted.
     */
    public List<String> findEntryPoints(CallGraph graph, ProcedureRegistry registry) {
        SortedSet<String> entries = new TreeSet<>();
        for (Procedure procedure : registry.all()) {
            if (procedure.isEntryPoint()) {
                entries.add(procedure.qualifiedName());
            }
        }
        for (String caller : graph.callers()) {
            if (Procedure.isEntryPointName(caller)) {
                entries.add(caller);
            }
        }
        return new ArrayList<>(entries);
    }
}
