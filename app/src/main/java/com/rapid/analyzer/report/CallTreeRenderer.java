package com.rapid.analyzer.report;

import com.rapid.analyzer.core.Procedure;
import com.rapid.analyzer.graph.CallGraph;

import java.util.*;

/**
 * Renders the call graph as an indented tree rooted at MAIN.
 * Uses an explicit stack; a node already on the current path is printed once more
 * with a cycle marker and not expanded.
 */
public class CallTreeRenderer {

    static final String NO_CALLS = "No calls detected.";
    static final String CYCLE_MARKER = "(cycle detected, stopping here)";

    private record Frame(String node, int depth, boolean exit) {
    }

    public String render(CallGraph graph) {
        if (graph.isEmpty()) {
            return NO_CALLS;
        }

        List<String> roots = graph.callers().stream()
                .filter(Procedure::isEntryPointName)
                .sorted()
                .toList();

        StringBuilder out = new StringBuilder();
        if (roots.isEmpty()) {
            out.append("=== Call tree (no MAIN found; showing all roots) ===\n");
            roots = graph.callers().stream().sorted().toList();
        } else {
            out.append("=== Call tree from MAIN ===\n");
        }
        out.append('\n');

        for (String root : roots) {
            renderFrom(graph, root, out);
            out.append('\n');
        }
        return out.toString();
    }

    private void renderFrom(CallGraph graph, String root, StringBuilder out) {
        Deque<Frame> stack = new ArrayDeque<>();
        Set<String> onPath = new HashSet<>();
        stack.push(new Frame(root, 0, false));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.exit()) {
                onPath.remove(frame.node());
                continue;
            }

            String indent = "  ".repeat(frame.depth());
            out.append(frame.depth()).append(' ').append(indent).append(frame.node()).append('\n');
            if (onPath.contains(frame.node())) {
                out.append(frame.depth()).append(' ').append(indent).append(CYCLE_MARKER).append('\n');
                continue;
            }

            onPath.add(frame.node());
            stack.push(new Frame(frame.node(), frame.depth(), true));
            List<String> callees = new ArrayList<>(graph.callees(frame.node()));
            Collections.reverse(callees);
            for (String callee : callees) {
                stack.push(new Frame(callee, frame.depth() + 1, false));
            }
        }
    }
}
