package com.rapid.analyzer.core;

import com.rapid.analyzer.scoring.Penalties;
import com.rapid.analyzer.scoring.Reachability;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final per-file result handed to reporters.
 * Carries the first-pass metrics plus every derived value so that nothing needs recomputing.
 * Procedures keep the order in which they appear in the file.
 */
public record FileScoreRecord(
        FileMetrics metrics,

        // Comments
        double commentRatio,
        double commentHealth,

        // Naming
        double namingScore,
        List<String> badTokens,

        // Procedures
        int procedureCount,
        int biggestProcedureLines,
        double biggestProcedureRatio,
        int maxCallDepth,
        Map<String, Reachability> procedureReachability,
        List<String> unreachableProcedures,

        // Variables
        List<String> unusedVariables,

        // Composite
        Penalties penalties,
        double score) {

    public FileScoreRecord {
        badTokens = List.copyOf(badTokens);
        procedureReachability = Collections.unmodifiableMap(new LinkedHashMap<>(procedureReachability));
        unreachableProcedures = List.copyOf(unreachableProcedures);
        unusedVariables = List.copyOf(unusedVariables);
    }

    public Path filePath() {
        return metrics.filePath();
    }

    public int totalLines() {
        return metrics.totalLines();
    }

    public int codeLines() {
        return metrics.codeLines();
    }

    public int commentLines() {
        return metrics.commentLines();
    }

    public int simpleComplexity() {
        return metrics.simpleComplexity();
    }

    public int depthComplexity() {
        return metrics.depthComplexity();
    }

    public int maxNesting() {
        return metrics.maxNesting();
    }

    public int variableCount() {
        return metrics.variableNames().size();
    }

    public List<Integer> waitTimeLines() {
        return metrics.waitTimeLines();
    }

    public int unreachableCount() {
        return unreachableProcedures.size();
    }

    public double commentRatioPercent() {
        return commentRatio * 100.0;
    }
}
