package com.rapid.analyzer.core;

import com.rapid.analyzer.graph.CallGraph;
import com.rapid.analyzer.graph.DepthMap;

import java.util.List;

/**
 * Everything a run produces, in discovery order.
 */
public record AnalysisResult(
        List<FileScoreRecord> files,
        int projectUniqueVariableCount,
        CallGraph callGraph,
        ProcedureRegistry procedures,
        DepthMap depths,
        double projectScore,
        List<SkippedFile> skippedFiles) {

    public AnalysisResult {
        files = List.copyOf(files);
        skippedFiles = List.copyOf(skippedFiles);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int totalLines() {
        return files.stream().mapToInt(FileScoreRecord::totalLines).sum();
    }

    /**
     * Sum of simple plus depth complexity over all files.
     */
    public int totalComplexity() {
        return files.stream().mapToInt(f -> f.simpleComplexity() + f.depthComplexity()).sum();
    }

    public double averageComplexity() {
        return files.stream().mapToInt(FileScoreRecord::simpleComplexity).average().orElse(0.0);
    }

    public double averageScore() {
        return files.stream().mapToDouble(FileScoreRecord::score).average().orElse(0.0);
    }
}
