package com.rapid.analyzer.scoring;

/**
 * Individual penalty contributions for one file, in score points.
 */
public record Penalties(
        double complexity,
        double nesting,
        double callDepth,
        double procedureCount,
        double procedureSize,
        double fileSize,
        double unusedVariables,
        double badWords,
        double comments) {

    public static Penalties none() {
        return new Penalties(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public double total() {
        return complexity + nesting + callDepth + procedureCount + procedureSize
                + fileSize + unusedVariables + badWords + comments;
    }
}
