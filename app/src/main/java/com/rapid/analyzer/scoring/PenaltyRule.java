package com.rapid.analyzer.scoring;

/**
 * A linear penalty: every unit above {@code threshold} costs {@code weight} points,
 * never less than zero and never more than {@code cap}.
 */
public record PenaltyRule(double threshold, double weight, double cap) {

    public static PenaltyRule capped(double threshold, double weight, double cap) {
        return new PenaltyRule(threshold, weight, cap);
    }

    public static PenaltyRule uncapped(double threshold, double weight) {
        return new PenaltyRule(threshold, weight, Double.POSITIVE_INFINITY);
    }

    public double apply(double value) {
        return Math.min(cap, Math.max(0.0, (value - threshold) * weight));
    }

    public boolean isCapped() {
        return !Double.isInfinite(cap);
    }
}
