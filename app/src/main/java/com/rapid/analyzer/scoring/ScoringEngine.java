package com.rapid.analyzer.scoring;

import com.rapid.analyzer.core.AnalyzerConfig;
import com.rapid.analyzer.core.FileMetrics;
import com.rapid.analyzer.core.FileScoreRecord;
import com.rapid.analyzer.core.Procedure;
import com.rapid.analyzer.core.ProcedureRegistry;
import com.rapid.analyzer.graph.DepthMap;
import com.rapid.analyzer.naming.NamingScore;
import com.rapid.analyzer.naming.NamingScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Third pass: turns metrics, call depths and naming quality into a 0-100 score per file.
 * Every penalty is floored at zero and capped on its own; the file score is 100 minus their sum,
 * clamped to [0, 100].
 */
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    static final double MAX_SCORE = 100.0;

    // Comment ratio curve: ramp up to 6 %, plateau to 25 %, down to zero at 60 %
    static final double COMMENT_RAMP_END = 0.06;
    static final double COMMENT_PLATEAU_END = 0.25;
    static final double COMMENT_ZERO_AT = 0.60;

    // Comment penalty is 5 - health * 100 * 0.05, i.e. 0..5 points
    static final double COMMENT_PENALTY_BASE = 5.0;
    static final double COMMENT_PENALTY_WEIGHT = 0.05;

    private final AnalyzerConfig config;
    private final NamingScorer namingScorer;

    public ScoringEngine(AnalyzerConfig config, NamingScorer namingScorer) {
        this.config = Objects.requireNonNull(config);
        this.namingScorer = Objects.requireNonNull(namingScorer);
    }

    /**
     * Health of a comment ratio in [0, 1]: 0 with no comments, 1 between 6 % and 25 %,
     * falling linearly to 0 at 60 %.
     */
    public static double commentHealth(double commentRatio) {
        if (commentRatio <= 0.0) {
            return 0.0;
        }
        if (commentRatio < COMMENT_RAMP_END) {
            return commentRatio / COMMENT_RAMP_END;
        }
        if (commentRatio <= COMMENT_PLATEAU_END) {
            return 1.0;
        }
        if (commentRatio >= COMMENT_ZERO_AT) {
            return 0.0;
        }
        return 1.0 - (commentRatio - COMMENT_PLATEAU_END) / (COMMENT_ZERO_AT - COMMENT_PLATEAU_END);
    }

    public List<FileScoreRecord> scoreAll(
            List<FileMetrics> files,
            ProcedureRegistry registry,
            DepthMap depths,
            Set<String> dynamicPrefixes,
            Set<String> projectReferencedIdentifiers) {
        List<FileScoreRecord> results = new ArrayList<>(files.size());
        for (FileMetrics metrics : files) {
            results.add(score(metrics, registry.proceduresIn(metrics.filePath()), depths,
                    dynamicPrefixes, projectReferencedIdentifiers));
        }
        return results;
    }

    public FileScoreRecord score(
            FileMetrics metrics,
            List<Procedure> procedures,
            DepthMap depths,
            Set<String> dynamicPrefixes,
            Set<String> projectReferencedIdentifiers) {

        List<String> unusedVariables = metrics.declaredVariables().stream()
                .filter(name -> !projectReferencedIdentifiers.contains(name))
                .sorted()
                .toList();

        double commentRatio = metrics.totalLines() > 0
                ? (double) metrics.commentLines() / metrics.totalLines()
                : 0.0;
        double commentHealth = commentHealth(commentRatio);

        NamingScore naming = namingScorer.score(metrics.variableNames());

        // Procedures
        int biggestProcedureLines = 0;
        int procedureLineSum = 0;
        int maxCallDepth = 0;
        Map<String, Reachability> reachability = new LinkedHashMap<>();
        List<String> unreachable = new ArrayList<>();

        for (Procedure p : procedures) {
            procedureLineSum += p.codeLines();
            biggestProcedureLines = Math.max(biggestProcedureLines, p.codeLines());

            Reachability r = classify(p, depths, dynamicPrefixes);
            reachability.put(p.qualifiedName(), r);
            if (r == Reachability.REACHABLE) {
                maxCallDepth = Math.max(maxCallDepth, depths.depthOf(p.qualifiedName()).orElse(0));
            } else if (r.isPenalized()) {
                unreachable.add(p.name());
            }
        }

        int denominator = metrics.codeLines() > 0 ? metrics.codeLines() : Math.max(procedureLineSum, 1);
        double biggestProcedureRatio = (double) biggestProcedureLines / denominator;

        Penalties penalties = penalties(metrics, procedures.size(), biggestProcedureRatio, maxCallDepth,
                unusedVariables.size(), naming.badTokenCount(), commentHealth);
        double score = Math.max(0.0, Math.min(MAX_SCORE, MAX_SCORE - penalties.total()));

        if (log.isDebugEnabled()) {
            log.debug("Scores for {}: comments={}%, naming={}, maxCallDepth={}, procs={}, biggestRatio={}, "
                            + "penalties={} => {}",
                    metrics.filePath().getFileName(),
                    String.format(Locale.ROOT, "%.1f", commentRatio * 100),
                    String.format(Locale.ROOT, "%.3f", naming.score()),
                    maxCallDepth, procedures.size(),
                    String.format(Locale.ROOT, "%.3f", biggestProcedureRatio),
                    penalties, String.format(Locale.ROOT, "%.2f", score));
        }

        return new FileScoreRecord(
                metrics,
                commentRatio,
                commentHealth,
                naming.score(),
                new ArrayList<>(naming.badTokens()),
                procedures.size(),
                biggestProcedureLines,
                biggestProcedureRatio,
                maxCallDepth,
                reachability,
                unreachable,
                unusedVariables,
                penalties,
                score);
    }

    Reachability classify(Procedure procedure, DepthMap depths, Set<String> dynamicPrefixes) {
        if (depths.isReachable(procedure.qualifiedName())) {
            return Reachability.REACHABLE;
        }
        String lowerName = procedure.name().toLowerCase(Locale.ROOT);
        if (lowerName.equals("main")) {
            return Reachability.MAIN;
        }
        for (String prefix : dynamicPrefixes) {
            if (lowerName.startsWith(prefix)) {
                return Reachability.DYNAMIC;
            }
        }
        return Reachability.UNREACHABLE;
    }

    Penalties penalties(FileMetrics metrics, int procedureCount, double biggestProcedureRatio,
                        int maxCallDepth, int unusedVariableCount, int badTokenCount, double commentHealth) {
        int totalLines = metrics.totalLines();

        double procedureSize = 0.0;
        PenaltyRule sizeRule = config.getProcedureSizePenalty();
        if (biggestProcedureRatio > sizeRule.threshold() && totalLines > config.getProcedureSizeMinTotalLines()) {
            procedureSize = sizeRule.apply(biggestProcedureRatio);
        }

        double fileSize = 0.0;
        PenaltyRule fileRule = config.getFileSizePenalty();
        if (totalLines > fileRule.threshold() && procedureCount > 1) {
            fileSize = fileRule.apply(totalLines);
        }

        double comments = COMMENT_PENALTY_BASE - commentHealth * MAX_SCORE * COMMENT_PENALTY_WEIGHT;

        return new Penalties(
                config.getComplexityPenalty().apply(metrics.simpleComplexity()),
                config.getNestingPenalty().apply(metrics.maxNesting()),
                config.getCallDepthPenalty().apply(maxCallDepth),
                config.getProcedureCountPenalty().apply(procedureCount),
                procedureSize,
                fileSize,
                config.getUnusedVariablePenalty().apply(unusedVariableCount),
                config.getBadWordPenalty().apply(badTokenCount),
                Math.max(0.0, comments));
    }

    /**
     * Mean file score, capped at the mean of the worst few files plus a margin
     * so that a handful of clean files cannot hide a poor project.
     */
    public double projectScore(List<FileScoreRecord> files) {
        if (files.isEmpty()) {
            return 0.0;
        }
        double mean = files.stream().mapToDouble(FileScoreRecord::score).average().orElse(0.0);
        double worstMean = files.stream()
                .mapToDouble(FileScoreRecord::score)
                .sorted()
                .limit(config.getWorstFileCount())
                .average()
                .orElse(mean);
        return Math.min(mean, worstMean + config.getWorstFileMargin());
    }
}
