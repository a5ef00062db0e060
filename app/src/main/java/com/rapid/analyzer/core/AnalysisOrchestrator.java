package com.rapid.analyzer.core;

import com.rapid.analyzer.graph.CallGraph;
import com.rapid.analyzer.graph.CallGraphBuilder;
import com.rapid.analyzer.graph.DepthMap;
import com.rapid.analyzer.graph.ReachabilityAnalyzer;
import com.rapid.analyzer.naming.NamingScorer;
import com.rapid.analyzer.naming.WordOracle;
import com.rapid.analyzer.scanner.FileScanResult;
import com.rapid.analyzer.scanner.FileScanner;
import com.rapid.analyzer.scanner.LineClassifier;
import com.rapid.analyzer.scanner.RapidLineClassifier;
import com.rapid.analyzer.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the three passes over a folder of RAPID files.
 * <ol>
 * <li>Scan every file and fill the project-wide procedure registry.</li>
 * <li>Build the call graph and compute depths from MAIN; this needs the complete registry.</li>
 * <li>Score each file.</li>
 * </ol>
 */
public class AnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private final AnalyzerConfig config;
    private final FileScanner scanner;
    private final CallGraphBuilder graphBuilder;
    private final ReachabilityAnalyzer reachabilityAnalyzer;
    private final ScoringEngine scoringEngine;

    public AnalysisOrchestrator(AnalyzerConfig config, WordOracle oracle) {
        this(config, new RapidLineClassifier(), oracle);
    }

    public AnalysisOrchestrator(AnalyzerConfig config, LineClassifier classifier, WordOracle oracle) {
        this.config = Objects.requireNonNull(config);
        this.scanner = new FileScanner(classifier, config);
        this.graphBuilder = new CallGraphBuilder(classifier, config.getDynamicDispatchMode());
        this.reachabilityAnalyzer = new ReachabilityAnalyzer();
        this.scoringEngine = new ScoringEngine(config, new NamingScorer(oracle));
    }

    /**
     * Analyze every RAPID file below {@code root}.
     *
     * @throws IllegalArgumentException if root is not a directory
     * @throws IOException              if the folder cannot be listed
     */
    public AnalysisResult analyze(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("'" + root + "' is not a valid directory");
        }
        return analyzeFiles(discover(root));
    }

    /**
     * Recursively list analyzable files in sorted order.
     */
    public List<Path> discover(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(config::isSourceFile)
                    .filter(p -> !config.shouldExclude(root.relativize(p)))
                    .sorted()
                    .toList();
        }
    }

    public AnalysisResult analyzeFiles(List<Path> files) {
        log.info("Pass 1: scanning {} files", files.size());
        ProcedureRegistry registry = new ProcedureRegistry();
        List<FileMetrics> scanned = new ArrayList<>();
        List<SkippedFile> skipped = new ArrayList<>();

        for (Path file : files) {
            try {
                FileScanResult result = scanner.scan(file);
                scanned.add(result.metrics());
                registry.registerAll(result.procedures());
            } catch (IOException e) {
                log.warn("Skipping {}: {}", file, e.getMessage());
                skipped.add(new SkippedFile(file, describe(e)));
            }
        }

        Set<String> dynamicPrefixes = new TreeSet<>();
        Set<String> referenced = new HashSet<>();
        Set<String> variables = new HashSet<>();
        for (FileMetrics metrics : scanned) {
            dynamicPrefixes.addAll(metrics.dynamicPrefixes());
            referenced.addAll(metrics.referencedIdentifiers());
            variables.addAll(metrics.variableNames());
        }

        log.info("Pass 2: building call graph over {} procedures", registry.size());
        CallGraph callGraph = graphBuilder.build(registry);
        DepthMap depths = reachabilityAnalyzer.analyze(callGraph, registry);

        log.info("Pass 3: scoring {} files", scanned.size());
        List<FileScoreRecord> scores = scoringEngine.scoreAll(scanned, registry, depths, dynamicPrefixes, referenced);
        double projectScore = scoringEngine.projectScore(scores);

        if (!skipped.isEmpty()) {
            log.warn("{} file(s) skipped: {}", skipped.size(),
                    skipped.stream().map(s -> s.path().getFileName().toString()).collect(Collectors.joining(", ")));
        }

        return new AnalysisResult(scores, variables.size(), callGraph, registry, depths, projectScore, skipped);
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
