package com.rapid.analyzer.scanner;

import com.rapid.analyzer.core.AnalyzerConfig;
import com.rapid.analyzer.core.FileMetrics;
import com.rapid.analyzer.core.Procedure;
import com.rapid.analyzer.core.SourceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * First pass: walks a file line by line, counting lines and decision points,
 * collecting variable names and cutting the file into procedures.
 */
public class FileScanner {

    private static final Logger log = LoggerFactory.getLogger(FileScanner.class);

    private final LineClassifier classifier;
    private final boolean excludeNoStepInModules;

    public FileScanner(LineClassifier classifier, AnalyzerConfig config) {
        this(classifier, config.isExcludeNoStepInModules());
    }

    public FileScanner(LineClassifier classifier, boolean excludeNoStepInModules) {
        this.classifier = Objects.requireNonNull(classifier);
        this.excludeNoStepInModules = excludeNoStepInModules;
    }

    /**
     * @throws IOException when the file cannot be read or decoded
     */
    public FileScanResult scan(Path file) throws IOException {
        return scan(file, SourceReader.readLines(file));
    }

    public FileScanResult scan(Path file, List<String> lines) {
        log.debug("Analyzing file: {}", file);
        ScanState state = new ScanState(file);

        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            state.accept(classifier.classify(line), line, lineNo);
        }

        FileScanResult result = state.finish();
        if (log.isDebugEnabled()) {
            FileMetrics m = result.metrics();
            log.debug("File stats for {}: total={} code={} comments={} complexity={} maxNesting={}",
                    file.getFileName(), m.totalLines(), m.codeLines(), m.commentLines(),
                    m.simpleComplexity(), m.maxNesting());
        }
        return result;
    }

    private static String fileStem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Mutable counters for one file.
     */
    private final class ScanState {

        private final Path file;
        private final String defaultModule;

        private int totalLines;
        private int codeLines;
        private int commentLines;

        private int simpleComplexity = 1;
        private int depthComplexity = 1;
        private int nesting;
        private int maxNesting;
        private Integer maxNestingLine;
        private String maxNestingProcedure;
        private long indentSum;

        private String currentModule;
        private boolean inNoStepInModule;
        private Procedure currentProcedure;
        private final Map<String, Procedure> procedures = new LinkedHashMap<>();

        private final Set<String> variableNames = new LinkedHashSet<>();
        private final Set<String> declared = new LinkedHashSet<>();
        private final Set<String> referenced = new HashSet<>();
        private final Set<String> dynamicPrefixes = new TreeSet<>();
        private final List<Integer> waitTimeLines = new ArrayList<>();

        ScanState(Path file) {
            this.file = file;
            this.defaultModule = fileStem(file);
        }

        void accept(LineClassification c, String line, int lineNo) {
            if (!inNoStepInModule && c.opensModule()) {
                currentModule = c.moduleName();
                log.debug("  MODULE detected: {} (NOSTEPIN={})", currentModule, c.noStepIn());
                if (excludeNoStepInModules && c.noStepIn()) {
                    inNoStepInModule = true;
                    return;
                }
            }

            if (inNoStepInModule) {
                if (c.moduleEnd()) {
                    log.debug("  Leaving NOSTEPIN module {}", currentModule);
                    inNoStepInModule = false;
                    currentModule = null;
                }
                return;
            }

            if (c.moduleEnd()) {
                currentModule = null;
            }

            if (c.kind() == LineKind.DECORATIVE) {
                return;
            }

            totalLines++;

            if (c.kind() == LineKind.COMMENT) {
                commentLines++;
                return;
            }
            if (c.kind() == LineKind.BLANK) {
                return;
            }

            codeLines++;
            acceptCode(c, line, lineNo);
        }

        private void acceptCode(LineClassification c, String line, int lineNo) {
            if (c.waitCall()) {
                waitTimeLines.add(lineNo);
            }

            if (!c.isDeclaration()) {
                referenced.addAll(c.identifiers());
            }

            indentSum += c.indent();

            if (c.isDeclaration()) {
                variableNames.add(c.declaredName());
                declared.add(c.declaredName());
                log.trace("  Declared variable found: {}", c.declaredName());
            }
            for (String signal : c.ioSignals()) {
                variableNames.add(signal);
                log.trace("  IO signal found: {}", signal);
            }
            if (c.dynamicPrefix() != null) {
                dynamicPrefixes.add(c.dynamicPrefix());
            }

            if (c.isProcedureHeader()) {
                String module = currentModule != null ? currentModule : defaultModule;
                currentProcedure = new Procedure(module, file, c.procedureName());
                procedures.put(currentProcedure.qualifiedName(), currentProcedure);
                log.debug("  PROC/FUNC detected: {}", currentProcedure.qualifiedName());
                return;
            }

            if (c.procedureEnd()) {
                currentProcedure = null;
            }

            if (c.closesBlock()) {
                nesting = Math.max(nesting - 1, 0);
            }
            if (c.opensBlock()) {
                simpleComplexity++;
                nesting++;
                if (nesting > maxNesting) {
                    maxNesting = nesting;
                    maxNestingLine = lineNo;
                    maxNestingProcedure = currentProcedure != null ? currentProcedure.qualifiedName() : null;
                }
                depthComplexity += nesting;
            }
            if (c.branch()) {
                simpleComplexity++;
                depthComplexity += nesting;
            }

            if (currentProcedure != null) {
                currentProcedure.addLine(line);
            }
        }

        FileScanResult finish() {
            double averageIndent = totalLines > 0 ? (double) indentSum / totalLines : 0.0;
            FileMetrics metrics = new FileMetrics(
                    file,
                    totalLines,
                    codeLines,
                    commentLines,
                    simpleComplexity,
                    Math.max(depthComplexity, simpleComplexity),
                    maxNesting,
                    maxNestingLine,
                    maxNestingProcedure,
                    indentSum,
                    averageIndent,
                    variableNames,
                    declared,
                    referenced,
                    dynamicPrefixes,
                    waitTimeLines,
                    new ArrayList<>(procedures.keySet()));
            return new FileScanResult(metrics, new ArrayList<>(procedures.values()));
        }
    }
}
