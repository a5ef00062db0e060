package com.rapid.analyzer.report;

import com.rapid.analyzer.core.AnalysisResult;
import com.rapid.analyzer.core.FileScoreRecord;
import com.rapid.analyzer.core.Procedure;
import com.rapid.analyzer.core.SkippedFile;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text report of an analysis run.
 */
public class ConsoleReporter {

    private static final int NAMES_PER_LINE = 5;
    private static final String LIST_INDENT = "                       ";

    private final PrintStream out;

    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    public void print(AnalysisResult result) {
        if (result.isEmpty()) {
            out.println("No RAPID files found.");
            printSkipped(result.skippedFiles());
            return;
        }

        out.println("\n=== RAPID CODE ANALYSIS ===");
        for (FileScoreRecord file : result.files()) {
            out.println();
            out.print(formatFileDetails(file));
        }
        printSkipped(result.skippedFiles());
        printSummary(result);
    }

    public String formatFileDetails(FileScoreRecord r) {
        StringBuilder sb = new StringBuilder();
        line(sb, "File", r.filePath().toString());
        line(sb, "Total lines", r.totalLines());
        line(sb, "Code lines", r.codeLines());
        line(sb, "Comment lines", r.commentLines());
        line(sb, "Comment ratio", fmt("%.0f %%", r.commentRatioPercent()));
        line(sb, "Simple complexity", r.simpleComplexity());
        line(sb, "Depth complexity", r.depthComplexity());
        if (r.metrics().maxNestingLine() != null) {
            line(sb, "Max nesting depth", fmt("%d (at line %d in %s)", r.maxNesting(),
                    r.metrics().maxNestingLine(), r.metrics().maxNestingProcedure()));
        } else {
            line(sb, "Max nesting depth", r.maxNesting());
        }
        line(sb, "Max call-chain depth", r.maxCallDepth());
        line(sb, "Unreachable procs", r.unreachableCount());
        names(sb, "Names", r.unreachableProcedures());
        line(sb, "Procedures", r.procedureCount());
        line(sb, "Biggest procedure", fmt("%d (%.1f%% of code)", r.biggestProcedureLines(),
                r.biggestProcedureRatio() * 100));
        line(sb, "Unique variables", r.variableCount());
        line(sb, "Variable naming score", fmt("%.0f / 100", r.namingScore() * 100));
        line(sb, "Bad words", r.badTokens().size());
        names(sb, "Words", r.badTokens());
        line(sb, "WaitTime calls", r.waitTimeLines().size());
        names(sb, "Lines", r.waitTimeLines().stream().map(String::valueOf).toList());
        line(sb, "Unused variables", r.unusedVariables().size());
        names(sb, "Names", r.unusedVariables());
        line(sb, "Overall code score", fmt("%.0f / 100", r.score()));
        return sb.toString();
    }

    public void printSummary(AnalysisResult result) {
        out.println("\n=== PROJECT SUMMARY ===");
        out.printf(Locale.ROOT, "Files analyzed:          %d%n", result.files().size());
        out.printf(Locale.ROOT, "Total project lines:     %d%n", result.totalLines());
        out.printf(Locale.ROOT, "Average complexity:      %.0f%n", result.averageComplexity());
        out.printf(Locale.ROOT, "Average Code Score:      %.0f / 100%n", result.projectScore());
        out.printf(Locale.ROOT, "Unique variables:        %d%n%n", result.projectUniqueVariableCount());
    }

    /**
     * Header plus one tab-separated row, ready to paste into a spreadsheet.
     */
    public String summaryTsv(AnalysisResult result) {
        String header = "Files\tTotal lines\tTotal complexity\tAvg code score\tUnique variables\n";
        if (result.isEmpty()) {
            return header;
        }
        return header + fmt("%d\t%d\t%d\t%.1f\t%d%n",
                result.files().size(),
                result.totalLines(),
                result.totalComplexity(),
                result.averageScore(),
                result.projectUniqueVariableCount());
    }

    /**
     * Body of every procedure that could not be reached, for review before deletion.
     */
    public void printUnreachableCode(AnalysisResult result) {
        out.println("\n=== UNREACHABLE PROCEDURES ===");
        boolean any = false;
        for (FileScoreRecord file : result.files()) {
            for (var entry : file.procedureReachability().entrySet()) {
                if (!entry.getValue().isPenalized()) {
                    continue;
                }
                any = true;
                Procedure p = result.procedures().get(entry.getKey()).orElse(null);
                out.printf("%n%s  (%s)%n", entry.getKey(), file.filePath());
                if (p != null) {
                    p.bodyLines().forEach(l -> out.println("    " + l));
                }
            }
        }
        if (!any) {
            out.println("None.");
        }
    }

    private void printSkipped(List<SkippedFile> skipped) {
        if (skipped.isEmpty()) {
            return;
        }
        out.println("\nSkipped files:");
        for (SkippedFile s : skipped) {
            out.println("  " + s.path() + " - " + s.reason());
        }
    }

    private static void line(StringBuilder sb, String label, Object value) {
        sb.append(String.format(Locale.ROOT, "  %-22s %s%n", label + ":", value));
    }

    private static void names(StringBuilder sb, String label, List<String> values) {
        if (values.isEmpty()) {
            return;
        }
        List<String> chunk = new ArrayList<>();
        boolean first = true;
        for (int i = 0; i < values.size(); i++) {
            chunk.add(values.get(i));
            if (chunk.size() == NAMES_PER_LINE || i == values.size() - 1) {
                String prefix = first ? String.format(Locale.ROOT, "    %-20s ", label + ":") : LIST_INDENT + "  ";
                sb.append(prefix).append(String.join(", ", chunk)).append(System.lineSeparator());
                chunk.clear();
                first = false;
            }
        }
    }

    private static String fmt(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
