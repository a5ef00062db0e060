package com.rapid.analyzer.report;

import com.rapid.analyzer.core.FileScoreRecord;
import com.rapid.analyzer.scoring.Penalties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class CsvReporter {

    private static final Logger log = LoggerFactory.getLogger(CsvReporter.class);

    static final String HEADER = "File,Total Lines,Code Lines,Comment Lines,Comment Ratio %,Simple Complexity,"
            + "Depth Complexity,Max Nesting,Max Call Depth,Procedures,Biggest Procedure,Biggest Ratio,"
            + "Variables,Naming Score,Bad Words,Unreachable,Unused Variables,WaitTime Calls,"
            + "Complexity Penalty,Nesting Penalty,Call Depth Penalty,Procedure Count Penalty,"
            + "Procedure Size Penalty,File Size Penalty,Unused Variable Penalty,Bad Word Penalty,"
            + "Comment Penalty,Score,Unreachable Procedures\n";

    public void generate(List<FileScoreRecord> data, Path outputPath) throws IOException {
        Files.writeString(outputPath, toCsv(data));
        log.info("CSV report generated at: {}", outputPath.toAbsolutePath());
    }

    public String toCsv(List<FileScoreRecord> data) {
        StringBuilder csv = new StringBuilder(HEADER);

        for (FileScoreRecord d : data) {
            Penalties p = d.penalties();
            csv.append(String.format(Locale.ROOT,
                    "%s,%d,%d,%d,%.1f,%d,%d,%d,%d,%d,%d,%.3f,%d,%.1f,%d,%d,%d,%d,"
                            + "%.2f,%.2f,%.2f,%.2f,%.2f,%.2f,%.2f,%.2f,%.2f,%.1f,%s\n",
                    escape(d.filePath().toString()),
                    d.totalLines(),
                    d.codeLines(),
                    d.commentLines(),
                    d.commentRatioPercent(),
                    d.simpleComplexity(),
                    d.depthComplexity(),
                    d.maxNesting(),
                    d.maxCallDepth(),
                    d.procedureCount(),
                    d.biggestProcedureLines(),
                    d.biggestProcedureRatio(),
                    d.variableCount(),
                    d.namingScore() * 100,
                    d.badTokens().size(),
                    d.unreachableCount(),
                    d.unusedVariables().size(),
                    d.waitTimeLines().size(),
                    p.complexity(),
                    p.nesting(),
                    p.callDepth(),
                    p.procedureCount(),
                    p.procedureSize(),
                    p.fileSize(),
                    p.unusedVariables(),
                    p.badWords(),
                    p.comments(),
                    d.score(),
                    escape(String.join(";", d.unreachableProcedures()))));
        }
        return csv.toString();
    }

    private String escape(String s) {
        if (s == null)
            return "";
        if (s.contains(",") || s.contains("\"")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
