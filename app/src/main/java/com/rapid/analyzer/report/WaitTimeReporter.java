package com.rapid.analyzer.report;

import com.rapid.analyzer.core.FileScoreRecord;
import com.rapid.analyzer.core.SourceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Lists every WaitTime call with two lines of context on each side.
 */
public class WaitTimeReporter {

    private static final Logger log = LoggerFactory.getLogger(WaitTimeReporter.class);

    static final int CONTEXT_LINES = 2;

    public String render(List<FileScoreRecord> files) {
        StringBuilder out = new StringBuilder();
        boolean any = false;

        for (FileScoreRecord file : files) {
            List<Integer> waits = file.waitTimeLines();
            if (waits.isEmpty()) {
                continue;
            }
            any = true;

            List<String> lines;
            try {
                lines = SourceReader.readLines(file.filePath());
            } catch (IOException e) {
                log.warn("Cannot re-read {} for WaitTime context: {}", file.filePath(), e.getMessage());
                out.append("File: ").append(file.filePath()).append(" (unreadable)\n\n");
                continue;
            }

            out.append("File: ").append(file.filePath()).append('\n');
            for (int lineNo : waits) {
                out.append("  WaitTime at line ").append(lineNo).append(":\n");
                int start = Math.max(1, lineNo - CONTEXT_LINES);
                int end = Math.min(lines.size(), lineNo + CONTEXT_LINES);
                for (int i = start; i <= end; i++) {
                    String marker = i == lineNo ? ">" : " ";
                    out.append(String.format(Locale.ROOT, "   %s %5d: %s%n", marker, i, lines.get(i - 1)));
                }
                out.append('\n');
            }
            out.append('\n');
        }

        if (!any) {
            out.append("No WaitTime calls found in any analyzed file.\n");
        }
        return out.toString();
    }
}
