package com.rapid.analyzer.scanner;

import com.rapid.analyzer.core.FileMetrics;
import com.rapid.analyzer.core.Procedure;

import java.util.List;

/**
 * Output of the first pass for one file: its metrics and the procedures it defines.
 */
public record FileScanResult(FileMetrics metrics, List<Procedure> procedures) {

    public FileScanResult {
        procedures = List.copyOf(procedures);
    }
}
