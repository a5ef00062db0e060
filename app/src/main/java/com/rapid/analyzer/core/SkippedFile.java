package com.rapid.analyzer.core;

import java.nio.file.Path;

/**
 * A discovered file that could not be analyzed.
 */
public record SkippedFile(Path path, String reason) {
}
