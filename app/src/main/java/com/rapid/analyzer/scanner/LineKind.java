package com.rapid.analyzer.scanner;

/**
 * Coarse category of a physical line.
 */
public enum LineKind {
    /** Banner or separator comment ({@code !****}, {@code !----}); not counted at all. */
    DECORATIVE,
    COMMENT,
    BLANK,
    CODE
}
