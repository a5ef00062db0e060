package com.rapid.analyzer.scoring;

/**
 * How a procedure was classified when looking for dead code.
 */
public enum Reachability {
    /** Reached from an entry point through static or CallByVar edges. */
    REACHABLE,
    /**
     * Named MAIN but missing from the depth map, which happens only with a depth map
     * not built from the same registry. Never penalized.
     */
    MAIN,
    /** Not reached, but its name starts with a known CallByVar prefix. */
    DYNAMIC,
    /** Dead code. */
    UNREACHABLE;

    public boolean isPenalized() {
        return this == UNREACHABLE;
    }
}
