package com.rapid.analyzer.core;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * First-pass facts for a single RAPID file.
 */
public record FileMetrics(
        Path filePath,

        /** Counted lines, excluding decorative banners and NOSTEPIN modules */
        int totalLines,
        int codeLines,
        int commentLines,

        /** 1 + every IF/FOR/WHILE/TEST/ELSEIF/CASE */
        int simpleComplexity,

        /** 1 + nesting level of every decision point, at least simpleComplexity */
        int depthComplexity,

        int maxNesting,
        /** Line of the first block reaching maxNesting, null when nothing nests */
        Integer maxNestingLine,
        /** Qualified name of the procedure holding that block, may be null */
        String maxNestingProcedure,

        long indentSum,
        double averageIndent,

        /** Declarations plus Set/Reset/Switch/SetDO/ResetDO targets */
        Set<String> variableNames,
        Set<String> declaredVariables,
        /** Identifiers on non-declaration code lines */
        Set<String> referencedIdentifiers,
        /** Lowercase CallByVar name prefixes */
        Set<String> dynamicPrefixes,
        List<Integer> waitTimeLines,
        List<String> procedureNames) {

    public FileMetrics {
        variableNames = ordered(variableNames);
        declaredVariables = ordered(declaredVariables);
        referencedIdentifiers = ordered(referencedIdentifiers);
        dynamicPrefixes = ordered(dynamicPrefixes);
        waitTimeLines = List.copyOf(waitTimeLines);
        procedureNames = List.copyOf(procedureNames);
    }

    private static Set<String> ordered(Set<String> names) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }
}
