package com.rapid.analyzer.scanner;

import java.util.List;

/**
 * Everything the analysis needs to know about one line of RAPID source.
 * Code facets are only populated for {@link LineKind#CODE} lines.
 */
public record LineClassification(
        LineKind kind,

        // Module structure, detected on any line
        String moduleName,
        boolean noStepIn,
        boolean moduleEnd,

        // Procedures
        String procedureName,
        boolean procedureEnd,

        // Control flow
        boolean opensBlock,
        boolean closesBlock,
        boolean branch,

        // Names
        String declaredName,
        List<String> ioSignals,
        String dynamicPrefix,
        /** Identifiers outside comments and string literals */
        List<String> identifiers,

        boolean waitCall,
        /** TPWrite and friends: text for the pendant, never a call */
        boolean displayOnly,
        int indent) {

    public LineClassification {
        ioSignals = List.copyOf(ioSignals);
        identifiers = List.copyOf(identifiers);
    }

    static LineClassification nonCode(LineKind kind, String moduleName, boolean noStepIn, boolean moduleEnd) {
        return new LineClassification(kind, moduleName, noStepIn, moduleEnd,
                null, false, false, false, false,
                null, List.of(), null, List.of(),
                false, false, 0);
    }

    public boolean isCode() {
        return kind == LineKind.CODE;
    }

    public boolean opensModule() {
        return moduleName != null;
    }

    public boolean isProcedureHeader() {
        return procedureName != null;
    }

    public boolean isDeclaration() {
        return declaredName != null;
    }
}
