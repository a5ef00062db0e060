package com.rapid.analyzer.scanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-level classifier for ABB RAPID.
 * Keywords are matched case-insensitively and names may use any Unicode letters.
 */
public class RapidLineClassifier implements LineClassifier {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
            | Pattern.UNICODE_CHARACTER_CLASS;

    /** A name starts with a letter, then letters, digits or underscores. */
    private static final String NAME = "[^\\W\\d_]\\w*";

    private static final Pattern MODULE = Pattern.compile("^\\s*MODULE\\s+(" + NAME + ")", FLAGS);
    private static final Pattern PROC = Pattern.compile("^\\s*(?:LOCAL\\s+)?PROC\\s+(" + NAME + ")", FLAGS);
    private static final Pattern FUNC = Pattern.compile("^\\s*(?:LOCAL\\s+)?FUNC\\s+\\w+\\s+(" + NAME + ")", FLAGS);
    private static final Pattern END_PROC = Pattern.compile("^\\s*(?:ENDPROC|ENDFUNC)\\b", FLAGS);
    private static final Pattern DECLARATION = Pattern.compile(
            "^\\s*(?:(?:LOCAL|TASK)\\s+)?(?:PERS|VAR|CONST)\\s+\\w+\\s+(" + NAME + ")", FLAGS);
    private static final Pattern SET_RESET = Pattern.compile("\\b(?:Set|Reset|Switch)\\s+(" + NAME + ")", FLAGS);
    private static final Pattern SET_DO = Pattern.compile("\\b(?:SetDO|ResetDO)\\s+(" + NAME + ")", FLAGS);
    private static final Pattern CALL_BY_VAR = Pattern.compile("\\bCallByVar\\b[^\\n\"]*\"([^\"]+)\"", FLAGS);
    private static final Pattern WAIT_TIME = Pattern.compile("\\bWaitTime\\b", FLAGS);
    private static final Pattern IDENTIFIER = Pattern.compile("\\b" + NAME + "\\b", FLAGS);
    private static final Pattern STRING_LITERAL = Pattern.compile("\"[^\"]*\"");

    private static final List<String> BLOCK_OPENERS = List.of("IF", "FOR", "WHILE", "TEST");
    private static final List<String> BLOCK_CLOSERS = List.of("ENDIF", "ENDFOR", "ENDWHILE", "ENDTEST");
    private static final List<String> BRANCHES = List.of("ELSEIF", "CASE");
    private static final List<String> DISPLAY_CALLS = List.of("TPWRITE");

    @Override
    public LineClassification classify(String line) {
        String stripped = line.strip();
        String upper = stripped.toUpperCase(Locale.ROOT);

        String moduleName = null;
        boolean noStepIn = false;
        if (upper.contains("MODULE")) {
            Matcher m = MODULE.matcher(line);
            if (m.lookingAt()) {
                moduleName = m.group(1);
                noStepIn = upper.contains("NOSTEPIN");
            }
        }
        boolean moduleEnd = upper.contains("ENDMODULE");

        if (stripped.startsWith("!**") || stripped.startsWith("!--")) {
            return LineClassification.nonCode(LineKind.DECORATIVE, moduleName, noStepIn, moduleEnd);
        }
        if (stripped.startsWith("!")) {
            return LineClassification.nonCode(LineKind.COMMENT, moduleName, noStepIn, moduleEnd);
        }
        if (stripped.isEmpty()) {
            return LineClassification.nonCode(LineKind.BLANK, moduleName, noStepIn, moduleEnd);
        }

        String declaredName = firstGroup(DECLARATION.matcher(line), true);

        List<String> ioSignals = new ArrayList<>(2);
        String setReset = firstGroup(SET_RESET.matcher(line), false);
        if (setReset != null) {
            ioSignals.add(setReset);
        }
        String setDo = firstGroup(SET_DO.matcher(line), false);
        if (setDo != null) {
            ioSignals.add(setDo);
        }

        String procedureName = firstGroup(PROC.matcher(line), true);
        if (procedureName == null) {
            procedureName = firstGroup(FUNC.matcher(line), true);
        }

        return new LineClassification(
                LineKind.CODE,
                moduleName,
                noStepIn,
                moduleEnd,
                procedureName,
                END_PROC.matcher(line).lookingAt(),
                startsWithAny(upper, BLOCK_OPENERS),
                startsWithAny(upper, BLOCK_CLOSERS),
                startsWithAny(upper, BRANCHES),
                declaredName,
                ioSignals,
                dynamicPrefix(line),
                identifiers(stripped),
                WAIT_TIME.matcher(line).find(),
                startsWithAny(upper, DISPLAY_CALLS),
                line.length() - line.stripLeading().length());
    }

    /**
     * Identifier-shaped tokens after dropping the inline comment and quoted strings.
     */
    static List<String> identifiers(String stripped) {
        int bang = stripped.indexOf('!');
        String code = bang >= 0 ? stripped.substring(0, bang) : stripped;
        code = STRING_LITERAL.matcher(code).replaceAll("");

        List<String> found = new ArrayList<>();
        Matcher m = IDENTIFIER.matcher(code);
        while (m.find()) {
            found.add(m.group());
        }
        return found;
    }

    /**
     * The quoted name prefix of a CallByVar, lowercased, or null.
     */
    static String dynamicPrefix(String line) {
        Matcher m = CALL_BY_VAR.matcher(line);
        if (!m.find()) {
            return null;
        }
        String prefix = m.group(1).strip();
        return prefix.isEmpty() ? null : prefix.toLowerCase(Locale.ROOT);
    }

    private static String firstGroup(Matcher m, boolean anchored) {
        boolean matched = anchored ? m.lookingAt() : m.find();
        return matched ? m.group(1) : null;
    }

    private static boolean startsWithAny(String upper, List<String> keywords) {
        for (String keyword : keywords) {
            if (upper.startsWith(keyword)) {
                return true;
            }
        }
        return false;
    }
}
