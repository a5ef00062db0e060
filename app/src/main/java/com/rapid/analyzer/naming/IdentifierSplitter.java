package com.rapid.analyzer.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Breaks RAPID identifiers into lowercase word tokens.
 * <p>
 * Underscores and digit runs separate words ({@code point2On} gives {@code point, on}),
 * camel case is split with acronyms kept together ({@code XMLParser} gives {@code xml, parser})
 * and the axis names {@code xaxis, yaxis, zaxis} become the letter plus {@code axis}.
 */
public class IdentifierSplitter {

    private static final Pattern UNDERSCORES = Pattern.compile("_+");
    private static final Pattern DIGITS = Pattern.compile("\\d+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Set<String> AXIS_TOKENS = Set.of("xaxis", "yaxis", "zaxis");

    public List<String> split(String identifier) {
        List<String> tokens = new ArrayList<>();
        if (identifier == null || identifier.isEmpty()) {
            return tokens;
        }

        for (String part : UNDERSCORES.split(identifier)) {
            if (part.isEmpty()) {
                continue;
            }
            String noDigits = DIGITS.matcher(part).replaceAll("_");
            for (String chunk : noDigits.split("_")) {
                if (chunk.isEmpty()) {
                    continue;
                }
                for (String word : camelSplit(chunk)) {
                    String lower = word.toLowerCase(Locale.ROOT);
                    if (AXIS_TOKENS.contains(lower)) {
                        tokens.add(lower.substring(0, 1));
                        tokens.add("axis");
                    } else {
                        tokens.add(lower);
                    }
                }
            }
        }
        return tokens;
    }

    /**
     * Camel-case split that keeps acronyms together; when an acronym runs into a
     * lowercase letter, its last capital starts the next word.
     */
    static List<String> camelSplit(String s) {
        List<String> result = new ArrayList<>();
        if (s.isEmpty()) {
            return result;
        }

        StringBuilder current = new StringBuilder().append(s.charAt(0));
        for (int i = 1; i < s.length(); i++) {
            char ch = s.charAt(i);
            char last = current.charAt(current.length() - 1);
            if (Character.isUpperCase(ch)) {
                if (!Character.isUpperCase(last)) {
                    result.add(current.toString());
                    current.setLength(0);
                }
                current.append(ch);
            } else if (Character.isUpperCase(last) && current.length() > 1) {
                result.add(current.substring(0, current.length() - 1));
                current.setLength(0);
                current.append(last).append(ch);
            } else {
                current.append(ch);
            }
        }
        result.add(current.toString());
        return result;
    }
}
