package com.rapid.analyzer.naming;

import java.util.SortedSet;

/**
 * Naming quality of a set of identifiers: 1.0 when every token is a word.
 */
public record NamingScore(double score, SortedSet<String> badTokens) {

    public int badTokenCount() {
        return badTokens.size();
    }
}
