package com.rapid.analyzer.naming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Scores variable names by how many of their tokens are real words.
 */
public class NamingScorer {

    private static final Logger log = LoggerFactory.getLogger(NamingScorer.class);

    /** Abbreviations that are normal in robot code even though they are short or not words. */
    public static final Set<String> ALLOWED_SHORT_TOKENS = Set.of(
            "di", "do", "gi", "go", "ai", "ao",
            "in", "on", "p", "t", "w", "l", "n", "s",
            "via", "m", "bool", "plc", "pre", "off",
            "with", "from", "x", "y", "z", "ry", "rz", "rx",
            "dir", "calc", "prog", "pers", "i", "j", "k", "a",
            "b", "ok", "at", "for", "over", "under", "front", "back", "cc", "ct", "v");

    private static final int MIN_WORD_LENGTH = 3;

    private final IdentifierSplitter splitter;
    private final WordOracle oracle;

    public NamingScorer(WordOracle oracle) {
        this(new IdentifierSplitter(), oracle);
    }

    public NamingScorer(IdentifierSplitter splitter, WordOracle oracle) {
        this.splitter = Objects.requireNonNull(splitter);
        this.oracle = Objects.requireNonNull(oracle);
    }

    /**
     * Mean score over all identifiers; an empty collection scores 1.0 since there is nothing to judge.
     */
    public NamingScore score(Collection<String> identifiers) {
        SortedSet<String> badTokens = new TreeSet<>();
        double score = score(identifiers, badTokens);
        return new NamingScore(score, badTokens);
    }

    public double score(Collection<String> identifiers, Set<String> badTokens) {
        if (identifiers.isEmpty()) {
            log.debug("No variables to score, naming score is neutral");
            return 1.0;
        }

        double sum = 0.0;
        for (String identifier : identifiers) {
            sum += identifierScore(identifier, badTokens);
        }
        return sum / identifiers.size();
    }

    /**
     * Fraction of the identifier's tokens that are good, 0.0 when it has none.
     */
    public double identifierScore(String identifier, Set<String> badTokens) {
        List<String> tokens = splitter.split(identifier);
        if (tokens.isEmpty()) {
            return 0.0;
        }

        int good = 0;
        for (String token : tokens) {
            if (isGoodToken(token)) {
                good++;
            } else {
                badTokens.add(token);
            }
        }

        double score = (double) good / tokens.size();
        if (log.isTraceEnabled()) {
            log.trace("Variable '{}' tokens={} good={}/{}", identifier, tokens, good, tokens.size());
        }
        return score;
    }

    public boolean isGoodToken(String token) {
        String normalized = token.toLowerCase(Locale.ROOT);
        if (ALLOWED_SHORT_TOKENS.contains(normalized)) {
            return true;
        }
        if (normalized.length() < MIN_WORD_LENGTH) {
            return false;
        }
        return oracle.isWord(normalized);
    }
}
