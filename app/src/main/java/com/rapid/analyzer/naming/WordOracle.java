package com.rapid.analyzer.naming;

/**
 * Answers whether a token is a known dictionary word.
 */
@FunctionalInterface
public interface WordOracle {

    boolean isWord(String token);
}
