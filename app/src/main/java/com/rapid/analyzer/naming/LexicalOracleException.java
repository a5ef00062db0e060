package com.rapid.analyzer.naming;

/**
 * The dictionary behind a {@link WordOracle} could not be loaded or queried.
 */
public class LexicalOracleException extends RuntimeException {

    public LexicalOracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
