package com.rapid.analyzer.naming;

import net.sf.extjwnl.JWNLException;
import net.sf.extjwnl.dictionary.Dictionary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * WordNet 3.1 lookup through extJWNL, using the dictionary bundled on the classpath.
 * A token counts as a word when WordNet has an index entry for it or for its base form.
 */
public class WordNetOracle implements WordOracle {

    private static final Logger log = LoggerFactory.getLogger(WordNetOracle.class);

    /**
     * Index lookup for one lowercase token.
     */
    @FunctionalInterface
    interface IndexLookup {
        boolean hasIndexWord(String lemma) throws JWNLException;
    }

    private final IndexLookup lookup;

    WordNetOracle(Dictionary dictionary) {
        this(lemma -> dictionary.lookupAllIndexWords(lemma).size() > 0);
    }

    WordNetOracle(IndexLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup);
    }

    /**
     * Loads the bundled dictionary.
     *
     * @throws LexicalOracleException if the dictionary resource is missing or corrupt
     */
    public static WordNetOracle load() {
        try {
            Dictionary dictionary = Dictionary.getDefaultResourceInstance();
            if (dictionary == null) {
                throw new LexicalOracleException("WordNet dictionary resource not found on classpath", null);
            }
            log.debug("WordNet dictionary loaded");
            return new WordNetOracle(dictionary);
        } catch (JWNLException e) {
            throw new LexicalOracleException("Could not load WordNet dictionary: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isWord(String token) {
        try {
            return lookup.hasIndexWord(token.toLowerCase(Locale.ROOT));
        } catch (JWNLException e) {
            throw new LexicalOracleException("WordNet lookup failed for '" + token + "'", e);
        }
    }
}
