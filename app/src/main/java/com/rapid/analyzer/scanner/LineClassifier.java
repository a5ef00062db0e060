package com.rapid.analyzer.scanner;

/**
 * Turns one physical source line into a {@link LineClassification}.
 * The scanner and the call-graph builder only see classifications, so the
 * regex implementation can be replaced by a real tokenizer.
 */
@FunctionalInterface
public interface LineClassifier {

    LineClassification classify(String line);
}
