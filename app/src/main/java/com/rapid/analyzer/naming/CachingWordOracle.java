package com.rapid.analyzer.naming;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes lookups per lowercase token for the lifetime of one analysis run.
 * Concurrent callers may compute the same token twice; the answer is the same either way.
 */
public class CachingWordOracle implements WordOracle {

    private final WordOracle delegate;
    private final Map<String, Boolean> cache = new ConcurrentHashMap<>();

    public CachingWordOracle(WordOracle delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }

    @Override
    public boolean isWord(String token) {
        String key = token.toLowerCase(Locale.ROOT);
        Boolean known = cache.get(key);
        if (known == null) {
            known = delegate.isWord(key);
            cache.put(key, known);
        }
        return known;
    }

    public int size() {
        return cache.size();
    }
}
