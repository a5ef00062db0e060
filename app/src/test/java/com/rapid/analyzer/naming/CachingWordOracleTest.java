package com.rapid.analyzer.naming;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CachingWordOracleTest {

    @Test
    void testLookupIsMemoizedPerLowercaseToken() {
        AtomicInteger calls = new AtomicInteger();
        CachingWordOracle oracle = new CachingWordOracle(token -> {
            calls.incrementAndGet();
            return token.equals("point");
        });

        assertTrue(oracle.isWord("Point"));
        assertTrue(oracle.isWord("point"));
        assertTrue(oracle.isWord("POINT"));
        assertFalse(oracle.isWord("pnt"));
        assertFalse(oracle.isWord("pnt"));

        assertEquals(2, calls.get());
        assertEquals(2, oracle.size());
    }

    @Test
    void testDelegateSeesLowercase() {
        CachingWordOracle oracle = new CachingWordOracle(token -> token.equals(token.toLowerCase()));
        assertTrue(oracle.isWord("Speed"));
    }
}
