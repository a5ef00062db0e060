package com.rapid.analyzer.naming;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierSplitterTest {

    private final IdentifierSplitter splitter = new IdentifierSplitter();

    @Test
    void testDigitsSeparateWords() {
        assertEquals(List.of("point", "on"), splitter.split("point2On"));
    }

    @Test
    void testAcronymKeptTogether() {
        assertEquals(List.of("xml", "parser"), splitter.split("XMLParser"));
        assertEquals(List.of("validate", "tcp", "connection"), splitter.split("ValidateTCPConnection"));
        assertEquals(List.of("abc"), splitter.split("ABC"));
    }

    @Test
    void testUnderscoresAndDigitRuns() {
        assertEquals(List.of("reg", "tool"), splitter.split("reg_1__tool"));
        assertEquals(List.of("n", "count"), splitter.split("nCount"));
    }

    @Test
    void testAxisNamesSplitIntoLetterAndAxis() {
        assertEquals(List.of("x", "axis", "offset"), splitter.split("xaxis_offset"));
        assertEquals(List.of("y", "axis"), splitter.split("YAxis"));
        assertEquals(List.of("z", "axis"), splitter.split("Zaxis"));
    }

    @Test
    void testEmptyInputGivesNoTokens() {
        assertTrue(splitter.split("").isEmpty());
        assertTrue(splitter.split(null).isEmpty());
        assertTrue(splitter.split("__").isEmpty());
        assertTrue(splitter.split("_42_").isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"point2On", "XMLParser", "tGripper_Open", "nYAxisSpeed",
            "reg_1__tool", "bIsHomePos", "ValidateTCPConnection", "pPick10", "nÄrgerZähler"})
    void testTokensAreLowercaseNonEmptyAndStable(String identifier) {
        for (String token : splitter.split(identifier)) {
            assertFalse(token.isEmpty(), "Empty token from " + identifier);
            assertEquals(token.toLowerCase(), token, "Token should be lowercase: " + token);
            assertEquals(List.of(token), splitter.split(token), "Splitting a token again should keep it whole");
        }
    }

    @Test
    void testCamelSplitKeepsOriginalCase() {
        assertEquals(List.of("my", "Var"), IdentifierSplitter.camelSplit("myVar"));
        assertEquals(List.of("HTTP", "Server"), IdentifierSplitter.camelSplit("HTTPServer"));
    }
}
