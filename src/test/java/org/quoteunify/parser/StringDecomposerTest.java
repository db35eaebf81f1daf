package org.quoteunify.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class StringDecomposerTest {

    @Test
    void testPlainLiteral() {
        DecomposedString string = StringDecomposer.decompose("'abc'");

        assertNotNull(string);
        assertEquals("", string.prefix());
        assertEquals("'", string.quote());
        assertEquals("abc", string.body());
        assertFalse(string.isTripleQuoted());
        assertEquals('\'', string.quoteChar());
    }

    @Test
    void testPrefixAndEscapedQuote() {
        DecomposedString string = StringDecomposer.decompose("Rb\"x\\\"y\"");

        assertNotNull(string);
        assertEquals("Rb", string.prefix());
        assertEquals("\"", string.quote());
        assertEquals("x\\\"y", string.body());
        assertTrue(string.hasPrefix('r'));
        assertTrue(string.hasPrefix('b'));
        assertFalse(string.hasPrefix('f'));
    }

    @Test
    void testTripleQuoted() {
        DecomposedString string = StringDecomposer.decompose("\"\"\"doc \"quoted\"\n\"\"\"");

        assertNotNull(string);
        assertTrue(string.isTripleQuoted());
        assertEquals("doc \"quoted\"\n", string.body());
    }

    @Test
    void testEmptyBodies() {
        assertEquals("", StringDecomposer.decompose("''").body());
        assertEquals("'", StringDecomposer.decompose("''").quote());
        assertEquals("'''", StringDecomposer.decompose("''''''").quote());
        assertEquals("", StringDecomposer.decompose("''''''").body());
    }

    @Test
    void testWithQuoteKeepsPrefix() {
        DecomposedString string = StringDecomposer.decompose("F\"a\"");

        assertEquals("F'b'", string.withQuote('\'', "b"));
        assertEquals("F\"a\"", string.toText());
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "'abc", "'a'b'", "'abc\\'", "x'abc'", "'abc\"", "", "'''a''"})
    void testRejectsMalformedText(String text) {
        assertNull(StringDecomposer.decompose(text));
    }
}
