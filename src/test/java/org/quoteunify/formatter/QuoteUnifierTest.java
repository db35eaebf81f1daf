package org.quoteunify.formatter;

import org.junit.jupiter.api.Test;
import org.quoteunify.lexer.LexerToken;
import org.quoteunify.lexer.LexerTokenType;
import org.quoteunify.lexer.PythonLexer;
import org.quoteunify.lexer.TokenizeException;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class QuoteUnifierTest {

    private static final Rules SINGLE = Rules.preferring(Quote.SINGLE);
    private static final Rules DOUBLE = Rules.preferring(Quote.DOUBLE);

    @Test
    void testUnifyQuotes() {
        assertEquals("'foo'", QuoteUnifier.unifyQuotes("\"foo\"", SINGLE));
        assertEquals("\"foo\"", QuoteUnifier.unifyQuotes("\"foo\"", DOUBLE));
        assertEquals("\"foo\"", QuoteUnifier.unifyQuotes("'foo'", DOUBLE));
        assertEquals("'foo'", QuoteUnifier.unifyQuotes("'foo'", SINGLE));
    }

    @Test
    void testUnifyQuotesAvoidsBreakingLiterals() {
        assertEquals("\"foo's\"", QuoteUnifier.unifyQuotes("\"foo's\"", SINGLE));
        assertEquals("'''foo\"'''", QuoteUnifier.unifyQuotes("'''foo\"'''", DOUBLE));
        assertEquals("\"\"\"foo\"\"\"", QuoteUnifier.unifyQuotes("\"\"\"foo\"\"\"", SINGLE));
    }

    @Test
    void testBackslashStrategyExample() {
        Rules rules = SINGLE.withEscapeSimple(EscapeSimple.BACKSLASH);
        assertEquals("'foo\\'s'", QuoteUnifier.formatCode("\"foo's\"", rules));
    }

    @Test
    void testLineContinuation() {
        assertEquals("x = 'abc' \\\n'next'\n",
                QuoteUnifier.formatCode("x = \"abc\" \\\n\"next\"\n", SINGLE));
    }

    @Test
    void testCommentWithTrailingBackslash() {
        assertEquals("x = 'abc' #\\\n'next'\n",
                QuoteUnifier.formatCode("x = \"abc\" #\\\n\"next\"\n", SINGLE));
    }

    @Test
    void testSourceThatDoesNotTokenizeIsUnchanged() {
        String source = "foo(\"abc\"\n";
        assertEquals(source, QuoteUnifier.formatCode(source, SINGLE));
        assertThrows(TokenizeException.class, () -> QuoteUnifier.formatCodeOrThrow(source, SINGLE));

        String badIndent = "if x:\n        a = \"b\"\n    c = \"d\"\n";
        assertEquals(badIndent, QuoteUnifier.formatCode(badIndent, SINGLE));
    }

    @Test
    void testEmptySource() {
        assertEquals("", QuoteUnifier.formatCode("", SINGLE));
        assertEquals("", QuoteUnifier.formatCodeOrThrow("", SINGLE));
    }

    @Test
    void testLineEndingsArePreserved() {
        assertEquals("x = 'a'\r\ny = 'b'\r\n", QuoteUnifier.formatCode("x = \"a\"\r\ny = \"b\"\r\n", SINGLE));
        assertEquals("x = 'a'", QuoteUnifier.formatCode("x = \"a\"", SINGLE));
    }

    @Test
    void testStringAfterMultiLineLiteral() {
        assertEquals("s = \"\"\"a\nb\"\"\" + 'c'\n",
                QuoteUnifier.formatCode("s = \"\"\"a\nb\"\"\" + \"c\"\n", SINGLE));
    }

    @Test
    void testStringContinuedWithBackslash() {
        assertEquals("x = 'a\\\nb'\n", QuoteUnifier.formatCode("x = \"a\\\nb\"\n", SINGLE));
    }

    @Test
    void testWhitespaceIsPreserved() {
        String source = "def f():\n\tif  x :\n\t\treturn\t\"y\"  # \"z\"\n\f\nz = ( \"a\" ,\n      \"b\" )\n";
        String expected = "def f():\n\tif  x :\n\t\treturn\t'y'  # \"z\"\n\f\nz = ( 'a' ,\n      'b' )\n";
        assertEquals(expected, QuoteUnifier.formatCode(source, SINGLE));
    }

    @Test
    void testOnlyStringTokensChange() {
        String source = "d = {\"k\": f\"{v}\", 'x': b\"y\"}  # \"c\"\nprint(d[\"k\"])\n";
        String formatted = QuoteUnifier.formatCode(source, DOUBLE);

        assertEquals(nonStringTokens(source), nonStringTokens(formatted));
        assertEquals("d = {\"k\": f\"{v}\", \"x\": b\"y\"}  # \"c\"\nprint(d[\"k\"])\n", formatted);
    }

    @Test
    void testFormattingTwiceChangesNothing() {
        String source = "a = \"x\"\nb = 'it\\'s'\nc = f\"{a}'s\"\nd = \"say \\\"hi\\\"\"\n";
        for (Rules rules : List.of(SINGLE, DOUBLE, SINGLE.withEscapeSimple(EscapeSimple.BACKSLASH))) {
            String once = QuoteUnifier.formatCode(source, rules);
            assertEquals(once, QuoteUnifier.formatCode(once, rules));
        }
    }

    private static List<String> nonStringTokens(String source) {
        return new PythonLexer(source).tokenize().stream()
                .filter(token -> token.type != LexerTokenType.STRING)
                .map(LexerToken::toString)
                .collect(Collectors.toList());
    }
}
