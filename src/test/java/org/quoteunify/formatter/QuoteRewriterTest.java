package org.quoteunify.formatter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class QuoteRewriterTest {

    private static final Rules BACKSLASH_SINGLE = Rules.DEFAULT.withEscapeSimple(EscapeSimple.BACKSLASH);
    private static final Rules BACKSLASH_DOUBLE = BACKSLASH_SINGLE.withPreferredQuote(Quote.DOUBLE);

    private static String reformat(String text, Rules rules) {
        return QuoteRewriter.reformat(StringClassifier.classify(text), rules);
    }

    @Test
    void testUnescapeQuote() {
        assertEquals("foo's", QuoteRewriter.unescapeQuote("foo\\'s", '\''));
        // an even run is literal backslashes
        assertEquals("a\\\\'b", QuoteRewriter.unescapeQuote("a\\\\'b", '\''));
        assertEquals("a\\\\'b", QuoteRewriter.unescapeQuote("a\\\\\\'b", '\''));
        assertEquals("a\\n\\\"b", QuoteRewriter.unescapeQuote("a\\n\\\"b", '\''));
    }

    @Test
    void testEscapeQuote() {
        assertEquals("foo\\'s \\'x\\'", QuoteRewriter.escapeQuote("foo's 'x'", '\''));
        assertEquals("plain", QuoteRewriter.escapeQuote("plain", '"'));
    }

    @Test
    void testSimpleKeepsPrefixAndBody() {
        assertEquals("B'abc'", reformat("B\"abc\"", Rules.DEFAULT));
        assertEquals("\"abc\"", reformat("'abc'", Rules.preferring(Quote.DOUBLE)));
    }

    @Test
    void testImmutableIsReturnedAsIs() {
        assertEquals("'''x'''", reformat("'''x'''", Rules.preferring(Quote.DOUBLE)));
    }

    @Test
    void testOppositeStrategy() {
        assertEquals("\"foo's\"", reformat("\"foo's\"", Rules.DEFAULT));
        assertEquals("\"foo's\"", reformat("'foo\\'s'", Rules.DEFAULT));
        assertEquals("'say \"hi\"'", reformat("\"say \\\"hi\\\"\"", Rules.DEFAULT));
    }

    @Test
    void testBackslashStrategy() {
        assertEquals("'foo\\'s'", reformat("\"foo's\"", BACKSLASH_SINGLE));
        assertEquals("\"foo's\"", reformat("'foo\\'s'", BACKSLASH_DOUBLE));
        assertEquals("'foo\\'s'", reformat("'foo\\'s'", BACKSLASH_SINGLE));
    }

    @Test
    void testIgnoreStrategy() {
        Rules rules = Rules.DEFAULT.withEscapeSimple(EscapeSimple.IGNORE);

        assertEquals("'foo\\'s'", reformat("'foo\\'s'", rules));
        assertEquals("f\"it's {x}\"", reformat("f\"it's {x}\"", rules));
        assertEquals("'abc'", reformat("\"abc\"", rules));
    }

    @Test
    void testInterpolatedLiteralText() {
        assertEquals("f'it\\'s {x}'", reformat("f\"it's {x}\"", BACKSLASH_SINGLE));
        assertEquals("f\"it's {x}\"", reformat("f\"it's {x}\"", Rules.DEFAULT));
        assertEquals("f'{{it\\'s}} {x}'", reformat("f\"{{it's}} {x}\"", BACKSLASH_SINGLE));
    }

    @Test
    void testInterpolatedCollisionLeavesLiteralAlone() {
        assertEquals("f\"it's {x['k']}\"", reformat("f\"it's {x['k']}\"", BACKSLASH_SINGLE));
    }

    @Test
    void testInterpolatedExpressionQuote() {
        Rules depended = BACKSLASH_SINGLE.withFStringExpressionQuote(ExpressionQuote.DEPENDED);
        assertEquals("f'it\\'s {x[\"k\"]}'", reformat("f\"it's {x['k']}\"", depended));

        Rules single = Rules.DEFAULT.withFStringExpressionQuote(ExpressionQuote.SINGLE);
        assertEquals("f'it\"s {x[\"k\"]}'", reformat("f'it\"s {x[\"k\"]}'", single));
    }

    @Test
    void testBackslashInExpressionLeavesLiteralAlone() {
        String text = "f\"it's {'\\\\'}\"";
        assertEquals(text, reformat(text, Rules.DEFAULT));
    }

    @Test
    void testQuoteInFormatSpecLeavesLiteralAlone() {
        String text = "f'say \"hi\" {d[\"k\"]:\">5}'";
        for (Quote quote : Quote.values()) {
            for (EscapeSimple escape : EscapeSimple.values()) {
                for (ExpressionQuote expressionQuote : ExpressionQuote.values()) {
                    Rules rules = new Rules(quote, escape, expressionQuote);
                    assertEquals(text, reformat(text, rules), rules.toString());
                }
            }
        }
    }

    @Test
    void testFormatSpecWithoutQuotesIsRewritten() {
        assertEquals("f\"it\\\"s {d['k']:>5}\"",
                reformat("f'it\"s {d[\"k\"]:>5}'", BACKSLASH_DOUBLE.withFStringExpressionQuote(ExpressionQuote.DEPENDED)));
    }
}
