package org.quoteunify.formatter;

import org.quoteunify.parser.Chunk;
import org.quoteunify.parser.DecomposedString;

/**
 * Produces the rewritten text of a classified string literal.
 */
public final class QuoteRewriter {

    private QuoteRewriter() {
    }

    /**
     * Rewrites a literal according to its variant and the rules.
     *
     * @param variant the classified literal
     * @param rules   the formatting rules
     * @return the new token text; the original text when nothing can be changed safely
     */
    public static String reformat(StringVariant variant, Rules rules) {
        return switch (variant.kind()) {
            case IMMUTABLE -> variant.originalText();
            case SIMPLE -> reformatSimple(variant.string(), rules);
            case SIMPLE_ESCAPED -> reformatSimpleEscaped(variant, rules);
            case SIMPLE_ESCAPED_INTERPOLATED -> reformatInterpolated(variant, rules);
        };
    }

    private static String reformatSimple(DecomposedString string, Rules rules) {
        return string.withQuote(rules.preferredQuote().character(), string.body());
    }

    private static String reformatSimpleEscaped(StringVariant variant, Rules rules) {
        if (rules.escapeSimple() == EscapeSimple.IGNORE) {
            return variant.originalText();
        }
        char inBody = variant.quoteInBody();
        char newQuote = chooseQuote(inBody, rules);

        String body = unescapeQuote(variant.string().body(), inBody);
        if (newQuote == inBody) {
            body = escapeQuote(body, inBody);
        }
        return variant.string().withQuote(newQuote, body);
    }

    private static String reformatInterpolated(StringVariant variant, Rules rules) {
        if (rules.escapeSimple() == EscapeSimple.IGNORE) {
            return variant.originalText();
        }
        char inLiteral = variant.quoteInBody();
        char newQuote = chooseQuote(inLiteral, rules);
        char expressionQuote = rules.fStringExpressionQuote().resolve(newQuote);
        if (expressionQuote == newQuote) {
            return variant.originalText();
        }

        StringBuilder body = new StringBuilder();
        for (Chunk chunk : variant.chunks()) {
            String text = chunk.text();
            if (chunk.expression()) {
                if (chunk.contains('\\')) {
                    // Backslashes inside expressions cannot be re-escaped reliably
                    return variant.originalText();
                }
                if (expressionQuote != 0) {
                    text = text.replace(Quote.opposite(expressionQuote), expressionQuote);
                }
                if (text.indexOf(newQuote) >= 0) {
                    return variant.originalText();
                }
            } else {
                text = unescapeQuote(text, inLiteral);
                if (newQuote == inLiteral) {
                    text = escapeQuote(text, inLiteral);
                }
            }
            body.append(text);
        }
        return variant.string().withQuote(newQuote, body.toString());
    }

    private static char chooseQuote(char inBody, Rules rules) {
        if (rules.escapeSimple() == EscapeSimple.OPPOSITE) {
            return Quote.opposite(inBody);
        }
        return rules.preferredQuote().character();
    }

    /**
     * Removes the escaping backslash from escaped occurrences of a quote.
     * A run of backslashes before the quote loses one backslash only if its
     * length is odd; an even run is a sequence of literal backslashes.
     *
     * @param body  the literal body
     * @param quote the quote character
     * @return the body with every occurrence of the quote unescaped
     */
    static String unescapeQuote(String body, char quote) {
        StringBuilder result = new StringBuilder(body.length());
        int length = body.length();
        int i = 0;
        while (i < length) {
            char c = body.charAt(i);
            if (c == '\\') {
                int runStart = i;
                while (i < length && body.charAt(i) == '\\') {
                    i++;
                }
                int run = i - runStart;
                if (i < length && body.charAt(i) == quote && run % 2 == 1) {
                    run--;
                }
                result.append("\\".repeat(run));
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }

    /**
     * Puts a backslash in front of every occurrence of a quote.
     * The body must not contain escaped occurrences already.
     */
    static String escapeQuote(String body, char quote) {
        StringBuilder result = new StringBuilder(body.length() + 4);
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == quote) {
                result.append('\\');
            }
            result.append(c);
        }
        return result.toString();
    }
}
