package org.quoteunify.formatter;

import org.quoteunify.parser.Chunk;
import org.quoteunify.parser.DecomposedString;
import org.quoteunify.parser.ExpressionAreaParser;
import org.quoteunify.parser.StringDecomposer;

import java.util.List;

/**
 * Decides which rewrite strategy applies to a string literal.
 * <p>
 * The checks run in a fixed order and the first one that matches wins:
 * <ol>
 *   <li>triple-quoted literals are left alone;</li>
 *   <li>a body without quote characters is SIMPLE;</li>
 *   <li>raw literals with a quote in the body are left alone, since a
 *       backslash cannot be added or removed without changing their value;</li>
 *   <li>f-strings are split into literal text and expressions and judged on
 *       both parts;</li>
 *   <li>a body with both quote characters is left alone;</li>
 *   <li>a body with one quote character is SIMPLE_ESCAPED.</li>
 * </ol>
 */
public final class StringClassifier {

    private StringClassifier() {
    }

    /**
     * Classifies the text of a STRING token.
     *
     * @param text the token text, prefix and delimiters included
     * @return the chosen variant; IMMUTABLE when the text is not a well-formed literal
     */
    public static StringVariant classify(String text) {
        DecomposedString string = StringDecomposer.decompose(text);
        if (string == null || string.isTripleQuoted()) {
            return StringVariant.immutable(text);
        }

        String body = string.body();
        boolean hasSingle = body.indexOf('\'') >= 0;
        boolean hasDouble = body.indexOf('"') >= 0;

        if (!hasSingle && !hasDouble) {
            return StringVariant.simple(text, string);
        }
        if (string.hasPrefix('r')) {
            return StringVariant.immutable(text);
        }
        if (string.hasPrefix('f')) {
            return classifyInterpolated(text, string);
        }
        if (hasSingle && hasDouble) {
            return StringVariant.immutable(text);
        }
        return StringVariant.simpleEscaped(text, string, hasSingle ? '\'' : '"');
    }

    private static StringVariant classifyInterpolated(String text, DecomposedString string) {
        List<Chunk> chunks = ExpressionAreaParser.parse(string.body());

        boolean literalSingle = false;
        boolean literalDouble = false;
        boolean expressionSingle = false;
        boolean expressionDouble = false;
        for (Chunk chunk : chunks) {
            if (chunk.expression()) {
                if (ExpressionAreaParser.hasQuoteInFormatSpec(chunk.text())) {
                    // A quote used as fill character can neither be escaped nor swapped
                    return StringVariant.immutable(text);
                }
                expressionSingle |= chunk.contains('\'');
                expressionDouble |= chunk.contains('"');
            } else {
                if (hasLoneBrace(chunk.text())) {
                    // An area was opened here but never closed as expected
                    return StringVariant.immutable(text);
                }
                literalSingle |= chunk.contains('\'');
                literalDouble |= chunk.contains('"');
            }
        }

        if (literalSingle && literalDouble) {
            return StringVariant.immutable(text);
        }
        if (!literalSingle && !literalDouble) {
            // Only the expressions quote anything
            return StringVariant.immutable(text);
        }
        if (expressionSingle && expressionDouble) {
            return StringVariant.immutable(text);
        }
        // An expression cannot reuse the delimiter; if it seems to, the split is not trustworthy
        boolean expressionUsesDelimiter = string.quoteChar() == '\'' ? expressionSingle : expressionDouble;
        if (expressionUsesDelimiter) {
            return StringVariant.immutable(text);
        }
        return StringVariant.simpleEscapedInterpolated(text, string, literalSingle ? '\'' : '"', chunks);
    }

    // True if the text has a brace that is not part of an escaped {{ or }} pair
    private static boolean hasLoneBrace(String text) {
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '{' || c == '}') {
                if (i + 1 >= text.length() || text.charAt(i + 1) != c) {
                    return true;
                }
                i += 2;
            } else {
                i++;
            }
        }
        return false;
    }
}
