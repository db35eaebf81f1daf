package org.quoteunify.formatter;

import org.quoteunify.parser.Chunk;
import org.quoteunify.parser.DecomposedString;

import java.util.List;

/**
 * The rewrite strategy chosen for one string literal, with what the strategy needs.
 * <p>
 * The set of kinds is closed; {@link QuoteRewriter} switches over it without a
 * default branch, so a new kind does not compile until the rewriter handles it.
 *
 * @param kind         which strategy applies
 * @param originalText the token text as it appears in the source
 * @param string       the decomposed literal; null for {@link Kind#IMMUTABLE}
 * @param quoteInBody  the single quote character found in the (literal part of the) body,
 *                     or 0 when the kind does not need one
 * @param chunks       the f-string chunks for {@link Kind#SIMPLE_ESCAPED_INTERPOLATED}, empty otherwise
 */
public record StringVariant(Kind kind, String originalText, DecomposedString string,
                            char quoteInBody, List<Chunk> chunks) {

    public enum Kind {
        /**
         * Left exactly as written.
         */
        IMMUTABLE,
        /**
         * The body contains no quote character; the delimiter can be swapped freely.
         */
        SIMPLE,
        /**
         * The body contains exactly one of the two quote characters.
         */
        SIMPLE_ESCAPED,
        /**
         * An f-string whose literal text contains exactly one of the two quote characters.
         */
        SIMPLE_ESCAPED_INTERPOLATED
    }

    public static StringVariant immutable(String text) {
        return new StringVariant(Kind.IMMUTABLE, text, null, (char) 0, List.of());
    }

    public static StringVariant simple(String text, DecomposedString string) {
        return new StringVariant(Kind.SIMPLE, text, string, (char) 0, List.of());
    }

    public static StringVariant simpleEscaped(String text, DecomposedString string, char quoteInBody) {
        return new StringVariant(Kind.SIMPLE_ESCAPED, text, string, quoteInBody, List.of());
    }

    public static StringVariant simpleEscapedInterpolated(String text, DecomposedString string,
                                                          char quoteInLiteral, List<Chunk> chunks) {
        return new StringVariant(Kind.SIMPLE_ESCAPED_INTERPOLATED, text, string, quoteInLiteral,
                List.copyOf(chunks));
    }
}
