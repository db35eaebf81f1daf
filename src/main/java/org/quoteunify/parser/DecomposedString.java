package org.quoteunify.parser;

import java.util.Locale;

/**
 * A string literal split into its prefix, delimiter and body.
 *
 * <p>The prefix keeps its original letters so that a rewritten literal keeps
 * {@code R}, {@code B} or {@code F} in the case the author wrote them;
 * {@link #hasPrefix(char)} compares case-insensitively. The body is the raw
 * text between the delimiters, escape sequences included.</p>
 *
 * <p>{@code prefix + quote + body + quote} is always the original literal.</p>
 *
 * @param prefix zero or more of the letters r, u, b, f in any case
 * @param quote  one of {@code '}, {@code "}, {@code '''}, {@code """}
 * @param body   the text between the delimiters
 */
public record DecomposedString(String prefix, String quote, String body) {

    public boolean hasPrefix(char letter) {
        return prefix.toLowerCase(Locale.ROOT).indexOf(Character.toLowerCase(letter)) >= 0;
    }

    public boolean isTripleQuoted() {
        return quote.length() == 3;
    }

    /**
     * Returns the quote character used by the delimiter.
     */
    public char quoteChar() {
        return quote.charAt(0);
    }

    /**
     * Builds a single-quoted literal with this prefix, the given delimiter and
     * the given body.
     */
    public String withQuote(char newQuote, String newBody) {
        return prefix + newQuote + newBody + newQuote;
    }

    public String toText() {
        return prefix + quote + body + quote;
    }
}
