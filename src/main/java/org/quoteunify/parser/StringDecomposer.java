package org.quoteunify.parser;

/**
 * Splits the text of a STRING token into prefix, delimiter and body.
 *
 * <p>The grammar is: any number of the letters {@code r}, {@code u},
 * {@code b}, {@code f} (case-insensitive), then {@code '}, {@code "},
 * {@code '''} or {@code """}, then the body, then the same delimiter.
 * The delimiter is found from the run length of the first quote character,
 * and the body is checked so that it cannot contain an unescaped delimiter
 * or escape the closing one.</p>
 *
 * <p>Text that does not fit the grammar is not an error: {@link #decompose}
 * returns null and the caller leaves the literal alone.</p>
 */
public final class StringDecomposer {

    private StringDecomposer() {
    }

    /**
     * Decomposes a string literal.
     *
     * @param text the token text
     * @return the decomposed literal, or null if the text is not a well-formed literal
     */
    public static DecomposedString decompose(String text) {
        int length = text.length();
        int pos = 0;
        while (pos < length && isPrefixLetter(text.charAt(pos))) {
            pos++;
        }
        if (pos >= length) {
            return null;
        }

        char q = text.charAt(pos);
        if (q != '\'' && q != '"') {
            return null;
        }

        int run = 0;
        while (pos + run < length && text.charAt(pos + run) == q) {
            run++;
        }
        String quote = run >= 3 && length - pos >= 6
                ? String.valueOf(q).repeat(3)
                : String.valueOf(q);

        int bodyStart = pos + quote.length();
        int bodyEnd = length - quote.length();
        if (bodyEnd < bodyStart || !text.startsWith(quote, bodyEnd)) {
            return null;
        }

        String body = text.substring(bodyStart, bodyEnd);
        if (!isValidBody(body, quote)) {
            return null;
        }
        return new DecomposedString(text.substring(0, pos), quote, body);
    }

    // The body must not close the literal early, nor escape the closing delimiter
    private static boolean isValidBody(String body, String quote) {
        int length = body.length();
        int i = 0;
        while (i < length) {
            char c = body.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (body.startsWith(quote, i)) {
                return false;
            } else {
                i++;
            }
        }
        if (i > length) {
            return false;
        }
        // A triple-quoted body may not end in a lone delimiter character
        return quote.length() == 1 || length == 0 || body.charAt(length - 1) != quote.charAt(0)
                || endsWithEscape(body);
    }

    private static boolean endsWithEscape(String body) {
        int backslashes = 0;
        int i = body.length() - 2;
        while (i >= 0 && body.charAt(i) == '\\') {
            backslashes++;
            i--;
        }
        return backslashes % 2 == 1;
    }

    private static boolean isPrefixLetter(char c) {
        return switch (c) {
            case 'r', 'R', 'u', 'U', 'b', 'B', 'f', 'F' -> true;
            default -> false;
        };
    }
}
