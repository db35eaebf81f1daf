package org.quoteunify.formatter;

/**
 * The two quote characters a Python string literal can be delimited with.
 */
public enum Quote {
    SINGLE('\''),
    DOUBLE('"');

    private final char character;

    Quote(char character) {
        this.character = character;
    }

    public char character() {
        return character;
    }

    /**
     * Returns the quote character that is not {@code c}.
     */
    public static char opposite(char c) {
        return c == '\'' ? '"' : '\'';
    }

    /**
     * Parses a quote given as the character itself.
     *
     * @param symbol {@code '} or {@code "}
     * @return the matching quote
     * @throws IllegalArgumentException if the symbol is neither
     */
    public static Quote fromSymbol(String symbol) {
        if ("'".equals(symbol)) {
            return SINGLE;
        }
        if ("\"".equals(symbol)) {
            return DOUBLE;
        }
        throw new IllegalArgumentException("invalid quote: " + symbol + " (choose from ', \")");
    }
}
