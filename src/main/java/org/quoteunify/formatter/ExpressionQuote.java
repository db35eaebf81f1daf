package org.quoteunify.formatter;

import java.util.Locale;

/**
 * Quote style used for string literals nested inside f-string expressions.
 */
public enum ExpressionQuote {
    IGNORE,   // leave expressions as written
    SINGLE,
    DOUBLE,
    DEPENDED; // the opposite of the quote chosen for the enclosing f-string

    public String optionName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the quote character to use inside expressions, or 0 when
     * expressions keep their quotes.
     *
     * @param outerQuote the delimiter chosen for the enclosing literal
     */
    public char resolve(char outerQuote) {
        return switch (this) {
            case IGNORE -> 0;
            case SINGLE -> '\'';
            case DOUBLE -> '"';
            case DEPENDED -> Quote.opposite(outerQuote);
        };
    }

    public static ExpressionQuote fromName(String name) {
        for (ExpressionQuote value : values()) {
            if (value != IGNORE && value.optionName().equals(name)) {
                return value;
            }
        }
        throw new IllegalArgumentException("invalid f-string expression quote: " + name
                + " (choose from single, double, depended)");
    }
}
