package org.quoteunify.formatter;

import java.util.Locale;

/**
 * How a literal containing one kind of quote character is rewritten.
 */
public enum EscapeSimple {
    /**
     * Delimit the literal with the quote it does not contain, so nothing needs escaping.
     */
    OPPOSITE,
    /**
     * Use the preferred quote and escape its occurrences in the body with a backslash.
     */
    BACKSLASH,
    /**
     * Leave such literals alone.
     */
    IGNORE;

    public String optionName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EscapeSimple fromName(String name) {
        for (EscapeSimple value : values()) {
            if (value.optionName().equals(name)) {
                return value;
            }
        }
        throw new IllegalArgumentException("invalid escape strategy: " + name
                + " (choose from opposite, backslash, ignore)");
    }
}
