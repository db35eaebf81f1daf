package org.quoteunify.formatter;

import java.util.Objects;

/**
 * The formatting rules for one run.
 * <p>
 * Built once per invocation and handed to every call that needs it; nothing
 * in the formatter keeps rules in shared state.
 *
 * @param preferredQuote         the quote literals should converge to
 * @param escapeSimple           how literals containing one kind of quote are handled
 * @param fStringExpressionQuote quote style for literals nested in f-string expressions
 */
public record Rules(Quote preferredQuote, EscapeSimple escapeSimple, ExpressionQuote fStringExpressionQuote) {

    public static final Rules DEFAULT = new Rules(Quote.SINGLE, EscapeSimple.OPPOSITE, ExpressionQuote.IGNORE);

    public Rules {
        Objects.requireNonNull(preferredQuote, "preferredQuote");
        Objects.requireNonNull(escapeSimple, "escapeSimple");
        Objects.requireNonNull(fStringExpressionQuote, "fStringExpressionQuote");
    }

    /**
     * Default rules with the given preferred quote.
     */
    public static Rules preferring(Quote preferredQuote) {
        return DEFAULT.withPreferredQuote(preferredQuote);
    }

    public Rules withPreferredQuote(Quote quote) {
        return new Rules(quote, escapeSimple, fStringExpressionQuote);
    }

    public Rules withEscapeSimple(EscapeSimple strategy) {
        return new Rules(preferredQuote, strategy, fStringExpressionQuote);
    }

    public Rules withFStringExpressionQuote(ExpressionQuote quote) {
        return new Rules(preferredQuote, escapeSimple, quote);
    }
}
