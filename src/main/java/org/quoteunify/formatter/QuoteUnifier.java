package org.quoteunify.formatter;

import org.quoteunify.lexer.LexerToken;
import org.quoteunify.lexer.PythonLexer;
import org.quoteunify.lexer.TokenizeException;

import java.util.List;

/**
 * Entry point of the quote formatter: rewrites the string literals of Python
 * source text to use the preferred quote wherever that is safe.
 * <p>
 * The formatter keeps no state between calls and may be used from several
 * threads at once.
 */
public final class QuoteUnifier {

    private QuoteUnifier() {
    }

    /**
     * Returns the source with its quotes unified.
     * Source that cannot be tokenized is returned unchanged.
     *
     * @param source the complete source text
     * @param rules  the formatting rules
     * @return the formatted source
     */
    public static String formatCode(String source, Rules rules) {
        try {
            return formatCodeOrThrow(source, rules);
        } catch (TokenizeException e) {
            return source;
        }
    }

    /**
     * Returns the source with its quotes unified.
     *
     * @param source the complete source text
     * @param rules  the formatting rules
     * @return the formatted source
     * @throws TokenizeException if the source cannot be tokenized
     */
    public static String formatCodeOrThrow(String source, Rules rules) {
        if (source.isEmpty()) {
            return source;
        }
        PythonLexer lexer = new PythonLexer(source);
        List<LexerToken> tokens = lexer.tokenize();
        return new Reassembler(lexer.getLines()).reassemble(tokens, text -> unifyQuotes(text, rules));
    }

    /**
     * Returns a single string literal with its quotes changed to the
     * preferred quote if possible.
     *
     * @param text  the literal, prefix and delimiters included
     * @param rules the formatting rules
     * @return the rewritten literal, or the original text
     */
    public static String unifyQuotes(String text, Rules rules) {
        return QuoteRewriter.reformat(StringClassifier.classify(text), rules);
    }
}
