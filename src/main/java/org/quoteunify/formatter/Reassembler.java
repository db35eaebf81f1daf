package org.quoteunify.formatter;

import org.quoteunify.lexer.LexerToken;
import org.quoteunify.lexer.LexerTokenType;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Rebuilds source text from a token sequence.
 * <p>
 * Tokens do not cover everything: whitespace between tokens, backslash
 * continuations and some line terminators live in the gaps. Those gaps are
 * copied from the physical source lines, using the positions the lexer
 * recorded, so the output differs from the input only where a STRING token
 * was rewritten.
 */
public class Reassembler {

    private final List<String> lines;

    /**
     * @param lines the physical lines of the source, terminators included
     */
    public Reassembler(List<String> lines) {
        this.lines = lines;
    }

    /**
     * Rebuilds the source, passing the text of every STRING token through
     * {@code stringRewriter}.
     *
     * @param tokens         the tokens of the source, in order
     * @param stringRewriter returns the replacement text for a STRING token
     * @return the rebuilt source text
     */
    public String reassemble(List<LexerToken> tokens, UnaryOperator<String> stringRewriter) {
        StringBuilder formatted = new StringBuilder();
        int lastRow = 1;
        int lastColumn = 0;

        for (LexerToken token : tokens) {
            // Preserve spacing, continuations and anything else between tokens
            appendGap(formatted, lastRow, lastColumn, token.startRow, token.startColumn);

            if (token.type == LexerTokenType.STRING) {
                formatted.append(stringRewriter.apply(token.text));
            } else {
                formatted.append(token.text);
            }

            lastRow = token.endRow;
            lastColumn = token.endColumn;
        }

        appendGap(formatted, lastRow, lastColumn, lines.size() + 1, 0);
        return formatted.toString();
    }

    private void appendGap(StringBuilder formatted, int fromRow, int fromColumn, int toRow, int toColumn) {
        if (toRow < fromRow || (toRow == fromRow && toColumn <= fromColumn)) {
            return;
        }
        if (fromRow == toRow) {
            String line = lineAt(fromRow);
            formatted.append(line, Math.min(fromColumn, line.length()), Math.min(toColumn, line.length()));
            return;
        }

        String first = lineAt(fromRow);
        if (fromColumn < first.length()) {
            formatted.append(first, fromColumn, first.length());
        }
        for (int row = fromRow + 1; row < toRow; row++) {
            formatted.append(lineAt(row));
        }
        String last = lineAt(toRow);
        formatted.append(last, 0, Math.min(toColumn, last.length()));
    }

    private String lineAt(int row) {
        return row >= 1 && row <= lines.size() ? lines.get(row - 1) : "";
    }
}
