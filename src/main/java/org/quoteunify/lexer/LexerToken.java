package org.quoteunify.lexer;

/**
 * The LexerToken class represents a lexical token of Python source text.
 *
 * <p>Besides its type and text, a token remembers where it starts and ends
 * (1-based rows, 0-based columns) and the physical source line it was read
 * from. A string literal spanning several lines carries all of those lines,
 * concatenated, as its {@code line}.</p>
 *
 * <p>Tokens are immutable once the lexer has produced them.</p>
 */
public class LexerToken {
    /**
     * The type of the token.
     */
    public final LexerTokenType type;

    /**
     * The exact source characters making up the token.
     */
    public final String text;

    public final int startRow;
    public final int startColumn;
    public final int endRow;
    public final int endColumn;

    /**
     * The physical line (or lines) the token was read from.
     */
    public final String line;

    /**
     * Constructs a new LexerToken.
     *
     * @param type        the type of the token
     * @param text        the text of the token
     * @param startRow    row of the first character, 1-based
     * @param startColumn column of the first character, 0-based
     * @param endRow      row just after the last character
     * @param endColumn   column just after the last character
     * @param line        the source line the token came from
     */
    public LexerToken(LexerTokenType type, String text, int startRow, int startColumn,
                      int endRow, int endColumn, String line) {
        this.type = type;
        this.text = text;
        this.startRow = startRow;
        this.startColumn = startColumn;
        this.endRow = endRow;
        this.endColumn = endColumn;
        this.line = line;
    }

    /**
     * Returns a string representation of the token, including its type,
     * text and position.
     *
     * @return a string representation of the token
     */
    @Override
    public String toString() {
        return "LexerToken{" + "type=" + type + ", text='" + text + '\''
                + ", start=" + startRow + ":" + startColumn
                + ", end=" + endRow + ":" + endColumn + '}';
    }
}
