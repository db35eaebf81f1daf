package org.quoteunify.lexer;

import java.io.Serial;

/**
 * TokenizeException is thrown when the source text cannot be split into
 * tokens, for example because a string literal or a bracketed expression is
 * still open at the end of the input.
 * The detailed message includes the row and column where the problem was found.
 */
public class TokenizeException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final int row;
    private final int column;

    // Detailed error message that includes the position of the error
    private final String errorMessage;

    /**
     * Constructs a new TokenizeException.
     *
     * @param message the detail message describing the error
     * @param row     the 1-based row where the error occurred
     * @param column  the 0-based column where the error occurred
     */
    public TokenizeException(String message, int row, int column) {
        super(message);
        this.row = row;
        this.column = column;
        this.errorMessage = message + " at line " + row + ", column " + column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Returns the detailed error message.
     *
     * @return the detailed error message
     */
    @Override
    public String getMessage() {
        return errorMessage;
    }
}
