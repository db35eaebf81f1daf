package org.quoteunify.lexer;

import java.io.Serial;

/**
 * Thrown when a dedent does not return to any enclosing indentation level.
 */
public class IndentationException extends TokenizeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public IndentationException(String message, int row, int column) {
        super(message, row, column);
    }
}
