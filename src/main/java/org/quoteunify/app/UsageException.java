package org.quoteunify.app;

import java.io.Serial;

/**
 * Thrown for invalid command-line arguments or configuration files.
 */
public class UsageException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
