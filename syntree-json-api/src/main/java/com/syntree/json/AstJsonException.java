package com.syntree.json;

/**
 * Exception thrown when a tree cannot be written to or read from JSON,
 * including JSON that describes a malformed tree.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public AstJsonException(Throwable cause) {
        super(cause);
    }
}
