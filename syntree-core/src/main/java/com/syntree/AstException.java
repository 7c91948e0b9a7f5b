package com.syntree;

/**
 * Base class for errors raised while building or reading a syntax tree.
 *
 * <p>These are programming defects in a tree producer (parser or macro code),
 * never conditions an end user is expected to recover from.</p>
 */
public class AstException extends RuntimeException {

    public AstException(String message) {
        super(message);
    }

    public AstException(String message, Throwable cause) {
        super(message, cause);
    }
}
