package com.syntree;

/**
 * Thrown when constructor input violates the shape required for a node kind:
 * wrong payload class, wrong arity, an absent node in a required slot, or a
 * child that is already owned by another parent.
 */
public class MalformedNodeException extends AstException {

    public MalformedNodeException(String message) {
        super(message);
    }

    public MalformedNodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
