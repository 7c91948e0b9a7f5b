package com.syntree;

/**
 * Thrown when a child or payload operation does not fit the node's kind,
 * e.g. indexing into a literal or resolving a node that is not an identifier.
 */
public class InvalidAccessException extends AstException {

    public InvalidAccessException(String message) {
        super(message);
    }
}
