package com.syntree;

/**
 * Thrown when a scalar payload accessor is called on a node whose kind
 * carries a different payload class.
 */
public class WrongPayloadKindException extends AstException {

    public WrongPayloadKindException(String message) {
        super(message);
    }
}
