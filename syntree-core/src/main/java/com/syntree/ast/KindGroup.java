package com.syntree.ast;

/**
 * Coarse classification of node kinds, used for documentation and for
 * consumers that dispatch on families of constructs.
 */
public enum KindGroup {
    /** Literals, identifiers, symbols and the absence node. */
    ATOM,
    /** Call-like forms: calls, commands and operator applications. */
    CALL,
    EXPRESSION,
    STATEMENT,
    /** Sections, definitions and their entries. */
    DECLARATION,
    /** Type expressions. */
    TYPE,
    /** Forms introduced by later compiler passes, never by the parser. */
    SPECIAL
}
