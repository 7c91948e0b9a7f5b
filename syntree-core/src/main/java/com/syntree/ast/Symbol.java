package com.syntree.ast;

/**
 * Symbol-table entry a resolved name links to.
 *
 * <p>Symbols are owned by the name-resolution pass. A {@code SYM} node only
 * holds a lookup reference to one, never ownership.</p>
 */
public interface Symbol {

    /** Identity of the symbol, unique within one compilation. */
    long id();

    String name();

    /** Qualified name of the declaring scope, e.g. a module or routine. */
    String scope();

    /** Rendering of the declared type; empty when not yet known. */
    String declaredType();
}
