package com.syntree.ast;

/**
 * The single data variant a node carries. Fixed per {@link NodeKind}.
 */
public enum PayloadClass {
    /** No data at all: the absence node, nil, internal markers. */
    NONE,
    /** Signed 64-bit storage; the kind decides the width that is legal. */
    INTEGER,
    /** 64-bit floating point storage; the kind decides the precision. */
    FLOAT,
    /** String literals, comments, identifier and symbol names. */
    TEXT,
    /** Ordered child list. */
    CHILDREN
}
