package com.syntree.ast;

import java.util.List;

/**
 * The single active data variant of a {@link Node}. Which variant a node
 * holds is decided by its kind's {@link PayloadClass}; the node replaces the
 * whole value when it is rewritten, so no variant is ever read under two
 * interpretations.
 */
sealed interface Payload {

    Payload NONE = new None();

    record None() implements Payload {}

    record IntValue(long value) implements Payload {}

    record FloatValue(double value) implements Payload {}

    record TextValue(String text) implements Payload {}

    /** Text payload of a resolved name plus its non-owning symbol link. */
    record SymbolValue(String name, Symbol symbol) implements Payload {}

    /** Owned, ordered child list. The list is mutated only through {@link Node}. */
    record Children(List<Node> nodes) implements Payload {}
}
