package com.syntree.ast;

import com.syntree.IndexOutOfRangeException;
import com.syntree.InvalidAccessException;
import com.syntree.Logging;
import com.syntree.MalformedNodeException;
import com.syntree.WrongPayloadKindException;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A syntax tree node: a stable, mutable cell holding a kind tag and the one
 * payload that kind allows.
 *
 * <p>Enclosing nodes reference the cell, not its current contents, so the
 * in-place identifier to symbol rewrite performed by {@link #resolve(Symbol)}
 * is observed by every holder of the node. Children are owned by exactly one
 * parent; move a subtree with {@link #detach()} or duplicate it with
 * {@link #copy()}.</p>
 *
 * <p>Equality is structural: kind and payload, recursively. Source locations
 * and parent links do not take part.</p>
 */
public final class Node implements Iterable<Node> {

    private static final Logger logger = Logging.getLogger("ast");

    /** The shared absence node; immutable and never owned. */
    static final Node EMPTY = new Node(NodeKind.EMPTY, Payload.NONE, true);

    private NodeKind kind;
    private Payload payload;
    private SourceLocation location = SourceLocation.UNKNOWN;
    private Node parent;
    private final boolean frozen;

    Node(NodeKind kind, Payload payload) {
        this(kind, payload, false);
    }

    private Node(NodeKind kind, Payload payload, boolean frozen) {
        this.kind = kind;
        this.payload = payload;
        this.frozen = frozen;
    }

    /**
     * Creates a node of the given kind to be filled in with {@link #add(Node)}.
     * Only compound kinds and kinds without payload can be created this way;
     * scalar kinds go through the {@link Nodes} literal constructors.
     */
    public static Node of(NodeKind kind) {
        Objects.requireNonNull(kind, "kind");
        switch (kind.payloadClass()) {
            case CHILDREN:
                return new Node(kind, new Payload.Children(new ArrayList<>()));
            case NONE:
                return new Node(kind, Payload.NONE);
            default:
                throw new MalformedNodeException(
                    kind.displayName() + " carries a " + kind.payloadClass() + " payload and needs a value");
        }
    }

    public NodeKind kind() {
        return kind;
    }

    public SourceLocation location() {
        return location;
    }

    public Node setLocation(SourceLocation location) {
        requireMutable();
        this.location = Objects.requireNonNull(location, "location");
        return this;
    }

    /**
     * True for the absence node. Decided by kind, so independently created
     * empty nodes are all absent.
     */
    public boolean isAbsent() {
        return kind == NodeKind.EMPTY;
    }

    /**
     * The node whose child list holds this node, or null for a root.
     */
    public Node parent() {
        return parent;
    }

    // ==================== Children ====================

    public int size() {
        return nodes().size();
    }

    public Node get(int index) {
        List<Node> nodes = nodes();
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfRangeException(index, nodes.size());
        }
        return nodes.get(index);
    }

    public Node last() {
        return get(size() - 1);
    }

    /**
     * Read-only, live view of the child list.
     */
    public List<Node> children() {
        return Collections.unmodifiableList(nodes());
    }

    @Override
    public Iterator<Node> iterator() {
        return children().iterator();
    }

    /**
     * Appends a child and returns this node, so construction can be chained.
     */
    public Node add(Node child) {
        List<Node> nodes = nodes();
        adopt(child);
        nodes.add(child);
        return this;
    }

    public Node addAll(Node... children) {
        for (Node child : children) {
            add(child);
        }
        return this;
    }

    public Node addAll(Iterable<Node> children) {
        for (Node child : children) {
            add(child);
        }
        return this;
    }

    public Node insert(int index, Node child) {
        List<Node> nodes = nodes();
        if (index < 0 || index > nodes.size()) {
            throw new IndexOutOfRangeException(index, nodes.size());
        }
        adopt(child);
        nodes.add(index, child);
        return this;
    }

    /**
     * Replaces the child at {@code index}.
     *
     * @return the replaced child, now detached
     */
    public Node set(int index, Node child) {
        Node previous = get(index);
        if (previous == child) {
            return previous;
        }
        adopt(child);
        nodes().set(index, child);
        release(previous);
        return previous;
    }

    /**
     * Removes the child at {@code index}.
     *
     * @return the removed child, now detached and free to be added elsewhere
     */
    public Node remove(int index) {
        Node removed = get(index);
        nodes().remove(index);
        release(removed);
        return removed;
    }

    /**
     * Removes this node from its parent's child list, if it has one.
     */
    public Node detach() {
        if (parent != null) {
            List<Node> siblings = parent.nodes();
            for (int i = 0; i < siblings.size(); i++) {
                if (siblings.get(i) == this) {
                    siblings.remove(i);
                    break;
                }
            }
            if (logger.isTraceEnabled()) {
                logger.trace("detach " + kind.displayName() + " from " + parent.kind.displayName());
            }
            parent = null;
        }
        return this;
    }

    /**
     * Visits this node and all of its descendants in pre-order.
     */
    public void walk(Consumer<Node> visitor) {
        visitor.accept(this);
        if (kind.isCompound()) {
            for (Node child : nodes()) {
                child.walk(visitor);
            }
        }
    }

    // ==================== Scalar payloads ====================

    public long intValue() {
        if (payload instanceof Payload.IntValue v) {
            return v.value();
        }
        throw wrongPayload(PayloadClass.INTEGER);
    }

    public double floatValue() {
        if (payload instanceof Payload.FloatValue v) {
            return v.value();
        }
        throw wrongPayload(PayloadClass.FLOAT);
    }

    /**
     * Text of string literals and comments, and the name of identifiers and
     * symbols.
     */
    public String textValue() {
        if (payload instanceof Payload.TextValue v) {
            return v.text();
        }
        if (payload instanceof Payload.SymbolValue v) {
            return v.name();
        }
        throw wrongPayload(PayloadClass.TEXT);
    }

    public Symbol symbol() {
        if (payload instanceof Payload.SymbolValue v) {
            return v.symbol();
        }
        throw new InvalidAccessException(kind.displayName() + " node is not a resolved symbol");
    }

    // ==================== Name resolution ====================

    /**
     * Rewrites this identifier, in place, into a symbol node linked to
     * {@code symbol}. The name and source location are kept.
     *
     * <p>Resolving an already resolved node to an equal symbol does nothing.
     * Any other target for a symbol node, a symbol whose name does not match,
     * or a node that is not an identifier is rejected.</p>
     *
     * @return this node
     * @throws InvalidAccessException when the transition is not allowed
     */
    public Node resolve(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        if (kind == NodeKind.SYM) {
            Payload.SymbolValue current = (Payload.SymbolValue) payload;
            if (current.symbol().equals(symbol)) {
                return this;
            }
            throw new InvalidAccessException(
                "'" + current.name() + "' is already resolved to symbol " + current.symbol().id());
        }
        if (kind != NodeKind.IDENT) {
            throw new InvalidAccessException("Only identifiers can be resolved, got " + kind.displayName());
        }
        String name = ((Payload.TextValue) payload).text();
        if (!Identifiers.eqIdent(name, symbol.name())) {
            throw new InvalidAccessException(
                "Identifier '" + name + "' cannot resolve to symbol '" + symbol.name() + "'");
        }
        this.kind = NodeKind.SYM;
        this.payload = new Payload.SymbolValue(name, symbol);
        if (logger.isTraceEnabled()) {
            logger.trace("resolve " + name + " -> " + symbol.scope() + "." + symbol.name() + "#" + symbol.id());
        }
        return this;
    }

    // ==================== Copy / check ====================

    /**
     * Deep copy. Symbol links are shared, locations are kept, the copy has no
     * parent.
     */
    public Node copy() {
        if (frozen) {
            return this;
        }
        Node result;
        if (payload instanceof Payload.Children c) {
            List<Node> copies = new ArrayList<>(c.nodes().size());
            result = new Node(kind, new Payload.Children(copies));
            for (Node child : c.nodes()) {
                Node childCopy = child.copy();
                result.adopt(childCopy);
                copies.add(childCopy);
            }
        } else {
            result = new Node(kind, payload);
        }
        result.location = location;
        return result;
    }

    /**
     * Verifies this node's children against {@link ShapeTable}.
     *
     * @return this node
     * @throws MalformedNodeException if the shape is violated
     */
    public Node check() {
        ShapeTable.check(this);
        return this;
    }

    // ==================== Internals ====================

    private List<Node> nodes() {
        if (payload instanceof Payload.Children c) {
            return c.nodes();
        }
        throw new InvalidAccessException(kind.displayName() + " node has no children");
    }

    private void requireMutable() {
        if (frozen) {
            throw new InvalidAccessException("The shared absence node cannot be modified");
        }
    }

    private void adopt(Node child) {
        if (child == null) {
            throw new MalformedNodeException(
                "Null child in " + kind.displayName() + "; use the absence node for missing slots");
        }
        if (child.frozen) {
            return;
        }
        if (child.parent != null) {
            throw new MalformedNodeException(
                child.kind.displayName() + " node already belongs to a "
                    + child.parent.kind.displayName() + "; detach or copy it first");
        }
        for (Node n = this; n != null; n = n.parent) {
            if (n == child) {
                throw new MalformedNodeException("Adding " + child.kind.displayName() + " would create a cycle");
            }
        }
        child.parent = this;
    }

    private void release(Node child) {
        if (!child.frozen) {
            child.parent = null;
        }
    }

    private WrongPayloadKindException wrongPayload(PayloadClass expected) {
        return new WrongPayloadKindException(
            kind.displayName() + " carries a " + kind.payloadClass() + " payload, not " + expected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node other)) {
            return false;
        }
        return kind == other.kind && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + payload.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb) {
        sb.append(kind.displayName());
        if (payload instanceof Payload.Children c) {
            sb.append('(');
            for (int i = 0; i < c.nodes().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                c.nodes().get(i).appendTo(sb);
            }
            sb.append(')');
        } else if (payload instanceof Payload.IntValue v) {
            sb.append(' ').append(v.value());
        } else if (payload instanceof Payload.FloatValue v) {
            sb.append(' ').append(v.value());
        } else if (payload instanceof Payload.TextValue v) {
            sb.append(' ').append(quote(v.text()));
        } else if (payload instanceof Payload.SymbolValue v) {
            sb.append(' ').append(quote(v.name()));
        }
    }

    private static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
    }
}
