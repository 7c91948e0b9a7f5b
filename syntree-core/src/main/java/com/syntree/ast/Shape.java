package com.syntree.ast;

import com.syntree.MalformedNodeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Required child layout of one compound kind.
 *
 * <p>A shape is a run of leading slots, an optional repeated slot with a
 * minimum (and optionally maximum) count, a run of trailing slots, and extra
 * rules over the whole child list. A slot is either required, in which case
 * it must hold a real node, or optional, in which case it may hold the
 * absence node; in both cases the position itself is always present.</p>
 */
public final class Shape {

    /** Any number of children of any kind. */
    public static final Shape ANY = builder().repeat(slot("child"), 0).build();

    /** No children at all; used for non-compound kinds. */
    public static final Shape LEAF = builder().build();

    private final List<Slot> leading;
    private final Slot repeated;
    private final int minRepeated;
    private final int maxRepeated;
    private final List<Slot> trailing;
    private final List<Rule> rules;

    private Shape(Builder b) {
        this.leading = Collections.unmodifiableList(new ArrayList<>(b.leading));
        this.repeated = b.repeated;
        this.minRepeated = b.minRepeated;
        this.maxRepeated = b.maxRepeated;
        this.trailing = Collections.unmodifiableList(new ArrayList<>(b.trailing));
        this.rules = Collections.unmodifiableList(new ArrayList<>(b.rules));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Required slot accepting any kind. */
    public static Slot slot(String role) {
        return new Slot(role, false, Set.of());
    }

    /** Required slot restricted to the given kinds. */
    public static Slot slot(String role, NodeKind first, NodeKind... rest) {
        return new Slot(role, false, EnumSet.of(first, rest));
    }

    /** Slot that may hold the absence node. */
    public static Slot optional(String role) {
        return new Slot(role, true, Set.of());
    }

    /** Slot that may hold the absence node or one of the given kinds. */
    public static Slot optional(String role, NodeKind first, NodeKind... rest) {
        return new Slot(role, true, EnumSet.of(first, rest));
    }

    public List<Slot> leading() {
        return leading;
    }

    public List<Slot> trailing() {
        return trailing;
    }

    public boolean isVariadic() {
        return repeated != null;
    }

    public int minArity() {
        return leading.size() + trailing.size() + (repeated != null ? minRepeated : 0);
    }

    /**
     * @return maximum child count, or -1 when unbounded
     */
    public int maxArity() {
        if (repeated == null) {
            return leading.size() + trailing.size();
        }
        return maxRepeated < 0 ? -1 : leading.size() + trailing.size() + maxRepeated;
    }

    /**
     * The slot governing child {@code index} of a node with {@code size}
     * children.
     */
    public Slot slotAt(int index, int size) {
        if (index < leading.size()) {
            return leading.get(index);
        }
        int trailStart = size - trailing.size();
        if (index >= trailStart) {
            return trailing.get(index - trailStart);
        }
        return repeated;
    }

    /**
     * Checks the children of {@code node}.
     *
     * @throws MalformedNodeException naming the first violation found
     */
    public void check(Node node) {
        int size = node.kind().isCompound() ? node.size() : 0;
        int max = maxArity();
        if (size < minArity() || (max >= 0 && size > max)) {
            throw new MalformedNodeException(
                node.kind().displayName() + " expects " + this + " but has " + size + " children");
        }
        for (int i = 0; i < size; i++) {
            Slot slot = slotAt(i, size);
            Node child = node.get(i);
            if (!slot.accepts(child)) {
                throw new MalformedNodeException(
                    node.kind().displayName() + " child " + i + " (" + slot.role() + ") "
                        + slot.describeRejection(child));
            }
        }
        for (Rule rule : rules) {
            if (!rule.test().test(node)) {
                throw new MalformedNodeException(node.kind().displayName() + ": " + rule.description());
            }
        }
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        for (Slot slot : leading) {
            parts.add(slot.toString());
        }
        if (repeated != null) {
            String suffix;
            if (maxRepeated == 1 && minRepeated == 0) {
                suffix = "?";
            } else if (minRepeated == 0) {
                suffix = "*";
            } else if (minRepeated == 1) {
                suffix = "+";
            } else {
                suffix = "{" + minRepeated + ",}";
            }
            parts.add(repeated + suffix);
        }
        for (Slot slot : trailing) {
            parts.add(slot.toString());
        }
        return "[" + String.join(", ", parts) + "]";
    }

    /**
     * One child position: its role name, whether it may hold the absence
     * node, and the kinds allowed in it (empty meaning any).
     */
    public record Slot(String role, boolean optional, Set<NodeKind> allowed) {

        public boolean accepts(Node child) {
            if (child.isAbsent()) {
                return optional;
            }
            return allowed.isEmpty() || allowed.contains(child.kind());
        }

        String describeRejection(Node child) {
            if (child.isAbsent()) {
                return "is required but holds the absence node";
            }
            return "cannot be " + child.kind().displayName();
        }

        @Override
        public String toString() {
            return optional ? role + "?" : role;
        }
    }

    record Rule(String description, Predicate<Node> test) {}

    public static final class Builder {
        private final List<Slot> leading = new ArrayList<>();
        private Slot repeated;
        private int minRepeated;
        private int maxRepeated = -1;
        private final List<Slot> trailing = new ArrayList<>();
        private final List<Rule> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder lead(Slot... slots) {
            leading.addAll(List.of(slots));
            return this;
        }

        public Builder repeat(Slot slot, int min) {
            return repeat(slot, min, -1);
        }

        public Builder repeat(Slot slot, int min, int max) {
            if (repeated != null) {
                throw new IllegalStateException("A shape has at most one repeated slot");
            }
            this.repeated = slot;
            this.minRepeated = min;
            this.maxRepeated = max;
            return this;
        }

        public Builder trail(Slot... slots) {
            trailing.addAll(List.of(slots));
            return this;
        }

        public Builder rule(String description, Predicate<Node> test) {
            rules.add(new Rule(description, test));
            return this;
        }

        public Shape build() {
            return new Shape(this);
        }
    }
}
