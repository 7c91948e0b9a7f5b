package com.syntree.ast;

import com.syntree.InvalidAccessException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Typed, read-only view over the field list of an object type.
 *
 * <p>A field list holds plain fields and variant groups. A variant group is
 * keyed by a discriminator field and carries, per branch, the values that
 * select it and a nested field list of its own, which may again contain
 * variant groups. The view is a union of records rather than a class
 * hierarchy over the nodes; every record keeps the node it was read from.</p>
 */
public final class RecordFields {

    private RecordFields() {
        // Utility class
    }

    public sealed interface FieldEntry permits Field, VariantGroup, WhenGroup {
        Node node();
    }

    /**
     * One binding entry: the names it declares, their type and default value
     * (either may be the absence node).
     */
    public record Field(Node node, List<Node> names, Node type, Node defaultValue) implements FieldEntry {}

    public record VariantGroup(Node node, Field discriminator, List<VariantBranch> branches) implements FieldEntry {}

    /**
     * Branch of a variant group. {@code values} is empty for the else branch.
     */
    public record VariantBranch(Node node, List<Node> values, List<FieldEntry> fields) {
        public boolean isElse() {
            return node.kind() == NodeKind.ELSE;
        }
    }

    /** Compile-time conditional part of a field list. */
    public record WhenGroup(Node node, List<WhenBranch> branches) implements FieldEntry {}

    /**
     * Branch of a when group. {@code condition} is the absence node for the
     * else branch.
     */
    public record WhenBranch(Node node, Node condition, List<FieldEntry> fields) {}

    /**
     * Fields of an {@link NodeKind#OBJECT_TY} node.
     */
    public static List<FieldEntry> ofObject(Node objectTy) {
        if (objectTy.kind() != NodeKind.OBJECT_TY) {
            throw new InvalidAccessException(objectTy.kind().displayName() + " node is not an object type");
        }
        return of(objectTy.get(2));
    }

    /**
     * Reads a {@link NodeKind#REC_LIST}; the absence node reads as no fields.
     * Empty-branch markers ({@code nil}) and comments are skipped.
     */
    public static List<FieldEntry> of(Node fieldList) {
        if (fieldList.isAbsent()) {
            return List.of();
        }
        if (fieldList.kind() != NodeKind.REC_LIST) {
            return entryList(fieldList);
        }
        List<FieldEntry> entries = new ArrayList<>(fieldList.size());
        for (Node child : fieldList) {
            entries.addAll(entryList(child));
        }
        return Collections.unmodifiableList(entries);
    }

    private static List<FieldEntry> entryList(Node node) {
        switch (node.kind()) {
            case IDENT_DEFS:
                return List.of(field(node));
            case REC_CASE:
                return List.of(variantGroup(node));
            case REC_WHEN:
                return List.of(whenGroup(node));
            case REC_LIST:
                return of(node);
            case NIL_LIT:
            case COMMENT_STMT:
            case EMPTY:
                return List.of();
            default:
                throw new InvalidAccessException(node.kind().displayName() + " node is not a field list entry");
        }
    }

    private static Field field(Node identDefs) {
        int n = identDefs.size();
        List<Node> names = identDefs.children().subList(0, n - 2);
        return new Field(identDefs, names, identDefs.get(n - 2), identDefs.get(n - 1));
    }

    private static VariantGroup variantGroup(Node recCase) {
        Field discriminator = field(recCase.get(0));
        List<VariantBranch> branches = new ArrayList<>(recCase.size() - 1);
        for (int i = 1; i < recCase.size(); i++) {
            Node branch = recCase.get(i);
            List<Node> values = branch.kind() == NodeKind.ELSE
                ? List.of()
                : branch.children().subList(0, branch.size() - 1);
            branches.add(new VariantBranch(branch, values, of(branch.last())));
        }
        return new VariantGroup(recCase, discriminator, Collections.unmodifiableList(branches));
    }

    private static WhenGroup whenGroup(Node recWhen) {
        List<WhenBranch> branches = new ArrayList<>(recWhen.size());
        for (Node branch : recWhen) {
            Node condition = branch.kind() == NodeKind.ELSE ? Nodes.empty() : branch.get(0);
            branches.add(new WhenBranch(branch, condition, of(branch.last())));
        }
        return new WhenGroup(recWhen, Collections.unmodifiableList(branches));
    }
}
