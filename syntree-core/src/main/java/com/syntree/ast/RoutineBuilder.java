package com.syntree.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fluent assembly of routine definitions for macro code.
 *
 * <pre>{@code
 * Node proc = RoutineBuilder.of(NodeKind.PROC_DEF, "area")
 *     .exported()
 *     .param("w", Nodes.ident("int"))
 *     .param("h", Nodes.ident("int"))
 *     .returns(Nodes.ident("int"))
 *     .body(Nodes.infix("*", Nodes.ident("w"), Nodes.ident("h")))
 *     .build();
 * }</pre>
 */
public final class RoutineBuilder {

    private final NodeKind kind;
    private Node name;
    private Node pattern = Nodes.empty();
    private final List<Node> genericParams = new ArrayList<>();
    private Node returnType = Nodes.empty();
    private final List<Node> params = new ArrayList<>();
    private final List<Node> pragmas = new ArrayList<>();
    private Node body = Nodes.empty();

    private RoutineBuilder(NodeKind kind, Node name) {
        if (!kind.isRoutineDefinition()) {
            throw new IllegalArgumentException(kind.displayName() + " is not a routine kind");
        }
        this.kind = kind;
        this.name = name;
    }

    public static RoutineBuilder of(NodeKind kind, String name) {
        return new RoutineBuilder(kind, Nodes.ident(name));
    }

    public static RoutineBuilder of(NodeKind kind, Node name) {
        return new RoutineBuilder(kind, Objects.requireNonNull(name, "name"));
    }

    public static RoutineBuilder proc(String name) {
        return of(NodeKind.PROC_DEF, name);
    }

    public static RoutineBuilder lambda() {
        return new RoutineBuilder(NodeKind.LAMBDA, Nodes.empty());
    }

    /** Marks the routine name for export. */
    public RoutineBuilder exported() {
        this.name = Nodes.exported(name);
        return this;
    }

    /** Term-rewriting pattern, only meaningful for templates and macros. */
    public RoutineBuilder pattern(Node pattern) {
        this.pattern = pattern;
        return this;
    }

    public RoutineBuilder generic(String name) {
        return generic(name, Nodes.empty());
    }

    public RoutineBuilder generic(String name, Node constraint) {
        genericParams.add(Nodes.identDefs(Nodes.ident(name), constraint, Nodes.empty()));
        return this;
    }

    public RoutineBuilder param(String name, Node type) {
        return param(name, type, Nodes.empty());
    }

    public RoutineBuilder param(String name, Node type, Node defaultValue) {
        params.add(Nodes.identDefs(Nodes.ident(name), type, defaultValue));
        return this;
    }

    /** Adds a prepared {@link NodeKind#IDENT_DEFS} entry, e.g. one declaring several names. */
    public RoutineBuilder param(Node identDefs) {
        params.add(identDefs);
        return this;
    }

    public RoutineBuilder returns(Node type) {
        this.returnType = type;
        return this;
    }

    public RoutineBuilder pragma(String name) {
        return pragma(Nodes.ident(name));
    }

    public RoutineBuilder pragma(Node entry) {
        pragmas.add(entry);
        return this;
    }

    public RoutineBuilder body(Node body) {
        this.body = body;
        return this;
    }

    public RoutineBuilder body(Node... statements) {
        this.body = Nodes.stmtList(statements);
        return this;
    }

    /**
     * Assembles the routine. The builder keeps its parts, so it can be built
     * again; every call returns an independent tree.
     */
    public Node build() {
        List<Node> generics = copies(genericParams);
        List<Node> formal = new ArrayList<>(params.size() + 1);
        formal.add(returnType.copy());
        formal.addAll(copies(params));
        List<Node> pragmaEntries = copies(pragmas);
        return Nodes.compound(kind,
            name.copy(),
            pattern.copy(),
            generics.isEmpty() ? Nodes.empty() : Nodes.compound(NodeKind.GENERIC_PARAMS, generics),
            Nodes.compound(NodeKind.FORMAL_PARAMS, formal),
            pragmaEntries.isEmpty() ? Nodes.empty() : Nodes.compound(NodeKind.PRAGMA, pragmaEntries),
            Nodes.empty(),
            body.copy());
    }

    private static List<Node> copies(List<Node> nodes) {
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            result.add(node.copy());
        }
        return result;
    }
}
