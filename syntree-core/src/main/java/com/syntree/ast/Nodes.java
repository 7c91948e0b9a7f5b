package com.syntree.ast;

import com.syntree.MalformedNodeException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Constructors for every node shape.
 *
 * <p>The primitive constructors ({@link #scalar(NodeKind, long)},
 * {@link #scalar(NodeKind, double)}, {@link #text(NodeKind, String)} and
 * {@link #compound(NodeKind, List)}) check that the payload matches the kind
 * and that compound children satisfy {@link ShapeTable}. Every convenience
 * constructor goes through them, so a node returned from this class is always
 * well formed at the moment it is returned.</p>
 *
 * <p>Children passed in become owned by the new node. Pass a {@link Node#copy()}
 * to reuse a subtree that is still attached elsewhere.</p>
 */
public final class Nodes {

    private Nodes() {
        // Utility class
    }

    // ==================== Primitives ====================

    /**
     * The shared absence node.
     */
    public static Node empty() {
        return Node.EMPTY;
    }

    public static Node scalar(NodeKind kind, long value) {
        requirePayload(kind, PayloadClass.INTEGER);
        if (!kind.acceptsInteger(value)) {
            throw new MalformedNodeException(value + " does not fit in a " + kind.displayName());
        }
        return new Node(kind, new Payload.IntValue(value));
    }

    public static Node scalar(NodeKind kind, double value) {
        requirePayload(kind, PayloadClass.FLOAT);
        double stored = kind == NodeKind.FLOAT32_LIT ? (double) (float) value : value;
        return new Node(kind, new Payload.FloatValue(stored));
    }

    /**
     * Creates a text node. Symbol nodes cannot be created this way; they only
     * come from {@link Node#resolve(Symbol)}.
     */
    public static Node text(NodeKind kind, String value) {
        requirePayload(kind, PayloadClass.TEXT);
        if (kind == NodeKind.SYM) {
            throw new MalformedNodeException("Sym nodes are produced by resolving an Ident");
        }
        if (value == null) {
            throw new MalformedNodeException(kind.displayName() + " needs a text value");
        }
        return new Node(kind, new Payload.TextValue(value));
    }

    public static Node compound(NodeKind kind, Node... children) {
        return compound(kind, Arrays.asList(children));
    }

    /**
     * Creates a compound node with the given children and checks its shape.
     */
    public static Node compound(NodeKind kind, List<Node> children) {
        requirePayload(kind, PayloadClass.CHILDREN);
        Node node = Node.of(kind);
        try {
            for (Node child : children) {
                node.add(child);
            }
            return node.check();
        } catch (MalformedNodeException e) {
            // release whatever was adopted so the children stay usable
            while (node.size() > 0) {
                node.remove(0);
            }
            throw e;
        }
    }

    private static void requirePayload(NodeKind kind, PayloadClass expected) {
        Objects.requireNonNull(kind, "kind");
        if (kind.payloadClass() != expected) {
            throw new MalformedNodeException(
                kind.displayName() + " carries a " + kind.payloadClass() + " payload, not " + expected);
        }
    }

    // ==================== Atoms ====================

    public static Node ident(String name) {
        return text(NodeKind.IDENT, name);
    }

    public static Node nilLit() {
        return Node.of(NodeKind.NIL_LIT);
    }

    public static Node intLit(long value) {
        return scalar(NodeKind.INT_LIT, value);
    }

    public static Node uintLit(long value) {
        return scalar(NodeKind.UINT_LIT, value);
    }

    public static Node charLit(char c) {
        return scalar(NodeKind.CHAR_LIT, (long) c);
    }

    public static Node floatLit(double value) {
        return scalar(NodeKind.FLOAT_LIT, value);
    }

    public static Node float32Lit(float value) {
        return scalar(NodeKind.FLOAT32_LIT, (double) value);
    }

    public static Node strLit(String value) {
        return text(NodeKind.STR_LIT, value);
    }

    public static Node rStrLit(String value) {
        return text(NodeKind.RSTR_LIT, value);
    }

    public static Node tripleStrLit(String value) {
        return text(NodeKind.TRIPLE_STR_LIT, value);
    }

    public static Node comment(String text) {
        return text(NodeKind.COMMENT_STMT, text);
    }

    /**
     * Backtick-quoted name, e.g. {@code `+=`}.
     */
    public static Node accQuoted(String... parts) {
        List<Node> idents = new ArrayList<>(parts.length);
        for (String part : parts) {
            idents.add(ident(part));
        }
        return compound(NodeKind.ACC_QUOTED, idents);
    }

    // ==================== Calls and operators ====================

    public static Node call(Node callee, Node... args) {
        return compound(NodeKind.CALL, prepend(callee, args));
    }

    public static Node call(String callee, Node... args) {
        return call(ident(callee), args);
    }

    public static Node command(Node callee, Node... args) {
        return compound(NodeKind.COMMAND, prepend(callee, args));
    }

    /**
     * Call with a raw string argument, e.g. {@code re"\d+"}.
     */
    public static Node callStrLit(Node callee, Node text) {
        return compound(NodeKind.CALL_STR_LIT, callee, text);
    }

    public static Node infix(String op, Node left, Node right) {
        return compound(NodeKind.INFIX, ident(op), left, right);
    }

    public static Node prefix(String op, Node operand) {
        return compound(NodeKind.PREFIX, ident(op), operand);
    }

    public static Node postfix(String op, Node operand) {
        return compound(NodeKind.POSTFIX, ident(op), operand);
    }

    /**
     * Marks a declared name as exported: {@code name*}.
     */
    public static Node exported(Node name) {
        return postfix("*", name);
    }

    public static Node exprEqExpr(Node name, Node value) {
        return compound(NodeKind.EXPR_EQ_EXPR, name, value);
    }

    public static Node colon(Node name, Node value) {
        return compound(NodeKind.EXPR_COLON_EXPR, name, value);
    }

    public static Node asgn(Node target, Node value) {
        return compound(NodeKind.ASGN, target, value);
    }

    // ==================== Expressions ====================

    public static Node dot(Node object, Node member) {
        return compound(NodeKind.DOT_EXPR, object, member);
    }

    public static Node dot(Node object, String member) {
        return dot(object, ident(member));
    }

    public static Node bracketExpr(Node object, Node... indices) {
        return compound(NodeKind.BRACKET_EXPR, prepend(object, indices));
    }

    public static Node par(Node inner) {
        return compound(NodeKind.PAR, inner);
    }

    public static Node tupleConstr(Node... elements) {
        return compound(NodeKind.TUPLE_CONSTR, elements);
    }

    public static Node bracket(Node... elements) {
        return compound(NodeKind.BRACKET, elements);
    }

    public static Node curly(Node... elements) {
        return compound(NodeKind.CURLY, elements);
    }

    /**
     * Table constructor; every entry is a {@link #colon(Node, Node)} pair.
     */
    public static Node tableConstr(Node... entries) {
        return compound(NodeKind.TABLE_CONSTR, entries);
    }

    public static Node objConstr(Node type, Node... fields) {
        return compound(NodeKind.OBJ_CONSTR, prepend(type, fields));
    }

    public static Node deref(Node operand) {
        return compound(NodeKind.DEREF_EXPR, operand);
    }

    public static Node addr(Node operand) {
        return compound(NodeKind.ADDR, operand);
    }

    public static Node cast(Node type, Node operand) {
        return compound(NodeKind.CAST, type, operand);
    }

    public static Node conv(Node type, Node operand) {
        return compound(NodeKind.CONV, type, operand);
    }

    /**
     * A range in expression position, e.g. a slice bound: {@code Infix("..", low, high)}.
     */
    public static Node rangeInfix(Node low, Node high) {
        return infix("..", low, high);
    }

    /**
     * A range among the values of a case branch. This is the only place the
     * dedicated range kind is used.
     */
    public static Node caseRange(Node low, Node high) {
        return compound(NodeKind.RANGE, low, high);
    }

    public static Node ifExpr(Node... branches) {
        return compound(NodeKind.IF_EXPR, branches);
    }

    public static Node elifExpr(Node condition, Node value) {
        return compound(NodeKind.ELIF_EXPR, condition, value);
    }

    public static Node elseExpr(Node value) {
        return compound(NodeKind.ELSE_EXPR, value);
    }

    public static Node lambda(Node params, Node body) {
        return routine(NodeKind.LAMBDA, empty(), empty(), params, empty(), body);
    }

    public static Node stmtListExpr(Node... items) {
        return compound(NodeKind.STMT_LIST_EXPR, items);
    }

    // ==================== Statements ====================

    public static Node stmtList(Node... statements) {
        return compound(NodeKind.STMT_LIST, statements);
    }

    public static Node stmtList(List<Node> statements) {
        return compound(NodeKind.STMT_LIST, statements);
    }

    /**
     * Conditional statement from {@link #elifBranch} nodes, optionally ending
     * in one {@link #elseBranch}. A missing else is simply not there.
     */
    public static Node ifStmt(Node... branches) {
        return compound(NodeKind.IF_STMT, branches);
    }

    public static Node ifThen(Node condition, Node body) {
        return ifStmt(elifBranch(condition, body));
    }

    public static Node ifThenElse(Node condition, Node thenBody, Node elseBody) {
        return ifStmt(elifBranch(condition, thenBody), elseBranch(elseBody));
    }

    public static Node whenStmt(Node... branches) {
        return compound(NodeKind.WHEN_STMT, branches);
    }

    public static Node elifBranch(Node condition, Node body) {
        return compound(NodeKind.ELIF_BRANCH, condition, body);
    }

    public static Node elseBranch(Node body) {
        return compound(NodeKind.ELSE, body);
    }

    public static Node caseStmt(Node subject, Node... branches) {
        return compound(NodeKind.CASE_STMT, prepend(subject, branches));
    }

    /**
     * Case branch matching any of {@code values}; a value may be a
     * {@link #caseRange(Node, Node)}.
     */
    public static Node ofBranch(List<Node> values, Node body) {
        List<Node> children = new ArrayList<>(values);
        children.add(body);
        return compound(NodeKind.OF_BRANCH, children);
    }

    public static Node ofBranch(Node value, Node body) {
        return compound(NodeKind.OF_BRANCH, value, body);
    }

    public static Node whileStmt(Node condition, Node body) {
        return compound(NodeKind.WHILE_STMT, condition, body);
    }

    public static Node forStmt(Node variable, Node iterable, Node body) {
        return compound(NodeKind.FOR_STMT, variable, iterable, body);
    }

    public static Node forStmt(List<Node> variables, Node iterable, Node body) {
        List<Node> children = new ArrayList<>(variables);
        children.add(iterable);
        children.add(body);
        return compound(NodeKind.FOR_STMT, children);
    }

    public static Node tryStmt(Node body, Node... handlers) {
        return compound(NodeKind.TRY_STMT, prepend(body, handlers));
    }

    /**
     * Except branch catching the given exception types, or everything when
     * no type is given. The body is stored last.
     */
    public static Node exceptBranch(Node body, Node... exceptionTypes) {
        List<Node> children = new ArrayList<>(Arrays.asList(exceptionTypes));
        children.add(body);
        return compound(NodeKind.EXCEPT_BRANCH, children);
    }

    public static Node finallyBranch(Node body) {
        return compound(NodeKind.FINALLY, body);
    }

    public static Node deferStmt(Node body) {
        return compound(NodeKind.DEFER, body);
    }

    public static Node returnStmt(Node value) {
        return compound(NodeKind.RETURN_STMT, value);
    }

    public static Node returnStmt() {
        return returnStmt(empty());
    }

    public static Node yieldStmt(Node value) {
        return compound(NodeKind.YIELD_STMT, value);
    }

    public static Node discardStmt(Node value) {
        return compound(NodeKind.DISCARD_STMT, value);
    }

    public static Node discardStmt() {
        return discardStmt(empty());
    }

    public static Node raiseStmt(Node value) {
        return compound(NodeKind.RAISE_STMT, value);
    }

    public static Node raiseStmt() {
        return raiseStmt(empty());
    }

    public static Node breakStmt(Node label) {
        return compound(NodeKind.BREAK_STMT, label);
    }

    public static Node breakStmt() {
        return breakStmt(empty());
    }

    public static Node continueStmt(Node label) {
        return compound(NodeKind.CONTINUE_STMT, label);
    }

    public static Node continueStmt() {
        return continueStmt(empty());
    }

    public static Node blockStmt(Node label, Node body) {
        return compound(NodeKind.BLOCK_STMT, label, body);
    }

    public static Node blockStmt(Node body) {
        return blockStmt(empty(), body);
    }

    public static Node pragmaBlock(Node pragma, Node body) {
        return compound(NodeKind.PRAGMA_BLOCK, pragma, body);
    }

    // ==================== Imports ====================

    public static Node importStmt(Node... modules) {
        return compound(NodeKind.IMPORT_STMT, modules);
    }

    /**
     * {@code import module as alias}; the alias is an {@code as} infix, not a
     * kind of its own.
     */
    public static Node importAs(Node module, Node alias) {
        return importStmt(infix("as", module, alias));
    }

    public static Node importExcept(Node module, Node... excluded) {
        return compound(NodeKind.IMPORT_EXCEPT_STMT, prepend(module, excluded));
    }

    public static Node fromStmt(Node module, Node... names) {
        return compound(NodeKind.FROM_STMT, prepend(module, names));
    }

    public static Node exportStmt(Node... names) {
        return compound(NodeKind.EXPORT_STMT, names);
    }

    public static Node exportExcept(Node module, Node... excluded) {
        return compound(NodeKind.EXPORT_EXCEPT_STMT, prepend(module, excluded));
    }

    public static Node includeStmt(Node... modules) {
        return compound(NodeKind.INCLUDE_STMT, modules);
    }

    // ==================== Declarations ====================

    public static Node varSection(Node... entries) {
        return compound(NodeKind.VAR_SECTION, entries);
    }

    public static Node letSection(Node... entries) {
        return compound(NodeKind.LET_SECTION, entries);
    }

    public static Node constSection(Node... entries) {
        return compound(NodeKind.CONST_SECTION, entries);
    }

    public static Node typeSection(Node... entries) {
        return compound(NodeKind.TYPE_SECTION, entries);
    }

    /**
     * Binding entry {@code name: type = value}; type and value may each be
     * the absence node.
     */
    public static Node identDefs(Node name, Node type, Node value) {
        return compound(NodeKind.IDENT_DEFS, name, type, value);
    }

    /**
     * Binding entry declaring several names that share one type and default.
     */
    public static Node identDefs(List<Node> names, Node type, Node value) {
        List<Node> children = new ArrayList<>(names);
        children.add(type);
        children.add(value);
        return compound(NodeKind.IDENT_DEFS, children);
    }

    /**
     * Constant entry; {@code value} is required.
     */
    public static Node constDef(Node name, Node type, Node value) {
        return compound(NodeKind.CONST_DEF, name, type, value);
    }

    /**
     * Tuple unpacking entry {@code (a, b) = value}.
     */
    public static Node varTuple(List<Node> names, Node value) {
        List<Node> children = new ArrayList<>(names);
        children.add(empty());
        children.add(value);
        return compound(NodeKind.VAR_TUPLE, children);
    }

    public static Node typeDef(Node name, Node genericParams, Node body) {
        return compound(NodeKind.TYPE_DEF, name, genericParams, body);
    }

    public static Node genericParams(Node... params) {
        return compound(NodeKind.GENERIC_PARAMS, params);
    }

    /**
     * Formal parameter list: the return type (or the absence node) followed
     * by {@link #identDefs} entries.
     */
    public static Node formalParams(Node returnType, Node... params) {
        return compound(NodeKind.FORMAL_PARAMS, prepend(returnType, params));
    }

    public static Node pragma(Node... entries) {
        return compound(NodeKind.PRAGMA, entries);
    }

    public static Node pragmaExpr(Node expr, Node pragma) {
        return compound(NodeKind.PRAGMA_EXPR, expr, pragma);
    }

    /**
     * Routine definition with no term-rewriting pattern and nothing in the
     * reserved slot.
     */
    public static Node routine(NodeKind kind, Node name, Node genericParams, Node params, Node pragma, Node body) {
        return compound(kind, name, empty(), genericParams, params, pragma, empty(), body);
    }

    public static Node procDef(Node name, Node params, Node body) {
        return routine(NodeKind.PROC_DEF, name, empty(), params, empty(), body);
    }

    // ==================== Type expressions ====================

    public static Node objectTy(Node pragma, Node base, Node fields) {
        return compound(NodeKind.OBJECT_TY, pragma, base, fields);
    }

    public static Node ofInherit(Node base) {
        return compound(NodeKind.OF_INHERIT, base);
    }

    public static Node recList(Node... fields) {
        return compound(NodeKind.REC_LIST, fields);
    }

    /**
     * Variant part of an object: a discriminator binding followed by
     * {@link #ofBranch} nodes whose bodies are {@link #recList} nodes.
     */
    public static Node recCase(Node discriminator, Node... branches) {
        return compound(NodeKind.REC_CASE, prepend(discriminator, branches));
    }

    public static Node recWhen(Node... branches) {
        return compound(NodeKind.REC_WHEN, branches);
    }

    /**
     * Enumeration type without pragmas.
     */
    public static Node enumTy(Node... fields) {
        return compound(NodeKind.ENUM_TY, prepend(empty(), fields));
    }

    public static Node enumField(Node name, Node value) {
        return compound(NodeKind.ENUM_FIELD_DEF, name, value);
    }

    public static Node refTy(Node inner) {
        return compound(NodeKind.REF_TY, inner);
    }

    public static Node ptrTy(Node inner) {
        return compound(NodeKind.PTR_TY, inner);
    }

    public static Node varTy(Node inner) {
        return compound(NodeKind.VAR_TY, inner);
    }

    public static Node distinctTy(Node inner) {
        return compound(NodeKind.DISTINCT_TY, inner);
    }

    public static Node procTy(Node params, Node pragma) {
        return compound(NodeKind.PROC_TY, params, pragma);
    }

    public static Node tupleTy(Node... fields) {
        return compound(NodeKind.TUPLE_TY, fields);
    }

    private static List<Node> prepend(Node first, Node[] rest) {
        List<Node> all = new ArrayList<>(rest.length + 1);
        all.add(first);
        all.addAll(Arrays.asList(rest));
        return all;
    }
}
