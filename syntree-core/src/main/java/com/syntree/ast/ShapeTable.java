package com.syntree.ast;

import com.syntree.Logging;
import com.syntree.MalformedNodeException;
import org.apache.log4j.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.syntree.ast.NodeKind.*;
import static com.syntree.ast.Shape.optional;
import static com.syntree.ast.Shape.slot;

/**
 * The contract between tree producers and consumers: for every compound
 * kind, the children it must have, in which order, and which of them may be
 * the absence node.
 *
 * <p>Kinds without an entry (mostly internal forms introduced after semantic
 * checking) accept any child list.</p>
 */
public final class ShapeTable {

    private static final Logger logger = Logging.getLogger("shape");

    private static final Map<NodeKind, Shape> SHAPES = new EnumMap<>(NodeKind.class);

    static {
        // Calls and operators
        Shape callLike = Shape.builder().lead(slot("callee")).repeat(slot("arg"), 0).build();
        SHAPES.put(CALL, callLike);
        SHAPES.put(COMMAND, callLike);
        SHAPES.put(DOT_CALL, callLike);
        SHAPES.put(CALL_STR_LIT, Shape.builder()
            .lead(slot("callee"), slot("text", STR_LIT, RSTR_LIT, TRIPLE_STR_LIT))
            .build());
        SHAPES.put(INFIX, Shape.builder()
            .lead(operator(), slot("left"), slot("right"))
            .build());
        Shape unary = Shape.builder().lead(operator(), slot("operand")).build();
        SHAPES.put(PREFIX, unary);
        SHAPES.put(POSTFIX, unary);
        Shape pair = Shape.builder().lead(slot("name"), slot("value")).build();
        SHAPES.put(EXPR_EQ_EXPR, pair);
        SHAPES.put(EXPR_COLON_EXPR, pair);

        // Expressions
        Shape operand = Shape.builder().lead(slot("operand")).build();
        SHAPES.put(DEREF_EXPR, operand);
        SHAPES.put(ADDR, operand);
        SHAPES.put(HIDDEN_DEREF, operand);
        SHAPES.put(HIDDEN_ADDR, operand);
        Shape conversion = Shape.builder().lead(slot("type"), slot("operand")).build();
        SHAPES.put(CAST, conversion);
        SHAPES.put(CONV, conversion);
        SHAPES.put(DOT_EXPR, Shape.builder().lead(slot("object"), slot("member")).build());
        SHAPES.put(BRACKET_EXPR, Shape.builder().lead(slot("object")).repeat(slot("index"), 0).build());
        SHAPES.put(CURLY_EXPR, Shape.builder().lead(slot("object")).repeat(slot("index"), 0).build());
        SHAPES.put(PAR, Shape.builder().lead(slot("inner")).build());
        Shape elements = Shape.builder().repeat(slot("element"), 0).build();
        SHAPES.put(TUPLE_CONSTR, elements);
        SHAPES.put(BRACKET, elements);
        SHAPES.put(CURLY, elements);
        SHAPES.put(TABLE_CONSTR, Shape.builder().repeat(slot("entry", EXPR_COLON_EXPR), 0).build());
        SHAPES.put(OBJ_CONSTR, Shape.builder()
            .lead(slot("type"))
            .repeat(slot("field", EXPR_COLON_EXPR), 0)
            .build());
        SHAPES.put(RANGE, Shape.builder().lead(slot("low"), slot("high")).build());
        SHAPES.put(ACC_QUOTED, Shape.builder().repeat(slot("part"), 1).build());
        SHAPES.put(PRAGMA_EXPR, Shape.builder().lead(slot("expr"), slot("pragma", PRAGMA)).build());
        SHAPES.put(STMT_LIST_EXPR, Shape.builder().repeat(slot("item"), 1).build());
        SHAPES.put(STATIC_EXPR, operand);
        SHAPES.put(TYPE_OF_EXPR, Shape.builder().repeat(slot("expr"), 1).build());
        SHAPES.put(IF_EXPR, branches(ELIF_EXPR, ELSE_EXPR));
        SHAPES.put(ELIF_EXPR, Shape.builder().lead(slot("condition"), slot("value")).build());
        SHAPES.put(ELSE_EXPR, Shape.builder().lead(slot("value")).build());

        // Statements
        SHAPES.put(STMT_LIST, Shape.builder().repeat(slot("statement"), 0).build());
        SHAPES.put(ASGN, Shape.builder().lead(slot("target"), slot("value")).build());
        SHAPES.put(FAST_ASGN, SHAPES.get(ASGN));
        SHAPES.put(SINK_ASGN, SHAPES.get(ASGN));
        SHAPES.put(IF_STMT, branches(ELIF_BRANCH, ELSE));
        SHAPES.put(WHEN_STMT, branches(ELIF_BRANCH, ELSE));
        SHAPES.put(ELIF_BRANCH, Shape.builder().lead(slot("condition"), slot("body")).build());
        SHAPES.put(ELSE, Shape.builder().lead(slot("body")).build());
        SHAPES.put(CASE_STMT, Shape.builder()
            .lead(slot("subject"))
            .repeat(slot("branch", OF_BRANCH, ELIF_BRANCH, ELSE), 1)
            .rule("else branch must come last", ShapeTable::elseOnlyLast)
            .build());
        SHAPES.put(OF_BRANCH, Shape.builder().repeat(slot("value"), 1).trail(slot("body")).build());
        SHAPES.put(WHILE_STMT, Shape.builder().lead(slot("condition"), slot("body")).build());
        Shape forLoop = Shape.builder()
            .repeat(slot("variable"), 1)
            .trail(slot("iterable"), slot("body"))
            .build();
        SHAPES.put(FOR_STMT, forLoop);
        SHAPES.put(PAR_FOR_STMT, forLoop);
        SHAPES.put(TRY_STMT, Shape.builder()
            .lead(slot("body"))
            .repeat(slot("handler", EXCEPT_BRANCH, FINALLY), 1)
            .rule("finally branch must come last", n -> onlyLast(n, FINALLY))
            .build());
        SHAPES.put(EXCEPT_BRANCH, Shape.builder().repeat(slot("exceptionType"), 0).trail(slot("body")).build());
        Shape body = Shape.builder().lead(slot("body")).build();
        SHAPES.put(FINALLY, body);
        SHAPES.put(DEFER, body);
        SHAPES.put(STATIC_STMT, body);
        Shape valueOrAbsent = Shape.builder().lead(optional("value")).build();
        SHAPES.put(RETURN_STMT, valueOrAbsent);
        SHAPES.put(YIELD_STMT, valueOrAbsent);
        SHAPES.put(DISCARD_STMT, valueOrAbsent);
        SHAPES.put(RAISE_STMT, valueOrAbsent);
        Shape labelOrAbsent = Shape.builder().lead(optional("label")).build();
        SHAPES.put(BREAK_STMT, labelOrAbsent);
        SHAPES.put(CONTINUE_STMT, labelOrAbsent);
        Shape block = Shape.builder().lead(optional("label"), slot("body")).build();
        SHAPES.put(BLOCK_STMT, block);
        SHAPES.put(BLOCK_EXPR, block);
        SHAPES.put(BLOCK_TYPE, block);
        SHAPES.put(PRAGMA_BLOCK, Shape.builder().lead(slot("pragma", PRAGMA), slot("body")).build());
        SHAPES.put(ASM_STMT, Shape.builder()
            .lead(optional("pragma", PRAGMA), slot("code", STR_LIT, RSTR_LIT, TRIPLE_STR_LIT))
            .build());

        // Imports
        Shape modules = Shape.builder().repeat(slot("module"), 1).build();
        SHAPES.put(IMPORT_STMT, modules);
        SHAPES.put(EXPORT_STMT, modules);
        SHAPES.put(INCLUDE_STMT, modules);
        Shape moduleWithNames = Shape.builder().lead(slot("module")).repeat(slot("name"), 1).build();
        SHAPES.put(IMPORT_EXCEPT_STMT, moduleWithNames);
        SHAPES.put(EXPORT_EXCEPT_STMT, moduleWithNames);
        SHAPES.put(FROM_STMT, moduleWithNames);
        Shape names = Shape.builder().repeat(slot("name"), 1).build();
        SHAPES.put(BIND_STMT, names);
        SHAPES.put(MIXIN_STMT, names);

        // Declarations
        Shape bindings = Shape.builder().repeat(slot("entry", IDENT_DEFS, VAR_TUPLE), 1).build();
        SHAPES.put(VAR_SECTION, bindings);
        SHAPES.put(LET_SECTION, bindings);
        SHAPES.put(USING_STMT, Shape.builder().repeat(slot("entry", IDENT_DEFS), 1).build());
        SHAPES.put(CONST_SECTION, Shape.builder().repeat(slot("entry", CONST_DEF), 1).build());
        SHAPES.put(TYPE_SECTION, Shape.builder().repeat(slot("entry", TYPE_DEF), 1).build());
        SHAPES.put(IDENT_DEFS, Shape.builder()
            .repeat(declaredName(), 1)
            .trail(optional("type"), optional("default"))
            .build());
        SHAPES.put(VAR_TUPLE, Shape.builder()
            .repeat(slot("name"), 1)
            .trail(optional("type"), slot("value"))
            .build());
        SHAPES.put(CONST_DEF, Shape.builder()
            .lead(declaredName(), optional("type"), slot("value"))
            .build());
        SHAPES.put(TYPE_DEF, Shape.builder()
            .lead(declaredName(), optional("genericParams", GENERIC_PARAMS), slot("body"))
            .build());
        SHAPES.put(GENERIC_PARAMS, Shape.builder().repeat(slot("param", IDENT_DEFS), 1).build());
        SHAPES.put(FORMAL_PARAMS, Shape.builder()
            .lead(optional("returnType"))
            .repeat(slot("param", IDENT_DEFS), 0)
            .build());
        SHAPES.put(PRAGMA, Shape.builder().repeat(slot("entry"), 1).build());
        Shape named = routine(false);
        for (NodeKind kind : new NodeKind[] {
            PROC_DEF, FUNC_DEF, METHOD_DEF, ITERATOR_DEF, CONVERTER_DEF, TEMPLATE_DEF, MACRO_DEF }) {
            SHAPES.put(kind, named);
        }
        Shape anonymous = routine(true);
        SHAPES.put(LAMBDA, anonymous);
        SHAPES.put(DO, anonymous);

        // Type expressions
        SHAPES.put(OBJECT_TY, Shape.builder()
            .lead(optional("pragma", PRAGMA), optional("base", OF_INHERIT), optional("fields", REC_LIST))
            .build());
        SHAPES.put(OF_INHERIT, Shape.builder().lead(slot("base")).build());
        SHAPES.put(REC_LIST, Shape.builder()
            .repeat(slot("field", IDENT_DEFS, REC_CASE, REC_WHEN, NIL_LIT, COMMENT_STMT), 0)
            .build());
        SHAPES.put(REC_CASE, Shape.builder()
            .lead(slot("discriminator", IDENT_DEFS))
            .repeat(slot("branch", OF_BRANCH, ELSE), 1)
            .rule("else branch must come last", ShapeTable::elseOnlyLast)
            .build());
        SHAPES.put(REC_WHEN, branches(ELIF_BRANCH, ELSE));
        SHAPES.put(ENUM_TY, Shape.builder()
            .lead(optional("pragma", PRAGMA))
            .repeat(slot("field", IDENT, SYM, ACC_QUOTED, ENUM_FIELD_DEF, PRAGMA_EXPR), 1)
            .build());
        SHAPES.put(ENUM_FIELD_DEF, Shape.builder().lead(slot("name"), slot("value")).build());
        Shape wrapper = Shape.builder().repeat(slot("inner"), 0, 1).build();
        for (NodeKind kind : new NodeKind[] { REF_TY, PTR_TY, VAR_TY, OUT_TY, CONST_TY, DISTINCT_TY, STATIC_TY }) {
            SHAPES.put(kind, wrapper);
        }
        Shape procType = Shape.builder()
            .lead(slot("params", FORMAL_PARAMS), optional("pragma", PRAGMA))
            .build();
        SHAPES.put(PROC_TY, procType);
        SHAPES.put(ITERATOR_TY, procType);
        SHAPES.put(TUPLE_TY, Shape.builder().repeat(slot("field", IDENT_DEFS), 0).build());
        SHAPES.put(TUPLE_CLASS_TY, Shape.builder().build());
    }

    private ShapeTable() {
        // Utility class
    }

    /**
     * @return the shape of {@code kind}; {@link Shape#LEAF} for kinds without
     *     a child list and {@link Shape#ANY} for unconstrained compound kinds
     */
    public static Shape shapeOf(NodeKind kind) {
        if (!kind.isCompound()) {
            return Shape.LEAF;
        }
        return SHAPES.getOrDefault(kind, Shape.ANY);
    }

    /**
     * Kinds whose child list is constrained, with their shapes.
     */
    public static Map<NodeKind, Shape> constrainedShapes() {
        return Collections.unmodifiableMap(SHAPES);
    }

    /**
     * Checks one node against its kind's shape, without descending.
     */
    public static void check(Node node) {
        try {
            shapeOf(node.kind()).check(node);
            checkRangePlacement(node);
        } catch (MalformedNodeException e) {
            if (logger.isTraceEnabled()) {
                logger.trace("rejected " + node + ": " + e.getMessage());
            }
            throw e;
        }
    }

    /**
     * Checks a node and every descendant.
     */
    public static void checkTree(Node root) {
        root.walk(ShapeTable::check);
    }

    // ==================== Shape helpers ====================

    private static Shape.Slot operator() {
        return slot("operator", IDENT, SYM, ACC_QUOTED, OPEN_SYM_CHOICE, CLOSED_SYM_CHOICE, OPEN_SYM);
    }

    private static Shape.Slot declaredName() {
        return slot("name", IDENT, SYM, ACC_QUOTED, POSTFIX, PRAGMA_EXPR);
    }

    /**
     * Condition branches followed by at most one else branch, which is
     * simply left out when there is no else.
     */
    private static Shape branches(NodeKind branch, NodeKind elseBranch) {
        return Shape.builder()
            .repeat(slot("branch", branch, elseBranch), 1)
            .rule("must start with a " + branch.displayName(), n -> n.get(0).kind() == branch)
            .rule(elseBranch.displayName() + " must come last", n -> onlyLast(n, elseBranch))
            .build();
    }

    private static Shape routine(boolean anonymous) {
        Shape.Slot name = anonymous
            ? optional("name")
            : slot("name", IDENT, SYM, ACC_QUOTED, POSTFIX);
        return Shape.builder()
            .lead(name,
                optional("pattern"),
                optional("genericParams", GENERIC_PARAMS),
                slot("params", FORMAL_PARAMS),
                optional("pragma", PRAGMA),
                optional("reserved"),
                optional("body"))
            .build();
    }

    /**
     * {@link NodeKind#RANGE} may only be a value of an {@link NodeKind#OF_BRANCH};
     * ranges anywhere else are written as {@code ..} infix expressions.
     */
    private static void checkRangePlacement(Node node) {
        if (!node.kind().isCompound()) {
            return;
        }
        int valueCount = node.kind() == OF_BRANCH ? node.size() - 1 : 0;
        for (int i = valueCount; i < node.size(); i++) {
            if (node.get(i).kind() == RANGE) {
                throw new MalformedNodeException(
                    node.kind().displayName() + " child " + i
                        + " is a Range, which is only allowed among case branch values; use Infix(\"..\") instead");
            }
        }
    }

    private static boolean elseOnlyLast(Node node) {
        return onlyLast(node, ELSE);
    }

    private static boolean onlyLast(Node node, NodeKind kind) {
        for (int i = 0; i < node.size() - 1; i++) {
            if (node.get(i).kind() == kind) {
                return false;
            }
        }
        return true;
    }
}
