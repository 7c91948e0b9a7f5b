package com.syntree.ast;

import static com.syntree.ast.KindGroup.ATOM;
import static com.syntree.ast.KindGroup.DECLARATION;
import static com.syntree.ast.KindGroup.EXPRESSION;
import static com.syntree.ast.KindGroup.SPECIAL;
import static com.syntree.ast.KindGroup.STATEMENT;
import static com.syntree.ast.PayloadClass.FLOAT;
import static com.syntree.ast.PayloadClass.INTEGER;
import static com.syntree.ast.PayloadClass.TEXT;

/**
 * The closed set of node kinds.
 *
 * <p>Every kind fixes the {@link PayloadClass} its nodes carry and the
 * {@link KindGroup} it belongs to. The child layout of compound kinds is
 * described by {@link ShapeTable}.</p>
 */
public enum NodeKind {
    // Atoms
    NONE(ATOM, PayloadClass.NONE),
    /** The absence node used for every unused optional slot. */
    EMPTY(ATOM, PayloadClass.NONE),
    IDENT(ATOM, TEXT),
    /** An identifier after name resolution; carries a {@link Symbol}. */
    SYM(ATOM, TEXT),
    TYPE(ATOM, PayloadClass.NONE),
    CHAR_LIT(ATOM, INTEGER),
    INT_LIT(ATOM, INTEGER),
    INT8_LIT(ATOM, INTEGER),
    INT16_LIT(ATOM, INTEGER),
    INT32_LIT(ATOM, INTEGER),
    INT64_LIT(ATOM, INTEGER),
    UINT_LIT(ATOM, INTEGER, "UIntLit"),
    UINT8_LIT(ATOM, INTEGER, "UInt8Lit"),
    UINT16_LIT(ATOM, INTEGER, "UInt16Lit"),
    UINT32_LIT(ATOM, INTEGER, "UInt32Lit"),
    UINT64_LIT(ATOM, INTEGER, "UInt64Lit"),
    FLOAT_LIT(ATOM, FLOAT),
    FLOAT32_LIT(ATOM, FLOAT),
    FLOAT64_LIT(ATOM, FLOAT),
    FLOAT128_LIT(ATOM, FLOAT),
    STR_LIT(ATOM, TEXT),
    RSTR_LIT(ATOM, TEXT, "RStrLit"),
    TRIPLE_STR_LIT(ATOM, TEXT),
    NIL_LIT(ATOM, PayloadClass.NONE),

    // Calls and operator applications
    COMES_FROM(SPECIAL),
    DOT_CALL(KindGroup.CALL),
    COMMAND(KindGroup.CALL),
    CALL(KindGroup.CALL),
    CALL_STR_LIT(KindGroup.CALL),
    INFIX(KindGroup.CALL),
    PREFIX(KindGroup.CALL),
    POSTFIX(KindGroup.CALL),
    HIDDEN_CALL_CONV(SPECIAL),

    // Expressions
    EXPR_EQ_EXPR(EXPRESSION),
    EXPR_COLON_EXPR(EXPRESSION),
    IDENT_DEFS(DECLARATION),
    VAR_TUPLE(DECLARATION),
    PAR(EXPRESSION),
    OBJ_CONSTR(EXPRESSION),
    CURLY(EXPRESSION),
    CURLY_EXPR(EXPRESSION),
    BRACKET(EXPRESSION),
    BRACKET_EXPR(EXPRESSION),
    PRAGMA_EXPR(EXPRESSION),
    /** Only used for value ranges inside case branches. */
    RANGE(EXPRESSION),
    DOT_EXPR(EXPRESSION),
    CHECKED_FIELD_EXPR(SPECIAL),
    DEREF_EXPR(EXPRESSION),
    IF_EXPR(EXPRESSION),
    ELIF_EXPR(EXPRESSION),
    ELSE_EXPR(EXPRESSION),
    LAMBDA(EXPRESSION),
    DO(EXPRESSION),
    ACC_QUOTED(EXPRESSION),
    TABLE_CONSTR(EXPRESSION),
    BIND(EXPRESSION),
    CLOSED_SYM_CHOICE(SPECIAL),
    OPEN_SYM_CHOICE(SPECIAL),
    HIDDEN_STD_CONV(SPECIAL),
    HIDDEN_SUB_CONV(SPECIAL),
    CONV(EXPRESSION),
    CAST(EXPRESSION),
    STATIC_EXPR(EXPRESSION),
    ADDR(EXPRESSION),
    HIDDEN_ADDR(SPECIAL),
    HIDDEN_DEREF(SPECIAL),
    OBJ_DOWN_CONV(SPECIAL),
    OBJ_UP_CONV(SPECIAL),
    CHCK_RANGE_F(SPECIAL),
    CHCK_RANGE64(SPECIAL),
    CHCK_RANGE(SPECIAL),
    STRING_TO_CSTRING(SPECIAL, "StringToCString"),
    CSTRING_TO_STRING(SPECIAL, "CStringToString"),

    // Statements and declarations
    ASGN(STATEMENT),
    FAST_ASGN(SPECIAL),
    GENERIC_PARAMS(DECLARATION),
    FORMAL_PARAMS(DECLARATION),
    OF_INHERIT(KindGroup.TYPE),
    IMPORT_AS(STATEMENT),
    PROC_DEF(DECLARATION),
    METHOD_DEF(DECLARATION),
    CONVERTER_DEF(DECLARATION),
    MACRO_DEF(DECLARATION),
    TEMPLATE_DEF(DECLARATION),
    ITERATOR_DEF(DECLARATION),
    OF_BRANCH(STATEMENT),
    ELIF_BRANCH(STATEMENT),
    EXCEPT_BRANCH(STATEMENT),
    ELSE(STATEMENT),
    ASM_STMT(STATEMENT),
    PRAGMA(DECLARATION),
    PRAGMA_BLOCK(STATEMENT),
    IF_STMT(STATEMENT),
    WHEN_STMT(STATEMENT),
    FOR_STMT(STATEMENT),
    PAR_FOR_STMT(STATEMENT),
    WHILE_STMT(STATEMENT),
    CASE_STMT(STATEMENT),
    TYPE_SECTION(DECLARATION),
    VAR_SECTION(DECLARATION),
    LET_SECTION(DECLARATION),
    CONST_SECTION(DECLARATION),
    CONST_DEF(DECLARATION),
    TYPE_DEF(DECLARATION),
    YIELD_STMT(STATEMENT),
    DEFER(STATEMENT),
    TRY_STMT(STATEMENT),
    FINALLY(STATEMENT),
    RAISE_STMT(STATEMENT),
    RETURN_STMT(STATEMENT),
    BREAK_STMT(STATEMENT),
    CONTINUE_STMT(STATEMENT),
    BLOCK_STMT(STATEMENT),
    STATIC_STMT(STATEMENT),
    DISCARD_STMT(STATEMENT),
    STMT_LIST(STATEMENT),
    IMPORT_STMT(STATEMENT),
    IMPORT_EXCEPT_STMT(STATEMENT),
    EXPORT_STMT(STATEMENT),
    EXPORT_EXCEPT_STMT(STATEMENT),
    FROM_STMT(STATEMENT),
    INCLUDE_STMT(STATEMENT),
    BIND_STMT(STATEMENT),
    MIXIN_STMT(STATEMENT),
    USING_STMT(STATEMENT),
    /** Documentation comment; the text is the merged run of comment lines. */
    COMMENT_STMT(STATEMENT, TEXT),
    STMT_LIST_EXPR(EXPRESSION),
    BLOCK_EXPR(EXPRESSION),
    STMT_LIST_TYPE(KindGroup.TYPE),
    BLOCK_TYPE(KindGroup.TYPE),

    // Type expressions
    WITH(KindGroup.TYPE),
    WITHOUT(KindGroup.TYPE),
    TYPE_OF_EXPR(KindGroup.TYPE),
    OBJECT_TY(KindGroup.TYPE),
    TUPLE_TY(KindGroup.TYPE),
    TUPLE_CLASS_TY(KindGroup.TYPE),
    TYPE_CLASS_TY(KindGroup.TYPE),
    STATIC_TY(KindGroup.TYPE),
    REC_LIST(KindGroup.TYPE),
    REC_CASE(KindGroup.TYPE),
    REC_WHEN(KindGroup.TYPE),
    REF_TY(KindGroup.TYPE),
    PTR_TY(KindGroup.TYPE),
    VAR_TY(KindGroup.TYPE),
    CONST_TY(KindGroup.TYPE),
    OUT_TY(KindGroup.TYPE),
    DISTINCT_TY(KindGroup.TYPE),
    PROC_TY(KindGroup.TYPE),
    ITERATOR_TY(KindGroup.TYPE),
    SINK_ASGN(SPECIAL),
    ENUM_TY(KindGroup.TYPE),
    ENUM_FIELD_DEF(KindGroup.TYPE),

    // Internal forms
    ARG_LIST(SPECIAL),
    PATTERN(SPECIAL),
    HIDDEN_TRY_STMT(SPECIAL),
    CLOSURE(SPECIAL),
    GOTO_STATE(SPECIAL),
    STATE(SPECIAL),
    BREAK_STATE(SPECIAL),
    FUNC_DEF(DECLARATION),
    TUPLE_CONSTR(EXPRESSION),
    ERROR(SPECIAL),
    OPEN_SYM(SPECIAL);

    private final KindGroup group;
    private final PayloadClass payloadClass;
    private final String displayName;

    NodeKind(KindGroup group) {
        this(group, PayloadClass.CHILDREN);
    }

    NodeKind(KindGroup group, String displayName) {
        this(group, PayloadClass.CHILDREN, displayName);
    }

    NodeKind(KindGroup group, PayloadClass payloadClass) {
        this(group, payloadClass, null);
    }

    NodeKind(KindGroup group, PayloadClass payloadClass, String displayName) {
        this.group = group;
        this.payloadClass = payloadClass;
        this.displayName = displayName != null ? displayName : camelCase(name());
    }

    public KindGroup group() {
        return group;
    }

    public PayloadClass payloadClass() {
        return payloadClass;
    }

    /**
     * Name used in textual dumps and in the JSON form, e.g. {@code IfStmt}.
     */
    public String displayName() {
        return displayName;
    }

    public boolean isCompound() {
        return payloadClass == PayloadClass.CHILDREN;
    }

    public boolean isLiteral() {
        return this.compareTo(CHAR_LIT) >= 0 && this.compareTo(NIL_LIT) <= 0;
    }

    public boolean isRoutineDefinition() {
        switch (this) {
            case PROC_DEF:
            case FUNC_DEF:
            case METHOD_DEF:
            case ITERATOR_DEF:
            case CONVERTER_DEF:
            case TEMPLATE_DEF:
            case MACRO_DEF:
            case LAMBDA:
            case DO:
                return true;
            default:
                return false;
        }
    }

    /**
     * Checks an integer payload against the width this kind implies.
     * Unsigned 64-bit kinds accept any bit pattern.
     */
    public boolean acceptsInteger(long value) {
        switch (this) {
            case CHAR_LIT:
            case UINT8_LIT:
                return value >= 0 && value <= 0xFFL;
            case UINT16_LIT:
                return value >= 0 && value <= 0xFFFFL;
            case UINT32_LIT:
                return value >= 0 && value <= 0xFFFF_FFFFL;
            case INT8_LIT:
                return value >= Byte.MIN_VALUE && value <= Byte.MAX_VALUE;
            case INT16_LIT:
                return value >= Short.MIN_VALUE && value <= Short.MAX_VALUE;
            case INT32_LIT:
                return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
            case INT_LIT:
            case INT64_LIT:
            case UINT_LIT:
            case UINT64_LIT:
                return true;
            default:
                return false;
        }
    }

    /**
     * Looks up a kind by its display name.
     *
     * @throws IllegalArgumentException if no kind has that name
     */
    public static NodeKind fromDisplayName(String displayName) {
        for (NodeKind kind : values()) {
            if (kind.displayName.equals(displayName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + displayName);
    }

    private static String camelCase(String constant) {
        StringBuilder sb = new StringBuilder(constant.length());
        boolean upper = true;
        for (char c : constant.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                sb.append(upper ? c : Character.toLowerCase(c));
                upper = false;
            }
        }
        return sb.toString();
    }
}
