package com.syntree.ast;

import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.ArrayList;
import java.util.List;

import static com.syntree.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.DynamicTest.dynamicTest;

/**
 * Builds one node of each construct family and reads it back: kind, child
 * count and every child in order.
 */
public class ShapeFamiliesTest {

    private record Family(String name, Node node, NodeKind kind, List<Node> children) {}

    private static Family family(String name, Node node, NodeKind kind, Node... children) {
        return new Family(name, node, kind, List.of(children));
    }

    private static List<Family> families() {
        List<Family> all = new ArrayList<>();

        // Calls and operators
        all.add(family("command", command(ident("echo"), strLit("x")),
            NodeKind.COMMAND, ident("echo"), strLit("x")));
        all.add(family("callStrLit", callStrLit(ident("re"), rStrLit("\\d+")),
            NodeKind.CALL_STR_LIT, ident("re"), rStrLit("\\d+")));
        all.add(family("prefix", prefix("-", intLit(1)),
            NodeKind.PREFIX, ident("-"), intLit(1)));
        all.add(family("postfix", postfix("*", ident("x")),
            NodeKind.POSTFIX, ident("*"), ident("x")));
        all.add(family("exprEqExpr", exprEqExpr(ident("sep"), strLit(",")),
            NodeKind.EXPR_EQ_EXPR, ident("sep"), strLit(",")));
        all.add(family("asgn", asgn(ident("x"), intLit(2)),
            NodeKind.ASGN, ident("x"), intLit(2)));

        // Expressions
        all.add(family("dot", dot(ident("p"), "x"),
            NodeKind.DOT_EXPR, ident("p"), ident("x")));
        all.add(family("deref", deref(ident("p")), NodeKind.DEREF_EXPR, ident("p")));
        all.add(family("addr", addr(ident("x")), NodeKind.ADDR, ident("x")));
        all.add(family("cast", cast(ident("int"), ident("x")),
            NodeKind.CAST, ident("int"), ident("x")));
        all.add(family("conv", conv(ident("float"), intLit(1)),
            NodeKind.CONV, ident("float"), intLit(1)));
        all.add(family("par", par(intLit(1)), NodeKind.PAR, intLit(1)));
        all.add(family("tupleConstr", tupleConstr(intLit(1), strLit("a")),
            NodeKind.TUPLE_CONSTR, intLit(1), strLit("a")));
        all.add(family("bracket", bracket(intLit(1), intLit(2)),
            NodeKind.BRACKET, intLit(1), intLit(2)));
        all.add(family("curly", curly(strLit("a")), NodeKind.CURLY, strLit("a")));
        all.add(family("objConstr", objConstr(ident("Point"), colon(ident("x"), intLit(1))),
            NodeKind.OBJ_CONSTR, ident("Point"), colon(ident("x"), intLit(1))));
        all.add(family("bracketExpr without index", bracketExpr(ident("p")),
            NodeKind.BRACKET_EXPR, ident("p")));
        all.add(family("ifExpr", ifExpr(elifExpr(ident("c"), intLit(1)), elseExpr(intLit(2))),
            NodeKind.IF_EXPR, elifExpr(ident("c"), intLit(1)), elseExpr(intLit(2))));
        all.add(family("stmtListExpr", stmtListExpr(call("f"), intLit(1)),
            NodeKind.STMT_LIST_EXPR, call("f"), intLit(1)));
        all.add(family("lambda", lambda(formalParams(empty()), stmtList()),
            NodeKind.LAMBDA, empty(), empty(), empty(), formalParams(empty()), empty(), empty(), stmtList()));

        // Statements
        all.add(family("whenStmt",
            whenStmt(elifBranch(call("defined", ident("windows")), stmtList()), elseBranch(stmtList())),
            NodeKind.WHEN_STMT, elifBranch(call("defined", ident("windows")), stmtList()), elseBranch(stmtList())));
        all.add(family("whileStmt", whileStmt(ident("c"), stmtList()),
            NodeKind.WHILE_STMT, ident("c"), stmtList()));
        all.add(family("forStmt", forStmt(ident("i"), rangeInfix(intLit(0), intLit(3)), stmtList()),
            NodeKind.FOR_STMT, ident("i"), rangeInfix(intLit(0), intLit(3)), stmtList()));
        all.add(family("catch-all except", exceptBranch(stmtList()),
            NodeKind.EXCEPT_BRANCH, stmtList()));
        all.add(family("deferStmt", deferStmt(call("close")), NodeKind.DEFER, call("close")));
        all.add(family("yieldStmt", yieldStmt(intLit(1)), NodeKind.YIELD_STMT, intLit(1)));
        all.add(family("raiseStmt", raiseStmt(), NodeKind.RAISE_STMT, empty()));
        all.add(family("raise with value", raiseStmt(call("newException")),
            NodeKind.RAISE_STMT, call("newException")));
        all.add(family("discardStmt", discardStmt(intLit(1)), NodeKind.DISCARD_STMT, intLit(1)));
        all.add(family("breakStmt", breakStmt(ident("outer")), NodeKind.BREAK_STMT, ident("outer")));
        all.add(family("continueStmt", continueStmt(ident("outer")),
            NodeKind.CONTINUE_STMT, ident("outer")));
        all.add(family("continue without label", continueStmt(), NodeKind.CONTINUE_STMT, empty()));
        all.add(family("labeled block", blockStmt(ident("outer"), stmtList()),
            NodeKind.BLOCK_STMT, ident("outer"), stmtList()));
        all.add(family("block", blockStmt(stmtList()), NodeKind.BLOCK_STMT, empty(), stmtList()));
        all.add(family("pragmaBlock", pragmaBlock(pragma(ident("push")), stmtList()),
            NodeKind.PRAGMA_BLOCK, pragma(ident("push")), stmtList()));

        // Imports
        all.add(family("importStmt", importStmt(ident("os"), ident("strutils")),
            NodeKind.IMPORT_STMT, ident("os"), ident("strutils")));
        all.add(family("importExcept", importExcept(ident("os"), ident("getEnv")),
            NodeKind.IMPORT_EXCEPT_STMT, ident("os"), ident("getEnv")));
        all.add(family("fromStmt", fromStmt(ident("os"), ident("getEnv"), ident("putEnv")),
            NodeKind.FROM_STMT, ident("os"), ident("getEnv"), ident("putEnv")));
        all.add(family("exportStmt", exportStmt(ident("os")), NodeKind.EXPORT_STMT, ident("os")));
        all.add(family("exportExcept", exportExcept(ident("os"), ident("getEnv")),
            NodeKind.EXPORT_EXCEPT_STMT, ident("os"), ident("getEnv")));
        all.add(family("includeStmt", includeStmt(strLit("inc")), NodeKind.INCLUDE_STMT, strLit("inc")));

        // Declarations
        all.add(family("letSection", letSection(identDefs(ident("x"), empty(), intLit(1))),
            NodeKind.LET_SECTION, identDefs(ident("x"), empty(), intLit(1))));
        all.add(family("varSection", varSection(identDefs(ident("x"), ident("int"), empty())),
            NodeKind.VAR_SECTION, identDefs(ident("x"), ident("int"), empty())));
        all.add(family("constSection", constSection(constDef(ident("n"), empty(), intLit(3))),
            NodeKind.CONST_SECTION, constDef(ident("n"), empty(), intLit(3))));
        all.add(family("typeSection",
            typeSection(typeDef(ident("Id"), empty(), distinctTy(ident("int")))),
            NodeKind.TYPE_SECTION, typeDef(ident("Id"), empty(), distinctTy(ident("int")))));
        all.add(family("generic typeDef",
            typeDef(exported(ident("Box")), genericParams(identDefs(ident("T"), empty(), empty())), refTy(ident("T"))),
            NodeKind.TYPE_DEF, exported(ident("Box")),
            genericParams(identDefs(ident("T"), empty(), empty())), refTy(ident("T"))));
        all.add(family("genericParams",
            genericParams(identDefs(ident("T"), ident("SomeNumber"), empty()), identDefs(ident("U"), empty(), empty())),
            NodeKind.GENERIC_PARAMS,
            identDefs(ident("T"), ident("SomeNumber"), empty()), identDefs(ident("U"), empty(), empty())));
        all.add(family("formalParams", formalParams(ident("int"), identDefs(ident("a"), ident("int"), empty())),
            NodeKind.FORMAL_PARAMS, ident("int"), identDefs(ident("a"), ident("int"), empty())));
        all.add(family("pragmaExpr", pragmaExpr(ident("x"), pragma(ident("used"))),
            NodeKind.PRAGMA_EXPR, ident("x"), pragma(ident("used"))));
        all.add(family("iterator", routine(NodeKind.ITERATOR_DEF, ident("items"), empty(),
                formalParams(empty()), pragma(ident("inline")), stmtList()),
            NodeKind.ITERATOR_DEF, ident("items"), empty(), empty(), formalParams(empty()),
            pragma(ident("inline")), empty(), stmtList()));

        // Type expressions
        all.add(family("objectTy", objectTy(empty(), ofInherit(ident("RootObj")), recList()),
            NodeKind.OBJECT_TY, empty(), ofInherit(ident("RootObj")), recList()));
        all.add(family("refTy", refTy(ident("Node")), NodeKind.REF_TY, ident("Node")));
        all.add(family("bare ref", Node.of(NodeKind.REF_TY), NodeKind.REF_TY));
        all.add(family("ptrTy", ptrTy(ident("int")), NodeKind.PTR_TY, ident("int")));
        all.add(family("varTy", varTy(ident("int")), NodeKind.VAR_TY, ident("int")));
        all.add(family("distinctTy", distinctTy(ident("float")), NodeKind.DISTINCT_TY, ident("float")));
        all.add(family("procTy", procTy(formalParams(ident("int")), pragma(ident("closure"))),
            NodeKind.PROC_TY, formalParams(ident("int")), pragma(ident("closure"))));
        all.add(family("tupleTy", tupleTy(identDefs(ident("a"), ident("int"), empty())),
            NodeKind.TUPLE_TY, identDefs(ident("a"), ident("int"), empty())));
        all.add(family("recWhen", recWhen(elifBranch(ident("c"), recList())),
            NodeKind.REC_WHEN, elifBranch(ident("c"), recList())));

        return all;
    }

    @TestFactory
    List<DynamicTest> testEveryFamilyReadsBack() {
        List<DynamicTest> tests = new ArrayList<>();
        for (Family family : families()) {
            tests.add(dynamicTest(family.name(), () -> {
                Node node = family.node();
                assertEquals(family.kind(), node.kind());
                assertEquals(family.children().size(), node.size());
                for (int i = 0; i < node.size(); i++) {
                    assertEquals(family.children().get(i), node.get(i), family.name() + " child " + i);
                    if (!node.get(i).isAbsent()) {
                        assertSame(node, node.get(i).parent());
                    }
                }
                ShapeTable.checkTree(node);
            }));
        }
        return tests;
    }

    @Test
    void testScalarFamilies() {
        assertEquals(NodeKind.UINT_LIT, uintLit(7).kind());
        assertEquals(7, uintLit(7).intValue());
        assertEquals(NodeKind.FLOAT32_LIT, float32Lit(1.5f).kind());
        assertEquals(1.5, float32Lit(1.5f).floatValue());
        assertEquals(NodeKind.TRIPLE_STR_LIT, tripleStrLit("a\nb").kind());
        assertEquals("a\nb", tripleStrLit("a\nb").textValue());
        assertEquals(NodeKind.NIL_LIT, nilLit().kind());
        assertEquals(0, scalar(NodeKind.INT16_LIT, 0).intValue());
        assertEquals(-2.5, scalar(NodeKind.FLOAT128_LIT, -2.5).floatValue());
    }
}
