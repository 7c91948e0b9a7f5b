package com.syntree.ast;

import com.syntree.IndexOutOfRangeException;
import com.syntree.MalformedNodeException;
import com.syntree.WrongPayloadKindException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.syntree.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

public class NodesTest {

    @Test
    @DisplayName("Nested infix exposes operator, operands and inner infix in order")
    void testNestedInfix() {
        Node sum = infix("+", intLit(5), infix("*", intLit(3), intLit(4)));

        assertEquals(NodeKind.INFIX, sum.kind());
        assertEquals(3, sum.size());
        assertEquals(NodeKind.IDENT, sum.get(0).kind());
        assertEquals("+", sum.get(0).textValue());
        assertEquals(NodeKind.INT_LIT, sum.get(1).kind());
        assertEquals(5, sum.get(1).intValue());

        Node product = sum.get(2);
        assertEquals(NodeKind.INFIX, product.kind());
        assertEquals("*", product.get(0).textValue());
        assertEquals(3, product.get(1).intValue());
        assertEquals(4, product.get(2).intValue());
        assertSame(sum, product.parent());
    }

    @Test
    @DisplayName("If without else has only its condition branches")
    void testIfWithoutElse() {
        Node stmt = ifStmt(
            elifBranch(ident("a"), stmtList(call("f"))),
            elifBranch(ident("b"), stmtList(call("g"))));

        assertEquals(2, stmt.size());
        for (Node branch : stmt) {
            assertFalse(branch.isAbsent());
            assertEquals(NodeKind.ELIF_BRANCH, branch.kind());
        }
    }

    @Test
    void testIfThenElseEndsWithElse() {
        Node stmt = ifThenElse(ident("c"), stmtList(call("f")), stmtList(call("g")));

        assertEquals(2, stmt.size());
        assertEquals(NodeKind.ELSE, stmt.last().kind());
        assertEquals(1, stmt.last().size());
    }

    @Test
    @DisplayName("Constant without a value is rejected, variable without a value is not")
    void testBindingValues() {
        assertThrows(MalformedNodeException.class,
            () -> constDef(ident("x"), ident("int"), empty()));

        Node variable = identDefs(ident("x"), ident("int"), empty());
        assertEquals(3, variable.size());
        assertTrue(variable.get(2).isAbsent());
        assertEquals("int", variable.get(1).textValue());
    }

    @Test
    void testTextValueOnIntegerLiteral() {
        assertThrows(WrongPayloadKindException.class, () -> intLit(7).textValue());
    }

    @Test
    void testIndexBeyondChildCount() {
        Node call = call("f", ident("a"), ident("b"));
        assertEquals(3, call.size());

        IndexOutOfRangeException e = assertThrows(IndexOutOfRangeException.class, () -> call.get(5));
        assertEquals(5, e.getIndex());
        assertEquals(3, e.getSize());
    }

    @Test
    void testIntegerWidths() {
        assertEquals(255, scalar(NodeKind.UINT8_LIT, 255).intValue());
        assertThrows(MalformedNodeException.class, () -> scalar(NodeKind.UINT8_LIT, 256));
        assertThrows(MalformedNodeException.class, () -> scalar(NodeKind.INT8_LIT, -129));
        assertThrows(MalformedNodeException.class, () -> scalar(NodeKind.UINT16_LIT, -1));
        assertEquals(Integer.MIN_VALUE, scalar(NodeKind.INT32_LIT, Integer.MIN_VALUE).intValue());
        assertEquals('q', charLit('q').intValue());
    }

    @Test
    void testFloat32IsRounded() {
        Node lit = scalar(NodeKind.FLOAT32_LIT, 0.1);
        assertEquals((double) 0.1f, lit.floatValue());
        assertEquals(0.1, floatLit(0.1).floatValue());
    }

    @Test
    void testPayloadClassMismatch() {
        assertThrows(MalformedNodeException.class, () -> scalar(NodeKind.STR_LIT, 1));
        assertThrows(MalformedNodeException.class, () -> text(NodeKind.INT_LIT, "1"));
        assertThrows(MalformedNodeException.class, () -> text(NodeKind.SYM, "x"));
        assertThrows(MalformedNodeException.class, () -> text(NodeKind.STR_LIT, null));
        assertThrows(MalformedNodeException.class, () -> compound(NodeKind.IDENT));
        assertThrows(MalformedNodeException.class, () -> Node.of(NodeKind.INT_LIT));
    }

    @Test
    void testNullChildIsMalformed() {
        assertThrows(MalformedNodeException.class, () -> call(ident("f"), (Node) null));
    }

    @Test
    @DisplayName("A rejected compound leaves its children free to reuse")
    void testFailedConstructionReleasesChildren() {
        Node name = ident("x");
        Node type = ident("int");
        assertThrows(MalformedNodeException.class, () -> constDef(name, type, empty()));

        assertNull(name.parent());
        assertNull(type.parent());
        Node def = constDef(name, type, intLit(1));
        assertSame(def, name.parent());
    }

    @Test
    void testCaseBranchesKeepSourceOrder() {
        Node stmt = caseStmt(ident("x"),
            ofBranch(List.of(intLit(1), intLit(2)), stmtList(call("a"))),
            ofBranch(caseRange(intLit(3), intLit(9)), stmtList(call("b"))),
            elseBranch(stmtList(call("c"))));

        assertEquals(4, stmt.size());
        assertEquals(NodeKind.OF_BRANCH, stmt.get(1).kind());
        assertEquals(3, stmt.get(1).size());
        assertEquals(NodeKind.RANGE, stmt.get(2).get(0).kind());
        assertEquals(NodeKind.ELSE, stmt.get(3).kind());
    }

    @Test
    void testRangesOutsideCaseAreInfix() {
        Node slice = bracketExpr(ident("s"), rangeInfix(intLit(0), intLit(3)));
        Node range = slice.get(1);

        assertEquals(NodeKind.INFIX, range.kind());
        assertEquals("..", range.get(0).textValue());
    }

    @Test
    void testImportAs() {
        Node stmt = importAs(ident("strutils"), ident("su"));

        assertEquals(NodeKind.IMPORT_STMT, stmt.kind());
        assertEquals(NodeKind.INFIX, stmt.get(0).kind());
        assertEquals("as", stmt.get(0).get(0).textValue());
    }

    @Test
    void testTryFinallyMustComeLast() {
        Node ok = tryStmt(stmtList(call("f")),
            exceptBranch(stmtList(call("log")), ident("IOError")),
            finallyBranch(stmtList(call("close"))));
        assertEquals(3, ok.size());
        assertEquals(2, ok.get(1).size());

        assertThrows(MalformedNodeException.class, () -> tryStmt(stmtList(call("f")),
            finallyBranch(stmtList(call("close"))),
            exceptBranch(stmtList(call("log")))));
    }

    @Test
    void testForLoopWithSeveralVariables() {
        Node loop = forStmt(List.of(ident("k"), ident("v")), call("pairs", ident("t")), stmtList(discardStmt()));

        assertEquals(4, loop.size());
        assertEquals("v", loop.get(1).textValue());
        assertEquals(NodeKind.CALL, loop.get(2).kind());
    }

    @Test
    void testEnumTypeHasPragmaSlot() {
        Node colors = enumTy(ident("red"), enumField(ident("green"), intLit(3)));

        assertTrue(colors.get(0).isAbsent());
        assertEquals(3, colors.size());
        assertThrows(MalformedNodeException.class, () -> enumTy());
    }

    @Test
    void testVarTupleLeavesTypeAbsent() {
        Node tuple = varTuple(List.of(ident("a"), ident("b")), call("pair"));

        assertEquals(4, tuple.size());
        assertTrue(tuple.get(2).isAbsent());
        assertEquals(NodeKind.CALL, tuple.last().kind());
    }

    @Test
    void testAccQuoted() {
        Node quoted = accQuoted("+", "=");
        assertEquals(2, quoted.size());
        assertEquals("+=", Identifiers.basename(quoted));
    }

    @Test
    void testTableConstrOnlyTakesPairs() {
        Node table = tableConstr(colon(strLit("a"), intLit(1)));
        assertEquals(1, table.size());
        assertThrows(MalformedNodeException.class, () -> tableConstr(strLit("a")));
    }

    @Test
    void testToString() {
        Node call = call("echo", strLit("hi"), intLit(3));
        assertEquals("Call(Ident \"echo\", StrLit \"hi\", IntLit 3)", call.toString());
    }
}
