package com.syntree.ast;

import com.syntree.IndexOutOfRangeException;
import com.syntree.InvalidAccessException;
import com.syntree.MalformedNodeException;
import com.syntree.WrongPayloadKindException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.syntree.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

public class NodeTest {

    @Test
    void testAbsenceNodesAreEqual() {
        Node a = Node.of(NodeKind.EMPTY);
        Node b = empty();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertTrue(a.isAbsent());
        assertNotEquals(b, nilLit());
        assertNotEquals(b, stmtList());
        assertNotEquals(b, ident(""));
    }

    @Test
    void testSharedAbsenceNodeIsFrozen() {
        assertThrows(InvalidAccessException.class,
            () -> empty().setLocation(SourceLocation.of(1, 0, 1, 1)));
        assertSame(empty(), empty().copy());
    }

    @Test
    void testAbsenceNodeMayFillSeveralSlots() {
        Node ret = returnStmt();
        Node brk = breakStmt();

        assertSame(empty(), ret.get(0));
        assertSame(empty(), brk.get(0));
        assertNull(empty().parent());
    }

    @Test
    void testStructuralEqualityIgnoresLocation() {
        Node a = call("f", intLit(1));
        Node b = call("f", intLit(1));
        b.setLocation(SourceLocation.of(3, 2, 3, 6));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, call("f", intLit(2)));
        assertNotEquals(a, command(ident("f"), intLit(1)));
    }

    @Test
    void testScalarAccessorsOnWrongKinds() {
        assertThrows(WrongPayloadKindException.class, () -> strLit("x").intValue());
        assertThrows(WrongPayloadKindException.class, () -> intLit(1).floatValue());
        assertThrows(WrongPayloadKindException.class, () -> stmtList().textValue());
        assertThrows(InvalidAccessException.class, () -> intLit(1).get(0));
        assertThrows(InvalidAccessException.class, () -> ident("x").add(intLit(1)));
        assertThrows(InvalidAccessException.class, () -> ident("x").symbol());
    }

    @Test
    void testNegativeIndex() {
        assertThrows(IndexOutOfRangeException.class, () -> stmtList(call("f")).get(-1));
        assertThrows(IndexOutOfRangeException.class, () -> stmtList().last());
        assertThrows(IndexOutOfRangeException.class, () -> stmtList().insert(1, call("f")));
    }

    @Test
    void testChildrenViewIsReadOnly() {
        Node list = stmtList(call("f"));
        assertThrows(UnsupportedOperationException.class, () -> list.children().add(call("g")));
    }

    @Test
    void testInsertSetRemove() {
        Node list = stmtList(call("a"), call("c"));
        Node b = call("b");
        list.insert(1, b);
        assertEquals(List.of(call("a"), call("b"), call("c")), list.children());
        assertSame(list, b.parent());

        Node replaced = list.set(2, call("d"));
        assertEquals(call("c"), replaced);
        assertNull(replaced.parent());

        Node removed = list.remove(0);
        assertNull(removed.parent());
        assertEquals(2, list.size());
        assertEquals(call("b"), list.get(0));
    }

    @Test
    @DisplayName("A node with a parent cannot be added a second time")
    void testOwnedChildRejected() {
        Node x = ident("x");
        Node first = stmtList(x);

        assertThrows(MalformedNodeException.class, () -> stmtList(x));
        assertThrows(MalformedNodeException.class, () -> first.add(x));
        assertEquals(1, first.size());
    }

    @Test
    void testCycleRejected() {
        Node inner = stmtList();
        Node outer = stmtList(blockStmt(inner));

        assertThrows(MalformedNodeException.class, () -> inner.add(outer));
        assertThrows(MalformedNodeException.class, () -> inner.add(inner));
    }

    @Test
    @DisplayName("Moving a subtree makes it reachable from the target tree only")
    void testMoveSubtree() {
        Node moved = call("work", ident("x"));
        Node treeA = stmtList(call("setup"), moved);
        Node treeB = stmtList(call("teardown"));

        treeB.add(moved.detach());

        assertEquals(0, countIdentical(treeA, moved));
        assertEquals(1, countIdentical(treeB, moved));
        assertSame(treeB, moved.parent());
        assertEquals(1, treeA.size());
    }

    @Test
    void testDetachRoot() {
        Node root = stmtList();
        assertSame(root, root.detach());
        assertNull(root.parent());
    }

    @Test
    void testCopyIsDeepAndDetached() {
        Node original = stmtList(call("f", ident("x")));
        original.get(0).setLocation(SourceLocation.of(1, 0, 1, 4));
        Node copy = original.get(0).copy();

        assertEquals(original.get(0), copy);
        assertNotSame(original.get(0), copy);
        assertNotSame(original.get(0).get(1), copy.get(1));
        assertNull(copy.parent());
        assertSame(copy, copy.get(0).parent());
        assertEquals(original.get(0).location(), copy.location());

        copy.get(1).resolve(new DeclaredSymbol(1, "x", "main"));
        assertEquals(NodeKind.IDENT, original.get(0).get(1).kind());
    }

    @Test
    void testWalkIsPreOrder() {
        Node tree = stmtList(call("f", intLit(1)), ident("y"));
        List<String> seen = new ArrayList<>();
        tree.walk(n -> seen.add(n.kind().displayName()));

        assertEquals(List.of("StmtList", "Call", "Ident", "IntLit", "Ident"), seen);
    }

    @Test
    void testAddIsFluent() {
        Node list = Node.of(NodeKind.STMT_LIST)
            .add(call("a"))
            .addAll(call("b"), call("c"))
            .check();
        assertEquals(3, list.size());
    }

    @Test
    void testCheckReportsViolation() {
        Node call = Node.of(NodeKind.CALL);
        MalformedNodeException e = assertThrows(MalformedNodeException.class, call::check);
        assertTrue(e.getMessage().contains("Call"));
    }

    @Test
    void testUnknownLocationByDefault() {
        Node node = ident("x");
        assertEquals(SourceLocation.UNKNOWN, node.location());
        assertFalse(node.location().isKnown());
        assertTrue(node.setLocation(SourceLocation.of(2, 4, 2, 5)).location().isKnown());
    }

    private static int countIdentical(Node root, Node target) {
        int[] count = {0};
        root.walk(n -> {
            if (n == target) {
                count[0]++;
            }
        });
        return count[0];
    }
}
