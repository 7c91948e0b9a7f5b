package com.syntree.ast;

import com.syntree.ast.Comments.CommentLine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CommentsTest {

    @Test
    void testConsecutiveLinesMerge() {
        List<Node> merged = Comments.merge(List.of(
            new CommentLine(3, 2, "Computes the area."),
            new CommentLine(4, 2, "Both sides must be positive."),
            new CommentLine(7, 2, "Unrelated.")));

        assertEquals(2, merged.size());
        assertEquals(NodeKind.COMMENT_STMT, merged.get(0).kind());
        assertEquals("Computes the area.\nBoth sides must be positive.", merged.get(0).textValue());
        assertEquals("Unrelated.", merged.get(1).textValue());
    }

    @Test
    void testLocationSpansTheRun() {
        Node comment = Comments.merge(List.of(
            new CommentLine(10, 4, "one"),
            new CommentLine(11, 4, "three"))).get(0);

        assertEquals(SourceLocation.of(10, 4, 11, 9), comment.location());
    }

    @Test
    void testNoLines() {
        assertTrue(Comments.merge(List.of()).isEmpty());
    }

    @Test
    void testSingleLine() {
        Node comment = Comments.merge(List.of(new CommentLine(1, "hello"))).get(0);
        assertEquals("hello", comment.textValue());
        assertEquals(new SourceLocation.Position(1, 0), comment.location().start());
    }
}
