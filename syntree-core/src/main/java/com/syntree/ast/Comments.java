package com.syntree.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds documentation comment nodes from comment lines.
 *
 * <p>Comment lines on consecutive source lines form one
 * {@link NodeKind#COMMENT_STMT} whose text is the lines joined with
 * {@code '\n'}. Any gap (a blank line or a line of code) starts a new node.</p>
 */
public final class Comments {

    private Comments() {
        // Utility class
    }

    /**
     * A comment as the lexer saw it: its 1-based line, its column and its
     * text without the comment marker.
     */
    public record CommentLine(int line, int column, String text) {
        public CommentLine(int line, String text) {
            this(line, 0, text);
        }
    }

    /**
     * @param lines comment lines in source order
     * @return one comment node per run of consecutive lines, with locations
     *     spanning the run
     */
    public static List<Node> merge(List<CommentLine> lines) {
        List<Node> result = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            CommentLine first = lines.get(i);
            StringBuilder text = new StringBuilder(first.text());
            CommentLine last = first;
            int j = i + 1;
            while (j < lines.size() && lines.get(j).line() == last.line() + 1) {
                last = lines.get(j);
                text.append('\n').append(last.text());
                j++;
            }
            Node comment = Nodes.comment(text.toString());
            comment.setLocation(SourceLocation.of(
                first.line(), first.column(), last.line(), last.column() + last.text().length()));
            result.add(comment);
            i = j;
        }
        return result;
    }
}
