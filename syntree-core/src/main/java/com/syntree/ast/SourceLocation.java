package com.syntree.ast;

/**
 * Source span of a node. Carried through every rewrite untouched.
 */
public record SourceLocation(Position start, Position end) {

    public static final SourceLocation UNKNOWN = new SourceLocation(Position.UNKNOWN, Position.UNKNOWN);

    public static SourceLocation of(int startLine, int startCol, int endLine, int endCol) {
        return new SourceLocation(new Position(startLine, startCol), new Position(endLine, endCol));
    }

    public boolean isKnown() {
        return start.line() > 0;
    }

    public record Position(int line, int column) {
        public static final Position UNKNOWN = new Position(0, 0);
    }
}
