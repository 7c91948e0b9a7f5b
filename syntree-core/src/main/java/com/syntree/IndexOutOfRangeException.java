package com.syntree;

/**
 * Thrown when a child index falls outside {@code [0, size)}.
 */
public class IndexOutOfRangeException extends AstException {

    private final int index;
    private final int size;

    public IndexOutOfRangeException(int index, int size) {
        super("Child index " + index + " out of range for node with " + size + " children");
        this.index = index;
        this.size = size;
    }

    public int getIndex() {
        return index;
    }

    public int getSize() {
        return size;
    }
}
