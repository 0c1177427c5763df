package com.templateweaver.core.node;

/**
 * A 1-based position in the source document.
 *
 * @param line line number, starting at 1
 * @param column column number, starting at 1
 */
public record SourceLocation(int line, int column) {

    /**
     * Compact constructor with validation.
     */
    public SourceLocation {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column are 1-based, got " + line + ":" + column);
        }
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
