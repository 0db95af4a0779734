package org.zepto8.peg.text;

/**
 * A position in source text: 1-based line and column, plus the 0-based character offset.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * 0-based offset of this location inside its line.
     */
    public int columnInLine() {
        return column - 1;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
