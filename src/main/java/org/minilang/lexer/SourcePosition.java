package org.minilang.lexer;

/**
 * A position in the source text.
 *
 * @param offset The number of code points preceding this position (0-based).
 * @param line The line number (1-based).
 * @param column The column number (1-based). Every code point, tabs included, counts as one column.
 */
public record SourcePosition(int offset, int line, int column) {

    /** The position of the first character of any input. */
    public static final SourcePosition START = new SourcePosition(0, 1, 1);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
