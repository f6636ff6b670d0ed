package org.minilang.lexer;

/**
 * A forward-only view over source text with one code point of lookahead.
 * Keeps the offset, line and column of the next unread code point.
 */
final class SourceCursor {

    /** Returned by {@link #peek()} when no input is left. */
    static final int EOF = -1;

    private final String source;
    private int index = 0;
    private int offset = 0;
    private int line = 1;
    private int column = 1;

    SourceCursor(String source) {
        this.source = source;
    }

    boolean isAtEnd() {
        return index >= source.length();
    }

    /**
     * Returns the next code point without consuming it.
     * @return The next code point, or {@link #EOF}.
     */
    int peek() {
        if (isAtEnd()) return EOF;
        return source.codePointAt(index);
    }

    /**
     * Consumes the next code point. A newline moves the cursor to column 1 of the following line.
     * @return The consumed code point.
     * @throws IllegalStateException if the input is exhausted.
     */
    int advance() {
        if (isAtEnd()) {
            throw new IllegalStateException("advance() past end of input at " + position());
        }
        int c = source.codePointAt(index);
        index += Character.charCount(c);
        offset++;
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    /**
     * Consumes the next code point only if it equals {@code expected}.
     * @param expected The code point to match.
     * @return {@code true} if it was consumed.
     */
    boolean match(int expected) {
        if (peek() != expected) return false;
        advance();
        return true;
    }

    SourcePosition position() {
        return new SourcePosition(offset, line, column);
    }

    /** The char index into the source of the next unread code point. */
    int mark() {
        return index;
    }

    /** The source text between a previous {@link #mark()} and the current position. */
    String textSince(int mark) {
        return source.substring(mark, index);
    }
}
