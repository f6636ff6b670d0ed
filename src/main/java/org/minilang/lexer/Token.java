package org.minilang.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Tokenizer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code (the lexeme).
 * @param value The value of the token: an {@link Integer} for {@link TokenType#INTEGER},
 *              a {@link String} for {@link TokenType#NAME}, a {@link Boolean} for
 *              {@link TokenType#BOOLEAN}, otherwise {@code null}.
 * @param position Where the first character of the token was found.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        SourcePosition position
) {

    /**
     * @return The line number where the token begins.
     */
    public int line() {
        return position.line();
    }

    /**
     * @return The column number where the token begins.
     */
    public int column() {
        return position.column();
    }

    @Override
    public String toString() {
        return value == null ? type.name() : type + "(" + value + ")";
    }
}
