package org.minilang.lexer;

import java.util.Map;
import java.util.Optional;

/**
 * The reserved words of the language. Matching is exact-case: {@code If} is a name, not a keyword.
 */
public final class Keywords {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", TokenType.AND,
            "array", TokenType.ARRAY,
            "if", TokenType.IF,
            "let", TokenType.LET,
            "not", TokenType.NOT,
            "or", TokenType.OR,
            "print", TokenType.PRINT,
            "while", TokenType.WHILE
    );

    private Keywords() {}

    /**
     * Looks up the keyword with exactly the given spelling.
     * @param text The identifier text.
     * @return The keyword's token type, or empty if the text is not reserved.
     */
    public static Optional<TokenType> lookup(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }

    /**
     * @return An unmodifiable view of all reserved spellings and their token types.
     */
    public static Map<String, TokenType> all() {
        return KEYWORDS;
    }
}
