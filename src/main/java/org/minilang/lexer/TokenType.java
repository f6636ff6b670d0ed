package org.minilang.lexer;

/**
 * Defines the different types of tokens that the {@link Tokenizer} can recognize.
 */
public enum TokenType {
    /** A character that matches no lexical rule. */
    INVALID,

    // Values.
    /** A boolean literal. Reserved: no spelling produces it yet. */
    BOOLEAN,
    /** A 32-bit signed integer literal. */
    INTEGER,
    /** An identifier that is not a keyword. */
    NAME,

    // Keywords.
    AND,
    ARRAY,
    IF,
    LET,
    NOT,
    OR,
    PRINT,
    WHILE,

    // Single-character symbols.
    /** The '*' character. */
    ASTERISK,
    /** The '{' character. */
    BRACE_LEFT,
    /** The '}' character. */
    BRACE_RIGHT,
    /** The '[' character. */
    BRACKET_LEFT,
    /** The ']' character. */
    BRACKET_RIGHT,
    /** The ':' character when not followed by '='. */
    COLON,
    /** The '.' character. */
    DOT,
    /** The '=' character when not followed by '='. */
    EQUAL_SIGN,
    /** The '-' character. */
    MINUS,
    /** The '(' character. */
    PAREN_LEFT,
    /** The ')' character. */
    PAREN_RIGHT,
    /** The '+' character. */
    PLUS,
    /** The ';' character. */
    SEMICOLON,
    /** The '/' character. */
    SLASH,
    /** The '>' character when not followed by '='. */
    GT,
    /** The '<' character when not followed by '=' or '>'. */
    LT,

    // Two-character operators.
    /** The ':=' operator. */
    ASSIGN,
    /** The '==' operator. */
    EQ,
    /** The '>=' operator. */
    GE,
    /** The '<=' operator. */
    LE,
    /** The '<>' operator. */
    NE;

    /**
     * @return {@code true} if tokens of this type carry a value.
     */
    public boolean hasValue() {
        return this == BOOLEAN || this == INTEGER || this == NAME;
    }

    /**
     * @return {@code true} if this type is one of the reserved words.
     */
    public boolean isKeyword() {
        return Keywords.all().containsValue(this);
    }
}
