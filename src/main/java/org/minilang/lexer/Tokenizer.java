package org.minilang.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The Tokenizer (also known as Lexer or Scanner) converts source text into tokens, one per call
 * to {@link #nextToken()}.
 * <p>
 * It is a forward-only, single-pass producer: characters consumed for a token are never
 * re-scanned. Instances are not thread-safe; each scan owns its own tokenizer.
 */
public class Tokenizer {

    private final SourceCursor cursor;
    private final String fileName;

    /**
     * Creates a new Tokenizer.
     * @param source The source code as a single string.
     */
    public Tokenizer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Tokenizer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param fileName The name of the scanned file, for error reporting.
     */
    public Tokenizer(String source, String fileName) {
        this.cursor = new SourceCursor(Objects.requireNonNull(source, "source"));
        this.fileName = fileName;
    }

    /**
     * Scans the next token.
     * @return The next token, or empty once only whitespace (or nothing) is left.
     * @throws NumericOverflowException if the next token is an integer literal outside the 32-bit range.
     *         The literal is consumed; a following call continues after it.
     */
    public Optional<Token> nextToken() throws NumericOverflowException {
        skipWhitespace();
        if (cursor.isAtEnd()) {
            return Optional.empty();
        }

        final SourcePosition start = cursor.position();
        final int mark = cursor.mark();
        final int c = cursor.advance();

        final TokenType symbol = switch (c) {
            case '*' -> TokenType.ASTERISK;
            case '{' -> TokenType.BRACE_LEFT;
            case '}' -> TokenType.BRACE_RIGHT;
            case '[' -> TokenType.BRACKET_LEFT;
            case ']' -> TokenType.BRACKET_RIGHT;
            case '.' -> TokenType.DOT;
            case '-' -> TokenType.MINUS;
            case '(' -> TokenType.PAREN_LEFT;
            case ')' -> TokenType.PAREN_RIGHT;
            case '+' -> TokenType.PLUS;
            case ';' -> TokenType.SEMICOLON;
            case '/' -> TokenType.SLASH;
            case ':' -> cursor.match('=') ? TokenType.ASSIGN : TokenType.COLON;
            case '=' -> cursor.match('=') ? TokenType.EQ : TokenType.EQUAL_SIGN;
            case '>' -> cursor.match('=') ? TokenType.GE : TokenType.GT;
            case '<' -> {
                if (cursor.match('=')) yield TokenType.LE;
                if (cursor.match('>')) yield TokenType.NE;
                yield TokenType.LT;
            }
            default -> null;
        };

        if (symbol != null) {
            return Optional.of(token(symbol, null, mark, start));
        }
        if (isDigit(c)) {
            return Optional.of(number(mark, start));
        }
        if (isAlpha(c)) {
            return Optional.of(identifier(mark, start));
        }
        return Optional.of(token(TokenType.INVALID, null, mark, start));
    }

    /**
     * Scans all remaining tokens.
     * @return The tokens in source order; there is no end-of-file token.
     * @throws NumericOverflowException on the first out-of-range integer literal.
     */
    public List<Token> scanTokens() throws NumericOverflowException {
        final List<Token> tokens = new ArrayList<>();
        Optional<Token> next = nextToken();
        while (next.isPresent()) {
            tokens.add(next.get());
            next = nextToken();
        }
        return tokens;
    }

    /**
     * @return The logical file name used in error reports.
     */
    public String getFileName() {
        return fileName;
    }

    private void skipWhitespace() {
        while (isWhitespace(cursor.peek())) {
            cursor.advance();
        }
    }

    private Token number(int mark, SourcePosition start) throws NumericOverflowException {
        while (isDigit(cursor.peek())) cursor.advance();
        final String text = cursor.textSince(mark);
        try {
            return token(TokenType.INTEGER, Integer.parseInt(text), mark, start);
        } catch (NumberFormatException e) {
            // Only digits were consumed, so the range is the only thing that can be wrong.
            throw new NumericOverflowException(text, fileName, start);
        }
    }

    private Token identifier(int mark, SourcePosition start) {
        while (isAlphaNumeric(cursor.peek())) cursor.advance();
        final String text = cursor.textSince(mark);
        return Keywords.lookup(text)
                .map(keyword -> token(keyword, null, mark, start))
                .orElseGet(() -> token(TokenType.NAME, text, mark, start));
    }

    private Token token(TokenType type, Object value, int mark, SourcePosition start) {
        return new Token(type, cursor.textSince(mark), value, start);
    }

    private static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n';
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAlphaNumeric(int c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }
}
