package org.minilang.lexer;

/**
 * Thrown when a run of digits does not fit into a 32-bit signed integer.
 * The digits have already been consumed, so the tokenizer can be asked for the next token.
 */
public class NumericOverflowException extends LexerException {

    private final String lexeme;

    /**
     * @param lexeme The digit run that was scanned.
     * @param fileName The logical file name of the scanned source.
     * @param position Where the digit run starts.
     */
    public NumericOverflowException(String lexeme, String fileName, SourcePosition position) {
        super("Integer literal out of range: " + lexeme, fileName, position);
        this.lexeme = lexeme;
    }

    public String getLexeme() {
        return lexeme;
    }
}
