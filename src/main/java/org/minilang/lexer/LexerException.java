package org.minilang.lexer;

/**
 * Base class of the failures the {@link Tokenizer} reports as exceptions rather than as tokens.
 */
public class LexerException extends Exception {

    private final String reason;
    private final String fileName;
    private final SourcePosition position;

    /**
     * Constructs a new lexer exception.
     * @param reason What went wrong, without location information.
     * @param fileName The logical file name of the scanned source.
     * @param position Where the offending lexeme starts.
     */
    public LexerException(String reason, String fileName, SourcePosition position) {
        super(String.format("%s at %s:%s", reason, fileName, position));
        this.reason = reason;
        this.fileName = fileName;
        this.position = position;
    }

    public String getReason() {
        return reason;
    }

    public String getFileName() {
        return fileName;
    }

    public SourcePosition getPosition() {
        return position;
    }
}
