package org.minilang.diagnostics;

/**
 * One problem found in a source text, pinned to the line and column where it starts.
 *
 * @param type How severe the problem is.
 * @param message Human-readable description, without location.
 * @param fileName Logical name of the scanned source.
 * @param lineNumber 1-based line.
 * @param columnNumber 1-based column.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * Severity of a diagnostic.
     */
    public enum Type {
        /** The token stream should not be handed to a parser. */
        ERROR,
        /** Suspicious input that still yields a usable token stream. */
        WARNING
    }

    /**
     * Formats as {@code [TYPE] file:line:column: message}, the shape printed by the tokenize command.
     */
    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, columnNumber, message);
    }
}
