package org.minilang.analysis;

import org.minilang.diagnostics.Diagnostic;
import org.minilang.lexer.Token;

import java.util.List;

/**
 * The outcome of scanning one source text.
 *
 * @param fileName The logical file name of the source.
 * @param tokens The tokens in source order, including {@code INVALID} ones.
 * @param diagnostics Everything reported while scanning.
 */
public record LexicalAnalysisResult(
        String fileName,
        List<Token> tokens,
        List<Diagnostic> diagnostics
) {
    public LexicalAnalysisResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }
}
