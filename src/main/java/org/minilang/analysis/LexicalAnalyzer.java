package org.minilang.analysis;

import org.minilang.diagnostics.DiagnosticsEngine;
import org.minilang.lexer.NumericOverflowException;
import org.minilang.lexer.SourcePosition;
import org.minilang.lexer.Token;
import org.minilang.lexer.TokenType;
import org.minilang.lexer.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs a {@link Tokenizer} over a whole source text and turns bad input into diagnostics
 * instead of stopping at the first problem.
 * <p>
 * Invalid characters stay in the token stream and are reported as well. An out-of-range integer
 * literal produces no token; scanning resumes right after its digits.
 */
public class LexicalAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(LexicalAnalyzer.class);

    private final LexerOptions options;

    public LexicalAnalyzer() {
        this(LexerOptions.DEFAULTS);
    }

    public LexicalAnalyzer(LexerOptions options) {
        this.options = options;
    }

    /**
     * Scans the given source text completely.
     * @param source The source code.
     * @param fileName The logical file name, used in diagnostics.
     * @return The tokens and diagnostics.
     */
    public LexicalAnalysisResult analyze(String source, String fileName) {
        final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        final Tokenizer tokenizer = new Tokenizer(source, fileName);
        final List<Token> tokens = new ArrayList<>();

        while (true) {
            final Optional<Token> next;
            try {
                next = tokenizer.nextToken();
            } catch (NumericOverflowException e) {
                final SourcePosition pos = e.getPosition();
                diagnostics.reportError(e.getReason(), fileName, pos.line(), pos.column());
                continue;
            }
            if (next.isEmpty()) {
                break;
            }
            final Token token = next.get();
            if (token.type() == TokenType.INVALID) {
                reportInvalid(token, fileName, diagnostics);
            }
            tokens.add(token);
        }

        if (diagnostics.hasErrors()) {
            LOG.debug("Scanned {} tokens from {} with errors:\n{}", tokens.size(), fileName, diagnostics.summary());
        } else {
            LOG.debug("Scanned {} tokens from {}", tokens.size(), fileName);
        }
        return new LexicalAnalysisResult(fileName, tokens, diagnostics.getDiagnostics());
    }

    private void reportInvalid(Token token, String fileName, DiagnosticsEngine diagnostics) {
        final String message = String.format("Unexpected character '%s' (U+%04X)",
                printable(token.text()), token.text().codePointAt(0));
        if (options.failOnInvalid()) {
            diagnostics.reportError(message, fileName, token.line(), token.column());
        } else {
            diagnostics.reportWarning(message, fileName, token.line(), token.column());
        }
    }

    private static String printable(String text) {
        final int c = text.codePointAt(0);
        return Character.isISOControl(c) ? "?" : text;
    }
}
