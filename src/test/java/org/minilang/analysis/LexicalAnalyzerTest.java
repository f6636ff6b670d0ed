package org.minilang.analysis;

import com.typesafe.config.ConfigFactory;
import org.minilang.diagnostics.Diagnostic;
import org.minilang.junit.extensions.logging.LogWatchExtension;
import org.minilang.lexer.Token;
import org.minilang.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LexicalAnalyzerTest {

    @Test
    void cleanSourceHasNoDiagnostics() {
        LexicalAnalysisResult result = new LexicalAnalyzer().analyze("print 1 + 2;", "clean.ml");

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.fileName()).isEqualTo("clean.ml");
        assertThat(result.tokens()).extracting(Token::type).containsExactly(
                TokenType.PRINT, TokenType.INTEGER, TokenType.PLUS, TokenType.INTEGER, TokenType.SEMICOLON);
    }

    @Test
    void invalidCharacterIsKeptAndReportedAsError() {
        LexicalAnalysisResult result = new LexicalAnalyzer().analyze("let x\n  := 1 # 2;", "bad.ml");

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.tokens()).extracting(Token::type).contains(TokenType.INVALID);
        assertThat(result.diagnostics())
                .extracting(Diagnostic::type, Diagnostic::message, Diagnostic::lineNumber, Diagnostic::columnNumber)
                .containsExactly(tuple(Diagnostic.Type.ERROR, "Unexpected character '#' (U+0023)", 2, 8));
    }

    @Test
    void controlCharacterIsNotPrintedVerbatim() {
        LexicalAnalysisResult result = new LexicalAnalyzer().analyze("a\rb", "cr.ml");

        assertThat(result.diagnostics())
                .extracting(Diagnostic::message)
                .containsExactly("Unexpected character '?' (U+000D)");
    }

    @Test
    void invalidCharacterIsOnlyAWarningWhenConfigured() {
        LexicalAnalysisResult result = new LexicalAnalyzer(new LexerOptions(false)).analyze("a @ b", "lenient.ml");

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.diagnostics())
                .extracting(Diagnostic::type)
                .containsExactly(Diagnostic.Type.WARNING);
    }

    @Test
    void overflowIsReportedAndScanningResumesAfterLiteral() {
        LexicalAnalysisResult result = new LexicalAnalyzer().analyze("a := 4294967296 + 1", "big.ml");

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.tokens())
                .extracting(Token::type, Token::value)
                .containsExactly(
                        tuple(TokenType.NAME, "a"),
                        tuple(TokenType.ASSIGN, null),
                        tuple(TokenType.PLUS, null),
                        tuple(TokenType.INTEGER, 1));
        assertThat(result.diagnostics()).singleElement().hasToString(
                "[ERROR] big.ml:1:6: Integer literal out of range: 4294967296");
    }

    @Test
    void optionsAreReadFromConfiguration() {
        assertThat(LexerOptions.fromConfig(ConfigFactory.parseString("minilang.lexer.fail-on-invalid = false")))
                .isEqualTo(new LexerOptions(false));
        assertThat(LexerOptions.fromConfig(ConfigFactory.empty())).isEqualTo(LexerOptions.DEFAULTS);
    }
}
