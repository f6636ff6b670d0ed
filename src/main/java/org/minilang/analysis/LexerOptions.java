package org.minilang.analysis;

import com.typesafe.config.Config;

/**
 * Settings of a {@link LexicalAnalyzer}.
 *
 * @param failOnInvalid Whether an invalid character is reported as an error (otherwise as a warning).
 */
public record LexerOptions(boolean failOnInvalid) {

    /** Invalid characters are errors. */
    public static final LexerOptions DEFAULTS = new LexerOptions(true);

    private static final String FAIL_ON_INVALID_PATH = "minilang.lexer.fail-on-invalid";

    /**
     * Reads the options from the {@code minilang.lexer} section, falling back to {@link #DEFAULTS}
     * for missing keys.
     * @param config The resolved application configuration.
     * @return The options.
     */
    public static LexerOptions fromConfig(Config config) {
        final boolean failOnInvalid = config.hasPath(FAIL_ON_INVALID_PATH)
                ? config.getBoolean(FAIL_ON_INVALID_PATH)
                : DEFAULTS.failOnInvalid();
        return new LexerOptions(failOnInvalid);
    }
}
