package org.minilang.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.minilang.analysis.LexerOptions;
import org.minilang.analysis.LexicalAnalysisResult;
import org.minilang.analysis.LexicalAnalyzer;
import org.minilang.cli.CommandLineInterface;
import org.minilang.diagnostics.Diagnostic;
import org.minilang.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "tokenize", description = "Scans a source file and prints its tokens.")
public class TokenizeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenizeCommand.class);

    /** Exit code when the source contains lexical errors. */
    public static final int EXIT_LEXICAL_ERRORS = 1;
    /** Exit code when the source file or the configuration file cannot be read. */
    public static final int EXIT_IO_ERROR = 2;

    /** How tokens are printed. */
    public enum OutputFormat { TEXT, JSON }

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: minilang.cli.output-format)")
    private OutputFormat format;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            LOGGER.error("Failed to load configuration: {}", e.getMessage());
            err.println("Cannot load configuration: " + e.getMessage());
            err.flush();
            return EXIT_IO_ERROR;
        }

        final String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.error("Failed to read source file {}", file.getAbsolutePath(), e);
            err.println("Cannot read " + file + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        final LexicalAnalyzer analyzer = new LexicalAnalyzer(LexerOptions.fromConfig(config));
        final LexicalAnalysisResult result = analyzer.analyze(source, file.getName());

        switch (resolveFormat(config)) {
            case JSON -> {
                final Gson gson = new GsonBuilder().setPrettyPrinting().create();
                out.println(gson.toJson(result.tokens()));
            }
            case TEXT -> {
                for (final Token token : result.tokens()) {
                    out.printf("%d:%d %s %s%n", token.line(), token.column(), token.type(), token.text());
                }
            }
        }
        out.flush();

        for (final Diagnostic diagnostic : result.diagnostics()) {
            err.println(diagnostic);
        }
        err.flush();

        return result.hasErrors() ? EXIT_LEXICAL_ERRORS : 0;
    }

    private OutputFormat resolveFormat(Config config) {
        if (format != null) {
            return format;
        }
        final String configured = config.getString("minilang.cli.output-format");
        try {
            return OutputFormat.valueOf(configured.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Unknown output format '{}' in configuration, using TEXT", configured);
            return OutputFormat.TEXT;
        }
    }
}
