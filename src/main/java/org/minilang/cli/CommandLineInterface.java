package org.minilang.cli;

import com.typesafe.config.Config;
import org.minilang.cli.commands.TokenizeCommand;
import org.minilang.config.ConfigLoader;
import org.minilang.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "minilang",
    mixinStandardHelpOptions = true,
    version = "minilang 1.0",
    description = "Tools for the minilang language",
    subcommands = {
        TokenizeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("minilang");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
