package org.caretta.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.caretta.cli.commands.LineCommand;
import org.caretta.cli.commands.LocateCommand;
import org.caretta.cli.commands.ReportCommand;
import org.caretta.config.ConfigLoader;
import org.caretta.config.DiagnosticOptions;
import org.caretta.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "caretta",
    mixinStandardHelpOptions = true,
    version = "Caretta 1.0",
    description = "Resolve source locations and render caret diagnostics.",
    subcommands = {
        LocateCommand.class,
        LineCommand.class,
        ReportCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("caretta");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException If the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (IllegalArgumentException | ConfigException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Failed to load configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    public DiagnosticOptions getDiagnosticOptions() {
        return DiagnosticOptions.fromConfig(getConfig());
    }
}
