package org.modcat.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.modcat.cli.commands.ConcatCommand;
import org.modcat.cli.commands.NotebookCommand;
import org.modcat.cli.commands.ReportCommand;
import org.modcat.cli.config.ConfigLoader;
import org.modcat.cli.config.LoggingConfigurator;
import org.modcat.output.ArtifactBanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "modcat",
    mixinStandardHelpOptions = true,
    version = "modcat " + ArtifactBanner.VERSION,
    description = "modcat - concatenates a module tree into one file, dependencies first",
    subcommands = {
        ConcatCommand.class,
        NotebookCommand.class,
        ReportCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/modcat.conf)"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log module discovery and edge resolution (DEBUG level)"
    )
    private boolean verbose;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("modcat");
        return commandLine;
    }

    /**
     * Loads the configuration once and applies its logging settings.
     *
     * @throws IllegalArgumentException            if an explicit config file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.debug(message);
                case WARN -> logger.warn(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("modcat.logging.format", "COLOR".equalsIgnoreCase(format) ? "STDERR_COLOR" : "STDERR");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
        if (verbose) {
            LoggingConfigurator.setLevel("org.modcat", "DEBUG");
        }

        initialized = true;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
