package org.octconverter.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.octconverter.cli.commands.DirectoryCommand;
import org.octconverter.cli.commands.InspectCommand;
import org.octconverter.cli.config.ConfigLoader;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "octconverter",
    mixinStandardHelpOptions = true,
    version = "octconverter 1.0",
    description = "Reads ophthalmic OCT files (Topcon, Heidelberg, Zeiss, Bioptigen, Optovue, DICOM)",
    subcommands = {
        InspectCommand.class,
        DirectoryCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/octconverter.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand given
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
        commandLine.setCommandName("octconverter");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        try {
            this.config = ConfigLoader.resolve(this.configFile);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(new CommandLine(this), e.getMessage(), e);
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }

        if (config.hasPath("octconverter.logging.format")) {
            final String format = config.getString("octconverter.logging.format");
            System.setProperty("octconverter.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDERR_PLAIN" : "STDERR");
            reconfigureLogback();
        }
        if (config.hasPath("octconverter.logging.level")) {
            applyLogLevel(config.getString("octconverter.logging.level"));
        }

        initialized = true;
    }

    private void reconfigureLogback() {
        try {
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    private static void applyLogLevel(String level) {
        ch.qos.logback.classic.Logger libraryLogger =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("org.octconverter");
        libraryLogger.setLevel(Level.toLevel(level, Level.WARN));
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
