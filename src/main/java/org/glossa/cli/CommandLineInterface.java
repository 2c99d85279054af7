package org.glossa.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.glossa.cli.commands.node.NodeCommand;
import org.glossa.node.config.ConfigLoader;
import org.glossa.node.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "glossa",
    mixinStandardHelpOptions = true,
    version = "Glossa 1.0",
    description = "Glossa - multi-user text annotation service",
    subcommands = {
        NodeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.DEFAULT_CONFIG_FILE + ")"
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
        commandLine.setCommandName("glossa");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     *
     * @return the resolved configuration
     * @throws ParameterException if {@code --config} names a missing file or the file is invalid
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        try {
            if (configFile != null) {
                if (!configFile.isFile()) {
                    throw new ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
                }
                config = ConfigLoader.load(configFile.getPath());
            } else {
                config = ConfigLoader.load();
            }
        } catch (final ConfigException e) {
            throw new ParameterException(spec.commandLine(), "Failed to load or parse configuration: " + e.getMessage(), e);
        }

        LoggingConfigurator.configure(config);
        LOGGER.debug("Configuration loaded.");
        return config;
    }
}
