package org.pixelbattle.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.pixelbattle.cli.commands.InspectCommand;
import org.pixelbattle.cli.commands.node.NodeCommand;
import org.pixelbattle.node.config.ConfigLoader;
import org.pixelbattle.node.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pixelbattle",
    mixinStandardHelpOptions = true,
    version = "PixelBattle 1.0",
    description = "PixelBattle - pixel ownership ledger with inactivity-based prize cycles",
    subcommands = {
        NodeCommand.class,
        InspectCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.DEFAULT_CONFIG_FILE_NAME + ")"
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
        commandLine.setCommandName("pixelbattle");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration
     * @throws CommandLine.ParameterException if {@code --config} names a missing file
     * @throws ConfigException if the configuration cannot be parsed
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            LOGGER.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            config = ConfigLoader.load(configFile);
        } else {
            config = ConfigLoader.load();
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
