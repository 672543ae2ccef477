package org.swarmsim.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.swarmsim.cli.commands.node.NodeCommand;
import org.swarmsim.node.config.ConfigLoader;
import org.swarmsim.node.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "swarmsim",
    mixinStandardHelpOptions = true,
    version = "Swarmsim 1.0",
    description = "Swarmsim - zone-based flocking simulation server",
    subcommands = {
        NodeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("swarmsim");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        try {
            config = ConfigLoader.load(configFile);
        } catch (final ConfigException | IllegalArgumentException e) {
            logger.error("Failed to load configuration: {}", e.getMessage());
            throw new CommandLine.ParameterException(new CommandLine(this), e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);

        if (config.hasPath("node.show-welcome-message") && config.getBoolean("node.show-welcome-message")
            && "PLAIN".equalsIgnoreCase(config.hasPath("logging.format") ? config.getString("logging.format") : "PLAIN")) {
            showWelcomeMessage();
        }
        return config;
    }

    private static void showWelcomeMessage() {
        System.out.println("\nWelcome to Swarmsim\n"
            + "Zone-based flocking simulation server\n");
    }
}
