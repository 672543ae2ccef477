package org.swarmsim.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the node configuration. Later sources only fill in what earlier ones leave unset:
 * <ol>
 *   <li>Java system properties ({@code -Dnode.processes.httpServer.options.network.port=9000})</li>
 *   <li>Environment variables</li>
 *   <li>The configuration file: the one passed in, or {@code swarmsim.conf} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "swarmsim.conf";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads and resolves the configuration.
     *
     * @param configFile An explicit configuration file, or {@code null} to look for
     *                   {@value #CONFIG_FILE_NAME} in the working directory.
     * @return The merged, resolved configuration.
     * @throws IllegalArgumentException if an explicit file does not exist.
     * @throws com.typesafe.config.ConfigException if a source cannot be parsed.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Using configuration file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File defaultFile = new File(CONFIG_FILE_NAME);
            if (defaultFile.isFile()) {
                LOG.info("Using configuration file found in current directory: {}", defaultFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(defaultFile);
            } else {
                LOG.debug("No '{}' in the working directory, using built-in defaults.", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }

        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
