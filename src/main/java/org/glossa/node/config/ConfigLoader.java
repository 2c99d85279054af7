package org.glossa.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dnode.processes.httpServer.options.network.port=9090})</li>
 *   <li>Environment variables</li>
 *   <li>The configuration file (by default {@code glossa.conf} in the working directory)</li>
 *   <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Name of the configuration file looked up in the working directory.
     */
    public static final String DEFAULT_CONFIG_FILE = "glossa.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@link #DEFAULT_CONFIG_FILE}.
     *
     * @return the resolved configuration
     */
    public static Config load() {
        return load(DEFAULT_CONFIG_FILE);
    }

    /**
     * Loads the configuration using the given file. The path is tried on the filesystem first and
     * then as a classpath resource. A missing or empty file falls back to the defaults.
     *
     * @param configFilePath filesystem path or classpath resource name
     * @return the resolved configuration
     * @throws com.typesafe.config.ConfigException if a file exists but cannot be parsed
     */
    public static Config load(final String configFilePath) {
        final File file = new File(configFilePath);
        Config fileConfig;
        if (file.isFile()) {
            LOG.info("Loading configuration from file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            fileConfig = ConfigFactory.parseResources(configFilePath);
        }

        if (fileConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", configFilePath);
            fileConfig = ConfigFactory.empty();
        }

        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.defaultReference())
            .resolve();
    }
}
