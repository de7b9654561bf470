package org.pixelbattle.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration. Precedence, highest first:
 * <ol>
 *   <li>environment variables</li>
 *   <li>JVM system properties ({@code -Dkey=value})</li>
 *   <li>the configuration file</li>
 *   <li>{@code reference.conf} defaults on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String DEFAULT_CONFIG_FILE_NAME = "pixelbattle.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@value #DEFAULT_CONFIG_FILE_NAME} from the working directory.
     */
    public static Config load() {
        return load(new File(DEFAULT_CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with {@code configFile} as the file layer. A missing file is skipped
     * with a warning and only the other layers are used.
     *
     * @param configFile the HOCON file to use, may not exist
     * @return the merged and resolved configuration
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or substitutions fail
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.warn("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return merge(fileConfig);
    }

    /**
     * Loads the configuration with a classpath resource as the file layer. Used by tests.
     *
     * @param resourceName classpath resource name
     */
    public static Config loadResource(final String resourceName) {
        final Config resourceConfig = ConfigFactory.parseResources(resourceName);
        if (resourceConfig.isEmpty()) {
            LOG.warn("Configuration resource '{}' not found or is empty. Using defaults.", resourceName);
        }
        return merge(resourceConfig);
    }

    private static Config merge(final Config fileConfig) {
        // The Typesafe library maps env vars with the CONFIG_FORCE_ prefix onto config paths
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
