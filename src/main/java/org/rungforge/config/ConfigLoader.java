package org.rungforge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "rungforge.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, highest precedence first:
     * <ol>
     *   <li>Java system properties ({@code -Dkey=value})</li>
     *   <li>Environment variables</li>
     *   <li>The given configuration file, or {@code rungforge.conf} in the working directory</li>
     *   <li>Default values from {@code reference.conf} on the classpath</li>
     * </ol>
     *
     * @param configFile An explicit configuration file, or {@code null} to look for {@code rungforge.conf}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if an explicit configuration file does not exist.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File defaultFile = new File(CONFIG_FILE_NAME);
            if (defaultFile.isFile()) {
                LOG.debug("Loading configuration from file: {}", defaultFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(defaultFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", defaultFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        // The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    /**
     * Loads the configuration without an explicit file.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(null);
    }
}
