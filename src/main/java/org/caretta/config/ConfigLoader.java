package org.caretta.config;

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

    /** Configuration file picked up from the working directory. */
    public static final String CONFIG_FILE_NAME = "caretta.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Java system properties (e.g. {@code -Dcaretta.diagnostics.show-colors=never})
     * 2. Environment variables
     * 3. The explicit file, or else {@code caretta.conf} in the working directory
     * 4. Default values from {@code reference.conf} on the classpath
     *
     * @param explicitFile A file given on the command line, or {@code null}.
     * @return A resolved {@link Config}.
     * @throws IllegalArgumentException If {@code explicitFile} does not exist.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.debug("Loading configuration from file: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File cwdFile = new File(CONFIG_FILE_NAME);
            if (cwdFile.isFile()) {
                LOG.debug("Loading configuration from file: {}", cwdFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdFile);
            } else {
                LOG.debug("No '{}' in working directory, using defaults.", CONFIG_FILE_NAME);
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
     * Loads a configuration from a classpath resource layered over the defaults, without
     * consulting system properties or the environment.
     *
     * @param resource The classpath resource, e.g. {@code org/caretta/config/test.conf}.
     * @return A resolved {@link Config}.
     */
    public static Config loadResource(final String resource) {
        return ConfigFactory.parseResources(resource)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}
