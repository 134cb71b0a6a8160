package org.sourcerange.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.sourcerange.api.RangeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the range engine configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "source-range.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@code source-range.conf} in the working directory as the
     * configuration file.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. CLI arguments (as Java System Properties, e.g., -Dkey=value)
     * 2. Environment Variables
     * 3. Configuration file (filesystem path, or classpath resource if no such file exists)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configPath The path of the configuration file.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String configPath) {
        final Config cliConfig = ConfigFactory.systemProperties();

        // The Typesafe library maps env vars like 'CONFIG_FORCE_source__range_max__depth'
        // to 'source-range.max-depth'.
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();

        final Config fileConfig = loadFile(configPath);

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        final Config combinedConfig = cliConfig
            .withFallback(envConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
        return combinedConfig.resolve();
    }

    /**
     * Loads the configuration and builds the engine options from it.
     * @param configPath The path of the configuration file.
     * @return The options.
     */
    public static RangeOptions loadOptions(final String configPath) {
        final RangeOptions options = RangeOptions.fromConfig(load(configPath));
        LOG.debug("Range options: includeComments={}, maxDepth={}", options.includeComments(), options.maxDepth());
        return options;
    }

    private static Config loadFile(final String configPath) {
        final File configFile = new File(configPath);
        Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.parseResources(configPath);
        }

        if (fileConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", configPath);
            return ConfigFactory.empty();
        }
        return fileConfig;
    }
}
