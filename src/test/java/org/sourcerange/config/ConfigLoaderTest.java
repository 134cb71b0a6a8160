package org.sourcerange.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.sourcerange.api.RangeOptions;
import org.sourcerange.junit.extensions.logging.AllowLog;
import org.sourcerange.junit.extensions.logging.ExpectLog;
import org.sourcerange.junit.extensions.logging.LogLevel;
import org.sourcerange.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties (highest priority)
 * 2. Environment Variables
 * 3. Configuration File
 * 4. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("source-range.max-depth");
        System.clearProperty("test.value");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Reference defaults match the built-in default options")
    @AllowLog(level = LogLevel.WARN, messagePattern = "Configuration file.*not found or is empty. Using defaults.")
    void load_referenceDefaultsMatchDefaultOptions() {
        RangeOptions options = ConfigLoader.loadOptions("non-existent-config.conf");

        assertThat(options).isEqualTo(RangeOptions.defaults());
    }

    @Test
    @DisplayName("Configuration file overrides reference defaults")
    void load_fileOverridesDefaults() {
        Config config = ConfigLoader.load("org/sourcerange/config/test-config.conf");

        assertThat(config.getString("test.value")).isEqualTo("file-value");
        assertThat(RangeOptions.fromConfig(config)).isEqualTo(new RangeOptions(true, 64));
    }

    @Test
    @DisplayName("System property overrides file configuration")
    void load_systemPropertyOverridesFile() {
        System.setProperty("source-range.max-depth", "1000");
        System.setProperty("test.value", "system-value");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load("org/sourcerange/config/test-config.conf");

        assertThat(config.getString("test.value")).isEqualTo("system-value");
        RangeOptions options = RangeOptions.fromConfig(config);
        assertThat(options.maxDepth()).isEqualTo(1000);
        // untouched by the override
        assertThat(options.includeComments()).isTrue();
    }

    @Test
    @DisplayName("Missing keys of a partial file fall back to reference defaults")
    void load_partialFileFallsBackToDefaults() {
        Config config = ConfigLoader.load("org/sourcerange/config/references-config.conf");

        assertThat(config.getString("test.referenced-value")).isEqualTo("base-suffix");
        assertThat(RangeOptions.fromConfig(config)).isEqualTo(new RangeOptions(false, 128));
    }

    @Test
    @DisplayName("Empty configuration file is skipped")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Configuration file 'org/sourcerange/config/empty-config.conf' not found or is empty. Using defaults.")
    void load_emptyFileIsSkipped() {
        Config config = ConfigLoader.load("org/sourcerange/config/empty-config.conf");

        assertThat(RangeOptions.fromConfig(config)).isEqualTo(RangeOptions.defaults());
    }
}
