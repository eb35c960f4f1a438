package org.geofacet.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.geofacet.junit.extensions.logging.AllowLog;
import org.geofacet.junit.extensions.logging.FailOnLog;
import org.geofacet.junit.extensions.logging.LogLevel;
import org.geofacet.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the configuration layering: system properties over the configuration file over
 * {@code reference.conf}. Loading is expected to be silent unless a resource is missing.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
@FailOnLog(level = LogLevel.DEBUG)
class GeoFacetConfigTest {

    private static final String TEST_CONFIG = "org/geofacet/config/test.conf";

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("geofacet.link-axes");
        System.clearProperty("geofacet.figure.cell-height");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults come from reference.conf")
    void defaults_shouldReadReferenceConf() {
        Config config = GeoFacetConfig.defaults();

        assertThat(config.getString("geofacet.default-grid")).isEqualTo("us_state_grid1");
        assertThat(config.getString("geofacet.link-axes")).isEqualTo("none");
        assertThat(config.getString("geofacet.missing-regions")).isEqualTo("skip");
        assertThat(config.getString("geofacet.extra-regions")).isEqualTo("error");
        assertThat(config.getBoolean("geofacet.hide-inner-decorations")).isTrue();
        assertThat(config.getInt("geofacet.figure.cell-width")).isEqualTo(200);
        assertThat(config.getInt("geofacet.figure.cell-height")).isEqualTo(150);
    }

    @Test
    @DisplayName("A configuration resource overrides defaults and keeps the rest")
    void load_resourceShouldOverrideDefaults() {
        Config config = GeoFacetConfig.load(TEST_CONFIG);

        assertThat(config.getString("geofacet.link-axes")).isEqualTo("both");
        assertThat(config.getInt("geofacet.figure.cell-width")).isEqualTo(100);
        assertThat(config.getInt("geofacet.figure.cell-height")).isEqualTo(150);
        assertThat(config.getStringList("geofacet.grids.available")).hasSize(4);
    }

    @Test
    @DisplayName("System properties override the configuration resource")
    void load_systemPropertyShouldOverrideResource() {
        System.setProperty("geofacet.link-axes", "x");
        System.setProperty("geofacet.figure.cell-height", "90");
        ConfigFactory.invalidateCaches();

        Config config = GeoFacetConfig.load(TEST_CONFIG);

        assertThat(config.getString("geofacet.link-axes")).isEqualTo("x");
        assertThat(config.getInt("geofacet.figure.cell-height")).isEqualTo(90);
        assertThat(config.getString("geofacet.missing-regions")).isEqualTo("placeholder");
    }

    @Test
    @DisplayName("A missing resource falls back to the defaults")
    @AllowLog(level = LogLevel.DEBUG, loggerPattern = ".*GeoFacetConfig",
            messagePattern = "Configuration resource '.*' not found or empty, using defaults only\\.")
    void load_missingResourceShouldUseDefaults() {
        Config config = GeoFacetConfig.load("org/geofacet/config/does-not-exist.conf");

        assertThat(config.getString("geofacet.link-axes")).isEqualTo("none");
    }

    @Test
    @DisplayName("Loading without arguments yields a complete configuration")
    void load_shouldProvideAllSettings() {
        Config config = GeoFacetConfig.load();

        assertThat(config.hasPath("geofacet.default-grid")).isTrue();
        assertThat(config.hasPath("geofacet.figure.legend-width")).isTrue();
    }
}
