package org.geofacet.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the library configuration from its layered sources.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Environment variables</li>
 *   <li>Java system properties ({@code -Dgeofacet.link-axes=both})</li>
 *   <li>A configuration file ({@code geofacet.conf} in the working directory, or an explicit classpath resource)</li>
 *   <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 * All library settings live below the {@value #ROOT_PATH} path.
 */
public final class GeoFacetConfig {

    private static final Logger LOG = LoggerFactory.getLogger(GeoFacetConfig.class);

    /** Root path of every library setting. */
    public static final String ROOT_PATH = "geofacet";

    private static final String CONFIG_FILE_NAME = "geofacet.conf";

    private GeoFacetConfig() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@code geofacet.conf} from the working directory, if present.
     *
     * @return the resolved configuration, rooted at the top level (not at {@value #ROOT_PATH})
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.empty();
        }
        return layer(fileConfig);
    }

    /**
     * Loads the configuration using a classpath resource instead of the working-directory file.
     *
     * @param resourceName classpath resource, e.g. {@code "org/geofacet/config/test.conf"}
     * @return the resolved configuration
     */
    public static Config load(final String resourceName) {
        final Config resourceConfig = ConfigFactory.parseResources(resourceName);
        if (resourceConfig.isEmpty()) {
            LOG.debug("Configuration resource '{}' not found or empty, using defaults only.", resourceName);
        }
        return layer(resourceConfig);
    }

    /**
     * Returns only the built-in defaults from {@code reference.conf}.
     */
    public static Config defaults() {
        return ConfigFactory.parseResources("reference.conf").resolve();
    }

    private static Config layer(final Config fileConfig) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config sysConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
                .withFallback(sysConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
