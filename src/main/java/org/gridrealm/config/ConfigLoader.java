package org.gridrealm.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the HOCON configuration the world is assembled from.
 * <p>
 * Sources, highest precedence first:
 * <ol>
 *   <li>environment variables</li>
 *   <li>system properties ({@code -Dgridrealm.world.seed=7})</li>
 *   <li>the configuration file, looked up on the filesystem and then on the classpath</li>
 *   <li>{@code reference.conf} shipped with the engine</li>
 * </ol>
 * Substitutions are resolved after merging, so a file may refer to values set by a system property.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_CONFIG_FILE = "gridrealm.conf";

    private ConfigLoader() {
    }

    /**
     * Loads with {@code gridrealm.conf} as the configuration file.
     * @return The merged and resolved configuration.
     */
    public static Config load() {
        return load(DEFAULT_CONFIG_FILE);
    }

    /**
     * Loads with the given configuration file.
     * @param configName A filesystem path or a classpath resource name.
     * @return The merged and resolved configuration.
     */
    public static Config load(final String configName) {
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(readConfigFile(configName))
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    private static Config readConfigFile(final String configName) {
        final File file = new File(configName);
        if (file.isFile()) {
            LOG.info("Loading configuration from file: {}", file.getAbsolutePath());
            return ConfigFactory.parseFile(file);
        }
        final Config resource = ConfigFactory.parseResources(configName);
        if (resource.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", configName);
            return ConfigFactory.empty();
        }
        LOG.info("Loading configuration from classpath resource: {}", configName);
        return resource;
    }
}
