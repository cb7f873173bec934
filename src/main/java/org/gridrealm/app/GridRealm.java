package org.gridrealm.app;

import com.typesafe.config.Config;
import org.gridrealm.config.ConfigLoader;
import org.gridrealm.config.LoggingConfigurator;
import org.gridrealm.runtime.systems.SystemRegistry;

/**
 * Entry point for hosting applications: loads configuration, applies logging settings and
 * assembles the world. The host then drives {@link org.gridrealm.runtime.World} from its own loop.
 */
public final class GridRealm {

    private GridRealm() {
    }

    /**
     * Boots a world from {@code gridrealm.conf} (or {@code reference.conf} defaults).
     * @param systems The auxiliary systems of the host.
     * @return The loaded world.
     */
    public static LoadedWorld bootstrap(SystemRegistry systems) {
        return bootstrap(ConfigLoader.load(), systems);
    }

    /**
     * Boots a world from an already loaded configuration.
     * @param config The configuration.
     * @param systems The auxiliary systems of the host.
     * @return The loaded world.
     */
    public static LoadedWorld bootstrap(Config config, SystemRegistry systems) {
        LoggingConfigurator.configure(config);
        return WorldLoader.load(config, systems);
    }
}
