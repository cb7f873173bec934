package org.gridrealm.app;

import org.gridrealm.runtime.World;
import org.gridrealm.runtime.model.Entity;

import java.util.Optional;

/**
 * A world assembled from configuration.
 *
 * @param world The world with all levels registered and linked.
 * @param player The spawned player, or null if the configuration defines none.
 */
public record LoadedWorld(World world, Entity player) {

    public Optional<Entity> playerEntity() {
        return Optional.ofNullable(player);
    }
}
