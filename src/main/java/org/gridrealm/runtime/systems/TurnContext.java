package org.gridrealm.runtime.systems;

import org.gridrealm.runtime.World;

/**
 * Everything a system may touch during one turn, passed explicitly instead of through globals.
 *
 * @param turn The number of the turn being completed, starting at 1.
 * @param world The world the turn runs in.
 * @param systems The registry of auxiliary systems.
 */
public record TurnContext(long turn, World world, SystemRegistry systems) {
}
