package org.gridrealm.runtime.systems;

/**
 * An auxiliary system (quests, farming, spawners, ...) that is updated once per turn by the
 * host loop. Systems reach each other through the registry in the {@link TurnContext}.
 */
public interface ITurnSystem {

    /**
     * Advances the system by one turn.
     *
     * @param context The current turn, world and registry.
     */
    void update(TurnContext context);
}
