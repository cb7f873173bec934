package org.gridrealm.runtime.systems;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named, ordered registry of auxiliary systems.
 * <p>
 * Its lifetime is owned by the application loop: created once at startup and discarded at shutdown.
 * Systems implementing {@link ITurnSystem} are updated in registration order.
 */
public final class SystemRegistry {

    private final Map<String, Object> systems = new LinkedHashMap<>();

    /**
     * Registers a system under a name.
     *
     * @param name     The unique name of the system.
     * @param instance The system instance.
     * @throws IllegalArgumentException if a system with this name is already registered.
     */
    public void register(final String name, final Object instance) {
        Objects.requireNonNull(name, "System name cannot be null.");
        Objects.requireNonNull(instance, "System instance cannot be null.");
        if (systems.containsKey(name)) {
            throw new IllegalArgumentException("System '" + name + "' is already registered.");
        }
        systems.put(name, instance);
    }

    /**
     * Removes a system.
     *
     * @param name The name of the system.
     * @return true if a system was removed.
     */
    public boolean unregister(final String name) {
        return systems.remove(name) != null;
    }

    /**
     * Retrieves a system by name.
     *
     * @param name The name of the system.
     * @return The system, or empty if none is registered under this name.
     */
    public Optional<Object> get(final String name) {
        return Optional.ofNullable(systems.get(name));
    }

    /**
     * Retrieves a system by name and type.
     *
     * @param name The name of the system.
     * @param type The expected type.
     * @param <T>  The type of the system.
     * @return The system.
     * @throws IllegalArgumentException if no system with this name and type exists.
     */
    public <T> T get(final String name, final Class<T> type) {
        final Object instance = systems.get(name);
        if (instance == null) {
            throw new IllegalArgumentException("No system registered under name '" + name + "'");
        }
        if (!type.isInstance(instance)) {
            throw new IllegalArgumentException("System '" + name + "' is a " + instance.getClass().getName()
                    + ", not a " + type.getName());
        }
        return type.cast(instance);
    }

    public boolean hasSystem(final String name) {
        return systems.containsKey(name);
    }

    /**
     * Updates every registered {@link ITurnSystem} in registration order.
     *
     * @param context The turn context.
     */
    public void updateAll(final TurnContext context) {
        for (final Object system : systems.values()) {
            if (system instanceof ITurnSystem turnSystem) {
                turnSystem.update(context);
            }
        }
    }

    public Collection<String> names() {
        return Collections.unmodifiableSet(systems.keySet());
    }
}
