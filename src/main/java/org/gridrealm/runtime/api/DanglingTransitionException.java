package org.gridrealm.runtime.api;

/**
 * Thrown when a transition points at a grid the host has already retired.
 * <p>
 * This indicates a lifetime bug in the hosting application. It is never retried by the engine.
 */
public class DanglingTransitionException extends Exception {

    private final String destinationName;

    /**
     * Creates a new DanglingTransitionException for the given destination grid.
     *
     * @param destinationName name of the retired destination grid.
     */
    public DanglingTransitionException(String destinationName) {
        super("Transition destination grid '" + destinationName + "' has been retired");
        this.destinationName = destinationName;
    }

    public String getDestinationName() {
        return destinationName;
    }
}
