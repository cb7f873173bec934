package org.gridrealm.runtime.api;

/**
 * Base type for failures raised by a {@link org.gridrealm.runtime.model.Grid} when a caller
 * violates its shape or bounds contract. Both subtypes are local to the caller and recoverable.
 */
public class GridException extends RuntimeException {

    /**
     * Constructs a new grid exception with the specified detail message.
     * @param message The detail message.
     */
    public GridException(String message) {
        super(message);
    }
}
