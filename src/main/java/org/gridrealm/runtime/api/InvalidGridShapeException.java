package org.gridrealm.runtime.api;

/**
 * Thrown at construction time when the supplied rows do not form a non-empty rectangle.
 */
public class InvalidGridShapeException extends GridException {

    /**
     * Creates a new InvalidGridShapeException with the given message.
     *
     * @param message description of the shape violation.
     */
    public InvalidGridShapeException(String message) {
        super(message);
    }
}
