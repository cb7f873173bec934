package org.gridrealm.runtime.api;

/**
 * Outcome of a single movement attempt.
 */
public enum MoveResult {
    /** The entity's placement was updated. */
    MOVED,
    /** Nothing changed. */
    BLOCKED
}
