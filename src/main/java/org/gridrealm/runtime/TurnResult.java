package org.gridrealm.runtime;

import org.gridrealm.runtime.api.MoveResult;
import org.gridrealm.runtime.transition.TransitionLink;

import java.util.Optional;

/**
 * What happened to an entity during one move.
 *
 * @param result Whether the entity moved.
 * @param transition The link that was followed, or null if the entity did not land on a portal.
 */
public record TurnResult(MoveResult result, TransitionLink transition) {

    static TurnResult blocked() {
        return new TurnResult(MoveResult.BLOCKED, null);
    }

    public boolean moved() {
        return result == MoveResult.MOVED;
    }

    public Optional<TransitionLink> transitionTaken() {
        return Optional.ofNullable(transition);
    }
}
