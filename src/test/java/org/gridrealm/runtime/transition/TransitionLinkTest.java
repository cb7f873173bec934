package org.gridrealm.runtime.transition;

import org.gridrealm.runtime.api.DanglingTransitionException;
import org.gridrealm.runtime.api.OutOfBoundsException;
import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Entity;
import org.gridrealm.runtime.model.Grid;
import org.gridrealm.runtime.model.Placement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TransitionLinkTest {

    private Grid gridA;
    private Grid gridB;
    private PortalTable portals;

    @BeforeEach
    void setUp() {
        gridA = Grid.filled("a", 6, 6, '.');
        gridA.set(4, 4, 'D');
        gridB = Grid.filled("b", 3, 3, '.');
        portals = new PortalTable();
        portals.register(gridA, new TransitionLink('D', gridB, new Cell(1, 1)));
    }

    @Test
    void checkTransition_findsPortalSymbolOnItsGridOnly() {
        assertThat(portals.checkTransition(gridA, new Cell(4, 4)))
                .hasValueSatisfying(link -> assertThat(link.getDestination()).isSameAs(gridB));
        assertThat(portals.checkTransition(gridA, new Cell(4, 3))).isEmpty();
        assertThat(portals.checkTransition(gridA, new Cell(9, 9))).isEmpty();

        gridB.set(0, 0, 'D');
        assertThat(portals.checkTransition(gridB, new Cell(0, 0))).isEmpty();
    }

    @Test
    void apply_swapsGridAndPositionInOneStep() throws DanglingTransitionException {
        Entity player = Entity.player(1, gridA, new Cell(4, 4));
        List<Placement> observed = new ArrayList<>();
        player.addPlacementListener((entity, previous, current) -> observed.add(entity.getPlacement()));

        portals.checkTransition(gridA, player.getPosition()).orElseThrow().apply(player);

        assertThat(player.getPlacement()).isEqualTo(new Placement(gridB, new Cell(1, 1)));
        assertThat(observed).containsExactly(new Placement(gridB, new Cell(1, 1)));
    }

    @Test
    void apply_failsLoudlyForRetiredDestination() {
        Entity player = Entity.player(1, gridA, new Cell(4, 4));
        TransitionLink link = portals.checkTransition(gridA, new Cell(4, 4)).orElseThrow();
        gridB.retire();

        assertThatThrownBy(() -> link.apply(player))
                .isInstanceOf(DanglingTransitionException.class)
                .hasMessageContaining("'b'");
        assertThat(player.getPlacement()).isEqualTo(new Placement(gridA, new Cell(4, 4)));
    }

    @Test
    void selfLinksAreLegalAndApplyOnce() throws DanglingTransitionException {
        gridA.set(0, 0, 'O');
        TransitionLink loop = new TransitionLink('O', gridA, new Cell(0, 0));
        portals.register(gridA, loop);
        Entity player = Entity.player(1, gridA, new Cell(0, 0));

        loop.apply(player);

        assertThat(player.getPlacement()).isEqualTo(new Placement(gridA, new Cell(0, 0)));
        assertThat(portals.checkTransition(gridA, player.getPosition())).contains(loop);
    }

    @Test
    void spawnMustLieInsideDestination() {
        assertThatThrownBy(() -> new TransitionLink('D', gridB, new Cell(3, 0)))
                .isInstanceOf(OutOfBoundsException.class);
    }

    @Test
    void portalSymbolCanOnlyBeLinkedOncePerGrid() {
        assertThatThrownBy(() -> portals.register(gridA, new TransitionLink('D', gridA, new Cell(0, 0))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
