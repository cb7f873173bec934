package org.gridrealm.runtime.collision;

import org.gridrealm.runtime.api.Direction;
import org.gridrealm.runtime.api.MoveResult;
import org.gridrealm.runtime.model.Bounds;
import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Entity;
import org.gridrealm.runtime.model.Grid;
import org.gridrealm.runtime.model.Placement;
import org.gridrealm.runtime.placement.ElementPlacer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CollisionIndexTest {

    private Grid grid;
    private EntityRegistry registry;
    private CollisionIndex collisions;
    private final BlockerSet walls = BlockerSet.of('#');

    @BeforeEach
    void setUp() {
        grid = Grid.fromRows("room", List.of(
                "#####",
                "#...#",
                "#..##",
                "#...#",
                "#####"));
        registry = new EntityRegistry();
        collisions = new CollisionIndex(registry);
    }

    @Test
    @DisplayName("Moving into a blocker leaves the entity where it was")
    void blockedByBlockerSymbol() {
        Entity player = Entity.player(1, grid, new Cell(2, 2));
        registry.add(player);
        Placement before = player.getPlacement();

        MoveResult result = collisions.attemptMove(player, 0, 1, walls);

        assertThat(result).isEqualTo(MoveResult.BLOCKED);
        assertThat(player.getPosition()).isEqualTo(new Cell(2, 2));
        assertThat(player.getPlacement()).isSameAs(before);
    }

    @Test
    void movesOntoFreeFloor() {
        Entity player = Entity.player(1, grid, new Cell(2, 2));
        registry.add(player);

        assertThat(collisions.attemptMove(player, Direction.UP, walls)).isEqualTo(MoveResult.MOVED);
        assertThat(player.getPosition()).isEqualTo(new Cell(1, 2));
        assertThat(player.getGrid()).isSameAs(grid);
    }

    @Test
    void canEnter_rejectsOutOfBoundsCells() {
        Entity player = Entity.player(1, grid, new Cell(0, 0));

        assertThat(collisions.canEnter(grid, new Cell(-1, 0), BlockerSet.none(), player)).isFalse();
        assertThat(collisions.canEnter(grid, new Cell(0, 5), BlockerSet.none(), player)).isFalse();
        assertThat(collisions.attemptMove(player, Direction.LEFT, BlockerSet.none())).isEqualTo(MoveResult.BLOCKED);
        assertThat(player.getPosition()).isEqualTo(new Cell(0, 0));
    }

    @Test
    void blockerSetIsSuppliedPerCall() {
        Entity player = Entity.player(1, grid, new Cell(2, 2));

        assertThat(collisions.canEnter(grid, new Cell(2, 3), BlockerSet.none(), player)).isTrue();
        assertThat(collisions.canEnter(grid, new Cell(2, 3), walls, player)).isFalse();
        assertThat(collisions.canEnter(grid, new Cell(1, 1), BlockerSet.of('.'), player)).isFalse();
    }

    @Test
    void boundsWinOverGridContent() {
        Entity player = Entity.player(1, grid, new Cell(1, 1));
        player.setBounds(new Bounds(1, 1, 1, 3));

        assertThat(collisions.attemptMove(player, Direction.DOWN, walls)).isEqualTo(MoveResult.BLOCKED);
        assertThat(collisions.attemptMove(player, Direction.RIGHT, walls)).isEqualTo(MoveResult.MOVED);
        assertThat(player.getPosition()).isEqualTo(new Cell(1, 2));
    }

    @Test
    void playersCannotShareACell() {
        Entity first = Entity.player(1, grid, new Cell(1, 1));
        Entity second = Entity.player(2, grid, new Cell(1, 2));
        registry.add(first);
        registry.add(second);

        assertThat(collisions.attemptMove(first, Direction.RIGHT, walls)).isEqualTo(MoveResult.BLOCKED);
        assertThat(first.getPosition()).isEqualTo(new Cell(1, 1));
    }

    @Test
    void elementsMayOverlap() {
        Entity player = Entity.player(1, grid, new Cell(1, 1));
        Entity crate = Entity.element(2, grid, new Cell(1, 2), "C");
        registry.add(player);
        registry.add(crate);

        assertThat(collisions.attemptMove(crate, Direction.LEFT, walls)).isEqualTo(MoveResult.MOVED);
        assertThat(crate.getPosition()).isEqualTo(new Cell(1, 1));
    }

    @Test
    void entitiesOnOtherGridsDoNotBlock() {
        Grid elsewhere = Grid.filled("elsewhere", 5, 5, '.');
        Entity player = Entity.player(1, grid, new Cell(1, 1));
        Entity stranger = Entity.player(2, elsewhere, new Cell(1, 2));
        registry.add(player);
        registry.add(stranger);

        assertThat(collisions.attemptMove(player, Direction.RIGHT, walls)).isEqualTo(MoveResult.MOVED);
    }

    @Test
    void multiCellArtOccupiesItsWholeFootprint() {
        ElementPlacer placer = new ElementPlacer();
        Entity table = Entity.element(2, grid, new Cell(3, 1), "TT");
        Entity player = Entity.player(1, grid, new Cell(2, 2));
        registry.add(table);
        registry.add(player);
        registry.setFootprint(table, placer.place(grid, table));

        assertThat(collisions.attemptMove(player, Direction.DOWN, walls)).isEqualTo(MoveResult.BLOCKED);
    }

    @Test
    void ownArtIsNotTreatedAsBlocker() {
        ElementPlacer placer = new ElementPlacer();
        Entity wallPiece = Entity.element(1, grid, new Cell(1, 1), "##");
        registry.add(wallPiece);
        registry.setFootprint(wallPiece, placer.place(grid, wallPiece));

        // the anchor moves onto (1, 2), which currently shows the element's own '#'
        assertThat(collisions.attemptMove(wallPiece, Direction.RIGHT, walls)).isEqualTo(MoveResult.MOVED);
        assertThat(wallPiece.getPosition()).isEqualTo(new Cell(1, 2));
    }
}
