package org.gridrealm.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class EntityTest {

    @Test
    void relocate_swapsGridAndCellTogetherAndNotifiesListeners() {
        Grid a = Grid.filled("a", 5, 5, '.');
        Grid b = Grid.filled("b", 5, 5, '.');
        Entity player = Entity.player(1, a, new Cell(2, 2));
        List<Placement> seen = new ArrayList<>();
        player.addPlacementListener((entity, previous, current) -> seen.add(entity.getPlacement()));

        player.relocate(new Placement(b, new Cell(1, 1)));

        assertThat(player.getGrid()).isSameAs(b);
        assertThat(player.getPosition()).isEqualTo(new Cell(1, 1));
        assertThat(seen).containsExactly(new Placement(b, new Cell(1, 1)));
    }

    @Test
    void factories_assignKindAndArt() {
        Grid grid = Grid.filled("g", 5, 5, '.');

        Entity player = Entity.player(1, grid, new Cell(0, 0));
        Entity element = Entity.element(2, grid, new Cell(1, 1), "\n[]\n");

        assertThat(player.getKind()).isEqualTo(EntityKind.PLAYER);
        assertThat(player.getArt()).isEqualTo(Art.of('X'));
        assertThat(element.getKind()).isEqualTo(EntityKind.ELEMENT);
        assertThat(element.getArt().getLines()).containsExactly("[]");
        assertThat(element.getBounds()).isNull();
    }

    @Test
    void bounds_containsIsInclusive() {
        Bounds bounds = Bounds.interiorOf(new Dimensions(6, 4));

        assertThat(bounds).isEqualTo(new Bounds(1, 1, 2, 4));
        assertThat(bounds.contains(new Cell(1, 1))).isTrue();
        assertThat(bounds.contains(new Cell(2, 4))).isTrue();
        assertThat(bounds.contains(new Cell(3, 4))).isFalse();
        assertThat(bounds.contains(new Cell(1, 0))).isFalse();
    }
}
