package org.gridrealm.runtime.systems;

import org.gridrealm.runtime.World;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class SystemRegistryTest {

    @Mock
    private ITurnSystem quests;

    @Mock
    private ITurnSystem farming;

    @Test
    void registerAndLookUpByNameAndType() {
        SystemRegistry registry = new SystemRegistry();
        registry.register("quests", quests);
        registry.register("notes", "plain value");

        assertThat(registry.hasSystem("quests")).isTrue();
        assertThat(registry.get("quests")).containsSame(quests);
        assertThat(registry.get("quests", ITurnSystem.class)).isSameAs(quests);
        assertThat(registry.get("missing")).isEmpty();
        assertThat(registry.names()).containsExactly("quests", "notes");
    }

    @Test
    void lookupWithWrongTypeOrUnknownNameFails() {
        SystemRegistry registry = new SystemRegistry();
        registry.register("notes", "plain value");

        assertThatThrownBy(() -> registry.get("notes", ITurnSystem.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("notes");
        assertThatThrownBy(() -> registry.get("quests", ITurnSystem.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void duplicateNamesAreRejected() {
        SystemRegistry registry = new SystemRegistry();
        registry.register("quests", quests);

        assertThatThrownBy(() -> registry.register("quests", farming))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unregisterForgetsTheSystem() {
        SystemRegistry registry = new SystemRegistry();
        registry.register("quests", quests);

        assertThat(registry.unregister("quests")).isTrue();
        assertThat(registry.unregister("quests")).isFalse();
        assertThat(registry.hasSystem("quests")).isFalse();
    }

    @Test
    void updateAllRunsTurnSystemsInRegistrationOrder() {
        SystemRegistry registry = new SystemRegistry();
        registry.register("farming", farming);
        registry.register("notes", "not a turn system");
        registry.register("quests", quests);
        TurnContext context = new TurnContext(1, new World(registry), registry);

        registry.updateAll(context);

        InOrder order = inOrder(farming, quests);
        order.verify(farming).update(context);
        order.verify(quests).update(context);
    }

    @Test
    void systemsReachEachOtherThroughTheContext() {
        SystemRegistry registry = new SystemRegistry();
        StringBuilder log = new StringBuilder();
        registry.register("log", log);
        registry.register("writer", (ITurnSystem) context ->
                context.systems().get("log", StringBuilder.class).append("turn ").append(context.turn()));
        registry.register("quests", quests);

        registry.updateAll(new TurnContext(3, new World(registry), registry));

        assertThat(log).hasToString("turn 3");
        verify(quests).update(any(TurnContext.class));
    }
}
