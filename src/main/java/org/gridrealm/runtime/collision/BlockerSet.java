package org.gridrealm.runtime.collision;

import java.util.HashSet;
import java.util.Set;

/**
 * The symbols that are impassable on a grid. Supplied by the host; the engine never derives it.
 *
 * @param symbols The blocking symbols.
 */
public record BlockerSet(Set<Character> symbols) {

    public BlockerSet {
        symbols = Set.copyOf(symbols);
    }

    /**
     * Creates a blocker set from individual symbols.
     * @param symbols The blocking symbols.
     * @return The blocker set.
     */
    public static BlockerSet of(char... symbols) {
        Set<Character> set = new HashSet<>();
        for (char symbol : symbols) {
            set.add(symbol);
        }
        return new BlockerSet(set);
    }

    /**
     * Creates a blocker set from every character of a string.
     * @param symbols The blocking symbols.
     * @return The blocker set.
     */
    public static BlockerSet of(String symbols) {
        return of(symbols.toCharArray());
    }

    public static BlockerSet none() {
        return new BlockerSet(Set.of());
    }

    public boolean blocks(char symbol) {
        return symbols.contains(symbol);
    }
}
