package org.gridrealm.runtime.worldgen;

import org.gridrealm.runtime.spi.IRandomProvider;

import java.util.Map;

/**
 * A functional interface for creating grid generators from configuration parameters.
 */
@FunctionalInterface
public interface IGridGeneratorCreator {
    /**
     * Creates a new grid generator.
     * @param params The parameters for the generator.
     * @param randomProvider The random source the generator draws from.
     * @return The created generator.
     */
    IGridGenerator create(Map<String, Object> params, IRandomProvider randomProvider);
}
