package org.gridrealm.runtime.spi;

/**
 * Seeded source of randomness for world generation.
 * <p>
 * Two providers built from the same seed return the same sequence. Independent consumers, such
 * as the generators of different levels, should draw from {@link #deriveFor derived} providers
 * rather than share one stream.
 */
public interface IRandomProvider {

    /**
     * Draws an integer in {@code [0, bound)}.
     * @param bound exclusive upper bound, positive
     * @return the drawn value
     */
    int nextInt(int bound);

    /**
     * Draws a double in {@code [0.0, 1.0)}.
     * @return the drawn value
     */
    double nextDouble();

    /**
     * Creates a provider whose sequence depends only on this provider's seed and the given scope
     * and key.
     * @param scope a stable name for the kind of consumer, e.g. {@code "level"}
     * @param key a stable index within the scope
     * @return the derived provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
