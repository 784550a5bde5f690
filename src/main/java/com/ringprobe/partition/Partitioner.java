package com.ringprobe.partition;

/**
 * A keyspace partitioning strategy.
 * Maps arbitrary keys to positions on the ring. Positions are unsigned 64-bit
 * values carried in a {@code long}.
 *
 * <p>Implementations must be deterministic: the same key and seed always yield
 * the same position for a given partitioner configuration.
 */
public interface Partitioner {

    /**
     * Seed for the default position and the first probe hash.
     */
    long SEED1 = 12345L;

    /**
     * Seed for the probe step hash.
     */
    long SEED2 = 67890L;

    /**
     * Get the ring position of a key under the default seed.
     *
     * @param key the key to hash
     * @return the ring position
     */
    long position(Object key);

    /**
     * Get the ring position of a key under the given seed.
     * Different seeds give independent positions for the same key.
     *
     * @param key  the key to hash
     * @param seed the seed value
     * @return the ring position
     */
    long positionSeeded(Object key, long seed);

    /**
     * Get the probe sequence for a key using double hashing:
     * {@code p[i] = h1 + i * h2} with wraparound arithmetic, where
     * {@code h1} and {@code h2} are the key hashed under {@link #SEED1} and
     * {@link #SEED2}.
     *
     * @param key   the key to hash
     * @param count number of probes to produce
     * @return probe positions in generation order
     * @throws IllegalArgumentException if count is negative
     */
    default long[] positions(Object key, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got: " + count);
        }
        long h1 = positionSeeded(key, SEED1);
        long h2 = positionSeeded(key, SEED2);

        long[] probes = new long[count];
        for (int i = 0; i < count; i++) {
            probes[i] = h1 + i * h2;
        }
        return probes;
    }
}
