package com.ringprobe.partition;

import com.ringprobe.util.MurmurHash3;

import java.util.Objects;

/**
 * Default partitioner backed by {@link MurmurHash3}.
 */
public class Murmur3Partitioner implements Partitioner {

    private final KeyEncoder encoder;

    /**
     * Create a partitioner with the standard key encoder.
     */
    public Murmur3Partitioner() {
        this(KeyEncoder.standard());
    }

    /**
     * Create a partitioner with a custom key encoder.
     *
     * @param encoder converts keys to hash input
     */
    public Murmur3Partitioner(KeyEncoder encoder) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
    }

    @Override
    public long position(Object key) {
        return positionSeeded(key, SEED1);
    }

    @Override
    public long positionSeeded(Object key, long seed) {
        Objects.requireNonNull(key, "key");
        return MurmurHash3.hash64(encoder.encode(key), seed);
    }

    public KeyEncoder getEncoder() {
        return encoder;
    }

    @Override
    public String toString() {
        return "Murmur3Partitioner";
    }
}
