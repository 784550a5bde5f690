package com.ringprobe.partition;

/**
 * A key or node that supplies its own canonical bytes for hashing.
 */
public interface RingKey {

    /**
     * Get the bytes used to place this object on the ring.
     * Equal objects must return equal bytes.
     *
     * @return the canonical hash bytes
     */
    byte[] ringKey();
}
