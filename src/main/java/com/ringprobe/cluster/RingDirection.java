package com.ringprobe.cluster;

/**
 * Direction of travel around the ring.
 */
public enum RingDirection {
    CLOCKWISE,          // Ascending positions, wrapping MAX -> 0
    COUNTER_CLOCKWISE   // Descending positions, wrapping 0 -> MAX
}
