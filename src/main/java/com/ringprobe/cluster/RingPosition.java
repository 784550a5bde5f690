package com.ringprobe.cluster;

import java.util.Comparator;

/**
 * Helpers for ring positions.
 * A position is an unsigned 64-bit value held in a {@code long}; the ring has
 * 2^64 positions and wraps from {@link #MAX} back to {@link #MIN}.
 */
public final class RingPosition {

    public static final long MIN = 0L;

    /**
     * Largest position, 2^64 - 1 (all bits set).
     */
    public static final long MAX = 0xFFFFFFFFFFFFFFFFL;

    /**
     * Unsigned ascending order of positions.
     */
    public static final Comparator<Long> ORDER = Long::compareUnsigned;

    private RingPosition() {
        // Utility class
    }

    public static int compare(long a, long b) {
        return Long.compareUnsigned(a, b);
    }

    public static long min(long a, long b) {
        return compare(a, b) <= 0 ? a : b;
    }

    public static long max(long a, long b) {
        return compare(a, b) >= 0 ? a : b;
    }

    /**
     * Clockwise distance from one position to another.
     * When the path wraps the result is {@code MAX - from + to}, one less than
     * the modular distance.
     *
     * @param from starting position
     * @param to   target position
     * @return distance moving clockwise
     */
    public static long distance(long from, long to) {
        if (compare(from, to) > 0) {
            return MAX - from + to;
        }
        return to - from;
    }

    /**
     * Convert a position to its unsigned value as a double.
     */
    public static double toDouble(long position) {
        double value = (double) (position >>> 1) * 2.0;
        return value + (position & 1L);
    }

    /**
     * Format a position as zero-padded unsigned hex.
     */
    public static String format(long position) {
        return String.format("0x%016x", position);
    }
}
