package com.ringprobe.cluster;

import java.util.Optional;

/**
 * Half-open range of ring positions, {@code [start, end)}.
 *
 * <p>If {@code start >= end} the range is inverted and covers
 * {@code [start, MAX]} together with {@code [0, end)}. If {@code start == end}
 * the range covers the whole ring. All comparisons are unsigned.
 */
public final class KeyRange {

    private static final KeyRange WHOLE_RING = new KeyRange(RingPosition.MIN, RingPosition.MIN);

    private final long start;
    private final long end;

    /**
     * Create a range.
     *
     * @param start inclusive lower bound
     * @param end   exclusive upper bound
     */
    public KeyRange(long start, long end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Get the canonical whole-ring range, {@code [0, 0)}.
     */
    public static KeyRange wholeRing() {
        return WHOLE_RING;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    /**
     * Check if the range crosses the origin, i.e. is inverted and does not end at 0.
     */
    public boolean isWrapping() {
        return isInverted() && !endsAtOrigin();
    }

    /**
     * Check if {@code start >= end}.
     */
    public boolean isInverted() {
        return RingPosition.compare(start, end) >= 0;
    }

    /**
     * Check if the range ends at position 0.
     * Such a range is inverted but never wraps past the origin.
     */
    public boolean endsAtOrigin() {
        return end == RingPosition.MIN;
    }

    public boolean coversWholeRing() {
        return start == end;
    }

    /**
     * Check if a position falls inside this range.
     *
     * @param position the position to test
     * @return true if contained
     */
    public boolean contains(long position) {
        boolean fromStart = RingPosition.compare(position, start) >= 0;
        boolean beforeEnd = RingPosition.compare(position, end) < 0;
        if (isInverted()) {
            return fromStart || beforeEnd;
        }
        return fromStart && beforeEnd;
    }

    /**
     * Check if this range shares at least one position with another.
     */
    public boolean isOverlapping(KeyRange other) {
        return contains(other.start) || other.contains(start);
    }

    /**
     * Check if one range ends exactly where the other starts, so that
     * {@code [a, b)} and {@code [b, c)} can be joined into {@code [a, c)}.
     * Always false when either range covers the whole ring.
     */
    public boolean isContinuous(KeyRange other) {
        if (coversWholeRing() || other.coversWholeRing()) {
            return false;
        }
        return end == other.start || other.end == start;
    }

    /**
     * Merge this range with another into a single interval.
     *
     * @param other the range to merge with
     * @return the union, or empty if the ranges neither overlap nor touch
     */
    public Optional<KeyRange> merged(KeyRange other) {
        if (coversWholeRing() || other.coversWholeRing()) {
            return Optional.of(WHOLE_RING);
        }
        if (!isOverlapping(other) && !isContinuous(other)) {
            return Optional.empty();
        }

        long mergedStart;
        long mergedEnd;
        if (isInverted() == other.isInverted()) {
            mergedStart = RingPosition.min(start, other.start);
            mergedEnd = RingPosition.max(end, other.end);
        } else {
            KeyRange a = isInverted() ? this : other;
            KeyRange b = isInverted() ? other : this;

            if (RingPosition.compare(a.start, b.end) <= 0) {
                // b touches a from the left
                mergedStart = RingPosition.min(a.start, b.start);
                mergedEnd = a.end;
            } else {
                // b touches a from the right
                mergedStart = a.start;
                mergedEnd = RingPosition.max(a.end, b.end);
            }
        }

        if (mergedStart == mergedEnd) {
            return Optional.of(WHOLE_RING);
        }
        return Optional.of(new KeyRange(mergedStart, mergedEnd));
    }

    /**
     * Get the number of positions in the range.
     * Inverted ranges report {@code MAX - (start - end)}, so the whole ring
     * reports {@code MAX} rather than 2^64.
     *
     * @return range size as an unsigned value
     */
    public long size() {
        if (isInverted()) {
            return RingPosition.MAX - (start - end);
        }
        return end - start;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyRange that = (KeyRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(start) + Long.hashCode(end);
    }

    @Override
    public String toString() {
        return "[" + RingPosition.format(start) + ", " + RingPosition.format(end) + ")";
    }
}
