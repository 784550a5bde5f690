package com.ringprobe.cluster;

import java.util.Objects;

/**
 * A ring entry: a position together with the node that owns it.
 * Tokens order and compare by position only.
 *
 * @param <N> the node type
 */
public final class RingToken<N> implements Comparable<RingToken<N>> {

    private final long position;
    private final N node;

    public RingToken(long position, N node) {
        this.position = position;
        this.node = Objects.requireNonNull(node, "node");
    }

    public long getPosition() {
        return position;
    }

    public N getNode() {
        return node;
    }

    /**
     * Check if this token belongs to the given node (by value).
     */
    public boolean isOwnedBy(N candidate) {
        return node.equals(candidate);
    }

    @Override
    public int compareTo(RingToken<N> other) {
        return RingPosition.compare(position, other.position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RingToken<?> that = (RingToken<?>) o;
        return position == that.position;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(position);
    }

    @Override
    public String toString() {
        return "RingToken{" +
               "position=" + RingPosition.format(position) +
               ", node=" + node +
               '}';
    }
}
