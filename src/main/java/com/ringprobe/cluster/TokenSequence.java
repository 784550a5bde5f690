package com.ringprobe.cluster;

import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy traversal of ring tokens from a start position in one direction,
 * wrapping once around the ring.
 *
 * <p>The sequence is two views of the ring map chained together: the part
 * reached before crossing the origin and the part reached after it. Both ends
 * are available without walking the whole sequence, and the sequence can be
 * iterated any number of times. Views over a concurrent map are weakly
 * consistent and reflect the ring at iteration time.
 *
 * @param <N> the node type
 */
public final class TokenSequence<N> implements Iterable<RingToken<N>> {

    private final NavigableMap<Long, N> leading;
    private final NavigableMap<Long, N> trailing;

    TokenSequence(NavigableMap<Long, N> positions, long start, RingDirection direction) {
        if (direction == RingDirection.CLOCKWISE) {
            this.leading = positions.tailMap(start, true);
            this.trailing = positions.headMap(start, false);
        } else {
            this.leading = positions.headMap(start, true).descendingMap();
            this.trailing = positions.tailMap(start, false).descendingMap();
        }
    }

    /**
     * Get the first token in traversal order.
     */
    public Optional<RingToken<N>> first() {
        Map.Entry<Long, N> entry = leading.firstEntry();
        if (entry == null) {
            entry = trailing.firstEntry();
        }
        return toToken(entry);
    }

    /**
     * Get the last token in traversal order.
     * For a clockwise sequence this is the nearest token before the start.
     */
    public Optional<RingToken<N>> last() {
        Map.Entry<Long, N> entry = trailing.lastEntry();
        if (entry == null) {
            entry = leading.lastEntry();
        }
        return toToken(entry);
    }

    @Override
    public Iterator<RingToken<N>> iterator() {
        return new ChainedIterator<>(leading, trailing);
    }

    /**
     * Iterate the sequence from its last token back to its first.
     */
    public Iterator<RingToken<N>> reverseIterator() {
        return new ChainedIterator<>(trailing.descendingMap(), leading.descendingMap());
    }

    public Stream<RingToken<N>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    private static <N> Optional<RingToken<N>> toToken(Map.Entry<Long, N> entry) {
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new RingToken<>(entry.getKey(), entry.getValue()));
    }

    private static final class ChainedIterator<N> implements Iterator<RingToken<N>> {

        private final Iterator<Map.Entry<Long, N>> head;
        private final Iterator<Map.Entry<Long, N>> tail;

        ChainedIterator(NavigableMap<Long, N> first, NavigableMap<Long, N> second) {
            this.head = first.entrySet().iterator();
            this.tail = second.entrySet().iterator();
        }

        @Override
        public boolean hasNext() {
            return head.hasNext() || tail.hasNext();
        }

        @Override
        public RingToken<N> next() {
            Map.Entry<Long, N> entry;
            if (head.hasNext()) {
                entry = head.next();
            } else if (tail.hasNext()) {
                entry = tail.next();
            } else {
                throw new NoSuchElementException();
            }
            return new RingToken<>(entry.getKey(), entry.getValue());
        }
    }
}
