package com.ringprobe.cluster;

import com.ringprobe.config.RingConfig;
import com.ringprobe.partition.Partitioner;
import com.ringprobe.util.RingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Multi-probe consistent hash ring.
 *
 * <p>Each node occupies exactly one position on the ring, derived from the
 * node's own value. A key is hashed into several probe positions by double
 * hashing; for each probe the next node clockwise is found, and the probe
 * closest to its node decides the owner. Because a probe's distance to its
 * node does not depend on how wide that node's interval is, owners are picked
 * evenly without virtual nodes.
 *
 * <p>The position map is a {@link ConcurrentSkipListMap} in unsigned order, so
 * membership changes, lookups and traversals may run concurrently without
 * external locking. Traversals are weakly consistent.
 *
 * @param <N> the node type; compared by value
 */
public class HashRing<N extends Comparable<? super N>> {

    private static final Logger logger = LoggerFactory.getLogger(HashRing.class);

    private final String name;
    private final Partitioner partitioner;
    private final int probeCount;
    private final RingMetrics metrics;

    // The hash ring: position -> node, ascending unsigned order
    private final ConcurrentSkipListMap<Long, N> positions;

    /**
     * Create an empty ring with the default configuration.
     */
    public HashRing() {
        this(new RingConfig());
    }

    /**
     * Create an empty ring with a custom partitioner and probe count.
     *
     * @param partitioner maps nodes and keys to positions
     * @param probeCount  number of probes per lookup
     */
    public HashRing(Partitioner partitioner, int probeCount) {
        this(RingConfig.builder().partitioner(partitioner).probeCount(probeCount).build());
    }

    /**
     * Create an empty ring from a configuration.
     *
     * @param config ring configuration
     */
    public HashRing(RingConfig config) {
        this.name = config.getName();
        this.partitioner = config.getPartitioner();
        this.probeCount = config.getProbeCount();
        this.metrics = config.getMetrics() != null ? config.getMetrics() : new RingMetrics();
        this.positions = new ConcurrentSkipListMap<>(RingPosition.ORDER);
        metrics.bindRingSize(name, positions);
        logger.info("Created hash ring {} with {} probes using {}", name, probeCount, partitioner);
    }

    /**
     * Add a node at the position derived from its value.
     * Adding the same node twice leaves the ring unchanged.
     *
     * @param node the node to add
     * @return the previous occupant of that position, if any
     */
    public Optional<N> add(N node) {
        Objects.requireNonNull(node, "node");
        long position = partitioner.position(node);
        N previous = positions.put(position, node);
        metrics.recordAdd();

        if (previous != null && !previous.equals(node)) {
            logger.debug("Node {} replaced {} at position {}", node, previous, RingPosition.format(position));
        } else {
            logger.debug("Added node {} at position {}", node, RingPosition.format(position));
        }
        return Optional.ofNullable(previous);
    }

    /**
     * Place a node at an exact position, bypassing the partitioner.
     * Intended for tests and simulations. An existing occupant is replaced.
     *
     * <p>A node inserted away from its hashed position cannot be removed with
     * {@link #remove(Comparable)}, which only looks at the hashed position.
     *
     * @param position the ring position
     * @param node     the node to place
     * @return the previous occupant, if any
     */
    public Optional<N> insert(long position, N node) {
        Objects.requireNonNull(node, "node");
        N previous = positions.put(position, node);
        metrics.recordInsert();
        logger.debug("Inserted node {} at position {}", node, RingPosition.format(position));
        return Optional.ofNullable(previous);
    }

    /**
     * Remove the entry at the node's hashed position.
     *
     * @param node the node to remove
     * @return the removed occupant, or empty if the position was free
     */
    public Optional<N> remove(N node) {
        Objects.requireNonNull(node, "node");
        long position = partitioner.position(node);
        N removed = positions.remove(position);
        if (removed == null) {
            logger.debug("Node {} not in ring", node);
            return Optional.empty();
        }

        metrics.recordRemove();
        logger.debug("Removed node {} from position {}", removed, RingPosition.format(position));
        return Optional.of(removed);
    }

    /**
     * Get the node that owns a key.
     *
     * @param key the key to look up
     * @return the owner, or empty if the ring is empty
     */
    public Optional<N> primaryNode(Object key) {
        return primaryToken(key).map(RingToken::getNode);
    }

    /**
     * Get the token that owns a key.
     *
     * <p>The key is hashed into {@code probeCount} probes. For each probe the
     * first token at or after it (wrapping) is found and the clockwise distance
     * to it measured. The token with the smallest distance wins; on ties the
     * earliest probe wins.
     *
     * @param key the key to look up
     * @return the owning token, or empty if the ring is empty
     */
    public Optional<RingToken<N>> primaryToken(Object key) {
        long startNanos = System.nanoTime();
        Map.Entry<Long, N> best = null;
        long bestDistance = RingPosition.MAX;

        for (long probe : partitioner.positions(key, probeCount)) {
            Map.Entry<Long, N> owner = positions.ceilingEntry(probe);

            // Wrap around if we've passed the highest position
            if (owner == null) {
                owner = positions.firstEntry();
            }
            if (owner == null) {
                best = null;
                break;
            }

            long distance = RingPosition.distance(probe, owner.getKey());
            if (best == null || RingPosition.compare(distance, bestDistance) < 0) {
                best = owner;
                bestDistance = distance;
            }
        }

        metrics.recordLookup(System.nanoTime() - startNanos, best != null);
        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(new RingToken<>(best.getKey(), best.getValue()));
    }

    /**
     * Get up to {@code count} distinct nodes for a key, starting with the
     * primary owner and walking clockwise.
     *
     * @param key   the key to look up
     * @param count number of nodes wanted
     * @return distinct nodes in ring order; fewer if the ring holds fewer
     * @throws IllegalArgumentException if count is negative
     */
    public List<N> replicas(Object key, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got: " + count);
        }
        if (count == 0) {
            return Collections.emptyList();
        }

        Optional<RingToken<N>> primary = primaryToken(key);
        if (primary.isEmpty()) {
            return Collections.emptyList();
        }

        List<N> result = new ArrayList<>();
        Set<N> seen = new HashSet<>();
        for (RingToken<N> token : tokens(primary.get().getPosition(), RingDirection.CLOCKWISE)) {
            N node = token.getNode();
            if (seen.add(node)) {
                result.add(node);
                if (result.size() >= count) {
                    break;
                }
            }
        }
        return result;
    }

    /**
     * Get the ring tokens starting at a position.
     *
     * <p>Clockwise: tokens at or after {@code start} ascending, then tokens
     * before it ascending. Counter-clockwise: tokens at or before
     * {@code start} descending, then tokens after it descending. Each token
     * appears once.
     *
     * @param start     the starting position
     * @param direction direction of travel
     * @return a reusable lazy sequence of tokens
     */
    public TokenSequence<N> tokens(long start, RingDirection direction) {
        Objects.requireNonNull(direction, "direction");
        return new TokenSequence<>(positions, start, direction);
    }

    /**
     * Get the key range a node at {@code position} would own.
     *
     * <p>The range ends at {@code position} and starts at the nearest token
     * before it, wrapping. If no other position is occupied and
     * {@code position} itself is, the range starts at 0.
     *
     * @param position the owner position
     * @return the owned range, or empty if the ring is empty
     */
    public Optional<KeyRange> keyRange(long position) {
        Optional<RingToken<N>> previous = tokens(position, RingDirection.CLOCKWISE).last();
        if (previous.isEmpty()) {
            return Optional.empty();
        }

        long start = previous.get().getPosition();
        if (start == position) {
            start = RingPosition.MIN;
        }
        return Optional.of(new KeyRange(start, position));
    }

    /**
     * Get the key ranges owned by a node.
     * Without virtual nodes a node owns a single contiguous range.
     *
     * @param node the node to check
     * @return the node's ranges, or an empty list if it is not on the ring
     */
    public List<KeyRange> intervals(N node) {
        if (!containsNode(node)) {
            return Collections.emptyList();
        }
        return keyRange(partitioner.position(node))
            .map(Collections::singletonList)
            .orElse(Collections.emptyList());
    }

    /**
     * Get the ring position of a key (or node) under the default seed.
     */
    public long position(Object key) {
        return partitioner.position(key);
    }

    /**
     * Check if a node sits at its hashed position.
     */
    public boolean containsNode(N node) {
        Objects.requireNonNull(node, "node");
        return node.equals(positions.get(partitioner.position(node)));
    }

    /**
     * Get the distinct nodes on the ring in ascending position order.
     */
    public List<N> nodes() {
        return new ArrayList<>(new LinkedHashSet<>(positions.values()));
    }

    /**
     * Get the number of occupied positions.
     */
    public int size() {
        return positions.size();
    }

    /**
     * Check if the ring is empty.
     */
    public boolean isEmpty() {
        return positions.isEmpty();
    }

    public String getName() {
        return name;
    }

    public int probeCount() {
        return probeCount;
    }

    public Partitioner getPartitioner() {
        return partitioner;
    }

    public RingMetrics getMetrics() {
        return metrics;
    }

    /**
     * Remove all nodes from the ring.
     */
    public void clear() {
        positions.clear();
        logger.info("Cleared hash ring");
    }

    /**
     * Calculate the fraction of the ring each node owns, from the sizes of the
     * key ranges ending at its positions.
     *
     * @return node to owned fraction, in ascending position order
     */
    public Map<N, Double> ownership() {
        Map<N, Double> shares = new LinkedHashMap<>();
        List<Map.Entry<Long, N>> entries = new ArrayList<>(positions.entrySet());

        if (entries.size() == 1) {
            shares.put(entries.get(0).getValue(), 1.0);
            return shares;
        }

        double ringSize = RingPosition.toDouble(RingPosition.MAX);
        for (Map.Entry<Long, N> entry : entries) {
            keyRange(entry.getKey()).ifPresent(range ->
                shares.merge(entry.getValue(), RingPosition.toDouble(range.size()) / ringSize, Double::sum));
        }
        return shares;
    }

    /**
     * Get statistics about the hash ring.
     */
    public String summary() {
        Map<N, Double> shares = ownership();
        StringBuilder sb = new StringBuilder();
        sb.append("HashRing Stats:\n");
        sb.append("  Positions: ").append(size()).append("\n");
        sb.append("  Nodes: ").append(shares.size()).append("\n");
        sb.append("  Probes: ").append(probeCount).append("\n");
        sb.append("  Ownership:\n");
        for (Map.Entry<N, Double> entry : shares.entrySet()) {
            sb.append("    ").append(entry.getKey())
              .append(": ").append(String.format("%.2f%%", entry.getValue() * 100))
              .append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "HashRing{" +
               "name=" + name +
               ", positions=" + positions.size() +
               ", probeCount=" + probeCount +
               ", partitioner=" + partitioner +
               '}';
    }
}
