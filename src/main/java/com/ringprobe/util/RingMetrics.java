package com.ringprobe.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for hash ring operations.
 * Tracks membership changes, lookup outcomes and lookup latency.
 *
 * <p>Counters and the timer are shared by every ring recording into the same
 * registry. The size gauge is tagged with the ring name, so rings sharing a
 * registry need distinct names; a second ring bound under an existing name
 * reuses the first ring's gauge.
 */
public class RingMetrics {

    private final MeterRegistry registry;

    // Counters
    private final Counter adds;
    private final Counter inserts;
    private final Counter removes;
    private final Counter lookupHits;
    private final Counter lookupMisses;

    // Timers
    private final Timer lookupLatency;

    // Gauges
    private volatile Gauge ringSize;

    /**
     * Create a metrics collector with a simple registry.
     */
    public RingMetrics() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public RingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.adds = Counter.builder("ringprobe.membership")
            .tag("operation", "add")
            .description("Nodes added at their hashed position")
            .register(registry);

        this.inserts = Counter.builder("ringprobe.membership")
            .tag("operation", "insert")
            .description("Nodes inserted at an explicit position")
            .register(registry);

        this.removes = Counter.builder("ringprobe.membership")
            .tag("operation", "remove")
            .description("Positions removed from the ring")
            .register(registry);

        this.lookupHits = Counter.builder("ringprobe.lookups")
            .tag("result", "hit")
            .description("Lookups that resolved an owner")
            .register(registry);

        this.lookupMisses = Counter.builder("ringprobe.lookups")
            .tag("result", "miss")
            .description("Lookups against an empty ring")
            .register(registry);

        this.lookupLatency = Timer.builder("ringprobe.lookup.latency")
            .description("Multi-probe owner lookup latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    /**
     * Register the size gauge for a ring, reading the ring's position map on
     * every sample.
     *
     * @param ringName  value of the {@code ring} tag
     * @param positions the ring's live position map
     */
    public void bindRingSize(String ringName, Map<?, ?> positions) {
        this.ringSize = Gauge.builder("ringprobe.ring.size", positions, Map::size)
            .tag("ring", ringName)
            .description("Number of occupied ring positions")
            .register(registry);
    }

    public void recordAdd() {
        adds.increment();
    }

    public void recordInsert() {
        inserts.increment();
    }

    public void recordRemove() {
        removes.increment();
    }

    public void recordLookup(long durationNanos, boolean hit) {
        lookupLatency.record(durationNanos, TimeUnit.NANOSECONDS);
        if (hit) {
            lookupHits.increment();
        } else {
            lookupMisses.increment();
        }
    }

    public long getTotalAdds() {
        return (long) adds.count();
    }

    public long getTotalInserts() {
        return (long) inserts.count();
    }

    public long getTotalRemoves() {
        return (long) removes.count();
    }

    public long getTotalLookups() {
        return (long) (lookupHits.count() + lookupMisses.count());
    }

    public long getLookupMisses() {
        return (long) lookupMisses.count();
    }

    /**
     * Get the size reported by the most recently bound ring, or 0 if none.
     */
    public long getRingSize() {
        Gauge gauge = ringSize;
        return gauge != null ? (long) gauge.value() : 0;
    }

    public double getMeanLookupLatencyMs() {
        return lookupLatency.mean(TimeUnit.MILLISECONDS);
    }

    /**
     * Get the underlying registry.
     *
     * @return the MeterRegistry
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Format a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        return String.format(
            "Ring Metrics Summary%n" +
            "Membership: add=%d, insert=%d, remove=%d%n" +
            "Lookups: total=%d, misses=%d%n" +
            "Ring size: %d%n" +
            "Lookup latency (mean): %.3fms",
            getTotalAdds(), getTotalInserts(), getTotalRemoves(),
            getTotalLookups(), getLookupMisses(),
            getRingSize(),
            getMeanLookupLatencyMs()
        );
    }
}
