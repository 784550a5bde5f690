package com.ringprobe.config;

import com.ringprobe.partition.Murmur3Partitioner;
import com.ringprobe.partition.Partitioner;
import com.ringprobe.util.RingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Configuration for a hash ring.
 */
public class RingConfig {

    private static final Logger logger = LoggerFactory.getLogger(RingConfig.class);

    /**
     * Number of probes per lookup. The probe with the smallest distance to the
     * next node on the ring decides the owner.
     */
    public static final int DEFAULT_PROBE_COUNT = 23;

    /**
     * Ring name used as the {@code ring} tag on per-ring metrics.
     */
    public static final String DEFAULT_NAME = "default";

    static final String PROBE_COUNT_ENV = "RINGPROBE_PROBE_COUNT";
    static final String PROBE_COUNT_PROPERTY = "ringprobe.probe.count";

    private String name = DEFAULT_NAME;
    private int probeCount = DEFAULT_PROBE_COUNT;
    private Partitioner partitioner = new Murmur3Partitioner();
    private RingMetrics metrics = null;

    public RingConfig() {
        this.probeCount = readProbeCount();
    }

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    /**
     * Set the ring name. Rings that share a metrics registry need distinct names.
     */
    public void setName(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        this.name = name;
    }

    public int getProbeCount() {
        return probeCount;
    }

    public void setProbeCount(int probeCount) {
        if (probeCount <= 0) {
            throw new IllegalArgumentException("probeCount must be positive, got: " + probeCount);
        }
        this.probeCount = probeCount;
    }

    public Partitioner getPartitioner() {
        return partitioner;
    }

    public void setPartitioner(Partitioner partitioner) {
        this.partitioner = Objects.requireNonNull(partitioner, "partitioner");
    }

    /**
     * Get the metrics collector, or null to let each ring create its own.
     */
    public RingMetrics getMetrics() {
        return metrics;
    }

    public void setMetrics(RingMetrics metrics) {
        this.metrics = metrics;
    }

    private static int readProbeCount() {
        String value = System.getenv(PROBE_COUNT_ENV);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(PROBE_COUNT_PROPERTY);
        }
        if (value == null || value.isEmpty()) {
            return DEFAULT_PROBE_COUNT;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid probe count {}, using default {}", value, DEFAULT_PROBE_COUNT);
            return DEFAULT_PROBE_COUNT;
        }
        if (parsed <= 0) {
            logger.warn("Probe count must be positive, got {}, using default {}", parsed, DEFAULT_PROBE_COUNT);
            return DEFAULT_PROBE_COUNT;
        }
        return parsed;
    }

    @Override
    public String toString() {
        return "RingConfig{" +
               "name=" + name +
               ", probeCount=" + probeCount +
               ", partitioner=" + partitioner +
               '}';
    }

    /**
     * Builder for RingConfig.
     */
    public static class Builder {
        private final RingConfig config = new RingConfig();

        public Builder name(String name) {
            config.setName(name);
            return this;
        }

        public Builder probeCount(int count) {
            config.setProbeCount(count);
            return this;
        }

        public Builder partitioner(Partitioner partitioner) {
            config.setPartitioner(partitioner);
            return this;
        }

        public Builder metrics(RingMetrics metrics) {
            config.setMetrics(metrics);
            return this;
        }

        public RingConfig build() {
            return config;
        }
    }
}
