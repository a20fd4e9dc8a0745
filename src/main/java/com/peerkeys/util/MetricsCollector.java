package com.peerkeys.util;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for the key store.
 * Tracks key operations, storage cache effectiveness, hidden storage faults and
 * how many signature checks were answered from the verification cache.
 */
public class MetricsCollector {

    private final MeterRegistry registry;

    // Counters
    private final Counter createOps;
    private final Counter getOps;
    private final Counter hasOps;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter storageFaults;
    private final Counter verifyCached;
    private final Counter verifyCrypto;
    private final Counter verifyFailed;

    // Timers
    private final Timer createLatency;
    private final Timer getLatency;
    private final Timer verifyLatency;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;

        this.createOps = Counter.builder("peerkeys.ops")
            .tag("operation", "create")
            .description("Total key creations")
            .register(registry);

        this.getOps = Counter.builder("peerkeys.ops")
            .tag("operation", "get")
            .description("Total key lookups")
            .register(registry);

        this.hasOps = Counter.builder("peerkeys.ops")
            .tag("operation", "has")
            .description("Total key existence checks")
            .register(registry);

        this.cacheHits = Counter.builder("peerkeys.storage.cache")
            .tag("result", "hit")
            .description("Storage cache hits")
            .register(registry);

        this.cacheMisses = Counter.builder("peerkeys.storage.cache")
            .tag("result", "miss")
            .description("Storage cache misses")
            .register(registry);

        this.storageFaults = Counter.builder("peerkeys.storage.faults")
            .description("Storage failures reported to callers as a missing key")
            .register(registry);

        this.verifyCached = Counter.builder("peerkeys.verify")
            .tag("path", "cached")
            .description("Verifications answered from the verification cache")
            .register(registry);

        this.verifyCrypto = Counter.builder("peerkeys.verify")
            .tag("path", "crypto")
            .description("Verifications that ran the elliptic-curve check")
            .register(registry);

        this.verifyFailed = Counter.builder("peerkeys.verify.failed")
            .description("Verifications that returned false")
            .register(registry);

        this.createLatency = Timer.builder("peerkeys.latency")
            .tag("operation", "create")
            .description("Key creation latency")
            .register(registry);

        this.getLatency = Timer.builder("peerkeys.latency")
            .tag("operation", "get")
            .description("Key lookup latency")
            .register(registry);

        this.verifyLatency = Timer.builder("peerkeys.latency")
            .tag("operation", "verify")
            .description("Cached verification latency")
            .register(registry);
    }

    // Key operations

    public void recordCreate(long durationNanos) {
        createOps.increment();
        createLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordGet(long durationNanos) {
        getOps.increment();
        getLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordHas() {
        hasOps.increment();
    }

    // Storage

    public void recordCacheLookup(boolean hit) {
        if (hit) {
            cacheHits.increment();
        } else {
            cacheMisses.increment();
        }
    }

    public void recordStorageFault() {
        storageFaults.increment();
    }

    // Verification

    public void recordVerification(long durationNanos, boolean cached, boolean verified) {
        if (cached) {
            verifyCached.increment();
        } else {
            verifyCrypto.increment();
        }
        if (!verified) {
            verifyFailed.increment();
        }
        verifyLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    // Getters for metrics values

    public long getTotalCreateOps() {
        return (long) createOps.count();
    }

    public long getTotalGetOps() {
        return (long) getOps.count();
    }

    public long getTotalHasOps() {
        return (long) hasOps.count();
    }

    public long getStorageFaults() {
        return (long) storageFaults.count();
    }

    public long getCachedVerifications() {
        return (long) verifyCached.count();
    }

    public long getCryptoVerifications() {
        return (long) verifyCrypto.count();
    }

    public long getFailedVerifications() {
        return (long) verifyFailed.count();
    }

    public double getCacheHitRate() {
        double hits = cacheHits.count();
        double misses = cacheMisses.count();
        double total = hits + misses;
        return total > 0 ? hits / total : 0.0;
    }

    public double getVerifyMeanLatencyMs() {
        return verifyLatency.mean(TimeUnit.MILLISECONDS);
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
     * Print a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        return String.format(
            "PeerKeys Metrics Summary%n" +
            "========================%n" +
            "Keys: CREATE=%d, GET=%d, HAS=%d%n" +
            "Storage cache: hits=%d, misses=%d, hitRate=%.2f%%%n" +
            "Storage faults: %d%n" +
            "Verify: cached=%d, crypto=%d, failed=%d, mean=%.3fms",
            getTotalCreateOps(), getTotalGetOps(), getTotalHasOps(),
            (long) cacheHits.count(), (long) cacheMisses.count(), getCacheHitRate() * 100,
            getStorageFaults(),
            getCachedVerifications(), getCryptoVerifications(), getFailedVerifications(),
            getVerifyMeanLatencyMs()
        );
    }
}
