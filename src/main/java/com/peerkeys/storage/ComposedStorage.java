package com.peerkeys.storage;

import com.peerkeys.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Presents a volatile cache tier over a durable persistent tier as one storage.
 * <p>
 * Reads are served from the cache when possible and otherwise read through to the
 * persistent tier, populating the cache. Writes go to the persistent tier first and only
 * then to the cache, so the cache never holds a value that is not yet durable. A read-through
 * only populates the cache if no write or clear completed while it was reading, so a slow
 * reader cannot put a replaced value back into the cache.
 * <p>
 * Values pass through a copy function on their way into and out of the cache; use
 * {@link #ofBytes} for mutable byte array values.
 *
 * @param <V> the value type
 */
public class ComposedStorage<V> implements Storage<V> {

    private static final Logger logger = LoggerFactory.getLogger(ComposedStorage.class);

    private final Storage<V> cache;
    private final Storage<V> persistent;
    private final MetricsCollector metrics;
    private final UnaryOperator<V> copier;
    private final Object writeLock = new Object();
    private long writeGeneration;

    public ComposedStorage(Storage<V> cache, Storage<V> persistent) {
        this(cache, persistent, new MetricsCollector());
    }

    public ComposedStorage(Storage<V> cache, Storage<V> persistent, MetricsCollector metrics) {
        this(cache, persistent, metrics, UnaryOperator.identity());
    }

    /**
     * Compose byte array tiers, copying values so callers never share the cached arrays.
     */
    public static ComposedStorage<byte[]> ofBytes(Storage<byte[]> cache, Storage<byte[]> persistent,
                                                  MetricsCollector metrics) {
        return new ComposedStorage<>(cache, persistent, metrics, value -> Arrays.copyOf(value, value.length));
    }

    /**
     * @param cache      the fast, volatile tier
     * @param persistent the durable tier holding the ground truth
     * @param metrics    receives cache hit/miss counts
     * @param copier     copies values entering and leaving the cache
     */
    public ComposedStorage(Storage<V> cache, Storage<V> persistent, MetricsCollector metrics,
                           UnaryOperator<V> copier) {
        if (cache == null || persistent == null) {
            throw new IllegalArgumentException("Both storage tiers are required");
        }
        if (copier == null) {
            throw new IllegalArgumentException("copier cannot be null");
        }
        this.copier = copier;
        this.cache = cache;
        this.persistent = persistent;
        this.metrics = metrics != null ? metrics : new MetricsCollector();
    }

    @Override
    public Optional<V> get(String key) {
        Optional<V> cached = cache.get(key);
        metrics.recordCacheLookup(cached.isPresent());
        if (cached.isPresent()) {
            logger.trace("GET key={} -> CACHE_HIT", key);
            return cached.map(copier);
        }
        long generation;
        synchronized (writeLock) {
            generation = writeGeneration;
        }
        Optional<V> stored = persistent.get(key);
        if (stored.isPresent()) {
            synchronized (writeLock) {
                if (generation == writeGeneration) {
                    cache.put(key, copier.apply(stored.get()));
                } else {
                    logger.trace("GET key={} -> skipping cache fill, written concurrently", key);
                }
            }
        }
        logger.trace("GET key={} -> {}", key, stored.isPresent() ? "PERSISTENT_HIT" : "NOT_FOUND");
        return stored;
    }

    @Override
    public void put(String key, V value) {
        synchronized (writeLock) {
            persistent.put(key, value);
            writeGeneration++;
            cache.put(key, copier.apply(value));
        }
    }

    @Override
    public void clear() {
        synchronized (writeLock) {
            persistent.clear();
            writeGeneration++;
            cache.clear();
        }
    }

    @Override
    public void close() {
        try {
            persistent.close();
        } finally {
            cache.close();
        }
    }

    public Storage<V> getCache() {
        return cache;
    }

    public Storage<V> getPersistent() {
        return persistent;
    }
}
