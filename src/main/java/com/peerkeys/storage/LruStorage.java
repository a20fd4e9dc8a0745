package com.peerkeys.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-memory storage with least-recently-used eviction.
 * Both reads and writes refresh an entry's recency. Nothing survives a restart.
 *
 * @param <V> the value type
 */
public class LruStorage<V> implements Storage<V> {

    private static final Logger logger = LoggerFactory.getLogger(LruStorage.class);
    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final LinkedHashMap<String, V> entries;
    private long evictions;

    /**
     * Create a cache with the default capacity of 1000 entries.
     */
    public LruStorage() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Create a cache holding at most {@code capacity} entries.
     *
     * @param capacity maximum number of entries
     */
    public LruStorage(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, V> eldest) {
                if (size() > LruStorage.this.capacity) {
                    evictions++;
                    logger.trace("Evicting least recently used key={}", eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    @Override
    public synchronized Optional<V> get(String key) {
        validateKey(key);
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized void put(String key, V value) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        entries.put(key, value);
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        logger.debug("LRU cache cleared");
    }

    /**
     * Nothing to release; entries are left for the garbage collector.
     */
    @Override
    public void close() {
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * @return number of entries dropped because the cache was full
     */
    public synchronized long getEvictions() {
        return evictions;
    }

    private void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
    }
}
