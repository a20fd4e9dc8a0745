package com.peerkeys.storage;

import java.io.Closeable;
import java.util.Optional;

/**
 * Key-value storage contract shared by the cache tier, the persistent tier and
 * their composition. All implementations must be thread-safe.
 *
 * @param <V> the value type
 */
public interface Storage<V> extends Closeable {

    /**
     * Retrieve the value for a given key.
     *
     * @param key the key to look up
     * @return the value if present, empty if the key is not stored
     * @throws StorageException if the underlying medium cannot be read
     */
    Optional<V> get(String key);

    /**
     * Store a value, replacing any previous value for the key.
     *
     * @param key   the key to store
     * @param value the value to store
     * @throws StorageException if the value cannot be written
     */
    void put(String key, V value);

    /**
     * Remove every entry.
     *
     * @throws StorageException if the underlying medium cannot be cleared
     */
    void clear();

    /**
     * Release any resources held by this storage. No other operation is valid afterwards.
     */
    @Override
    void close();
}
