package com.peerkeys;

import com.peerkeys.config.KeyStoreConfig;
import com.peerkeys.crypto.IdentityKeyPair;
import com.peerkeys.crypto.PublicKeyFormat;
import com.peerkeys.storage.ComposedStorage;
import com.peerkeys.storage.LogStorage;
import com.peerkeys.storage.LruStorage;
import com.peerkeys.storage.Storage;
import com.peerkeys.storage.StorageException;
import com.peerkeys.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Creates, persists and looks up secp256k1 identity key pairs by identifier.
 * <p>
 * Only the private key is stored, under {@code "private_" + id}; the public key is derived
 * again on every load. Unless a storage is supplied, keys live in a {@link ComposedStorage}
 * of an {@link LruStorage} over a {@link LogStorage} rooted at the configured path.
 * <p>
 * Lookups report storage faults as a missing key so callers only see found/absent, but every
 * fault is logged and counted in {@link MetricsCollector#getStorageFaults()}.
 * <p>
 * Concurrent {@link #createKey(String)} calls for the same id are last-writer-wins.
 */
public class PeerKeyStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PeerKeyStore.class);

    static final String PRIVATE_KEY_PREFIX = "private_";

    private final Storage<byte[]> storage;
    private final Path path;
    private final MetricsCollector metrics;
    private final SecureRandom random;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Open a key store with default configuration.
     */
    public PeerKeyStore() {
        this(new KeyStoreConfig());
    }

    /**
     * Open a key store.
     *
     * @param config the configuration; its storage, if set, is used instead of the default tiers
     * @throws StorageException if the default persistent tier cannot be opened
     */
    public PeerKeyStore(KeyStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.metrics = config.getMetrics() != null ? config.getMetrics() : new MetricsCollector();
        this.path = config.getPath();
        this.random = new SecureRandom();
        if (config.getStorage() != null) {
            this.storage = config.getStorage();
            logger.info("Key store opened with supplied storage {}", storage.getClass().getSimpleName());
        } else {
            LogStorage persistent = new LogStorage(path, config.isWalFsync(), config.getWalMaxBytes());
            this.storage = ComposedStorage.ofBytes(new LruStorage<>(config.getCacheSize()), persistent, metrics);
            logger.info("Key store opened at {} (cacheSize={})", path.toAbsolutePath(), config.getCacheSize());
        }
    }

    /**
     * Generate and store a new key pair for {@code id}, replacing any existing one.
     *
     * @param id the key owner
     * @return the new key pair
     * @throws IllegalArgumentException if id is null or empty
     * @throws StorageException if the key cannot be persisted
     */
    public IdentityKeyPair createKey(String id) {
        return createKey(id, null);
    }

    /**
     * Generate and store a new key pair for {@code id} from the given entropy source.
     *
     * @param id      the key owner
     * @param entropy entropy for key generation; null uses the store's own source
     * @return the new key pair
     */
    public IdentityKeyPair createKey(String id, SecureRandom entropy) {
        requireId(id, "id needed to create a key");
        ensureOpen();
        long start = System.nanoTime();

        IdentityKeyPair keys = IdentityKeyPair.generate(entropy != null ? entropy : random);
        storage.put(PRIVATE_KEY_PREFIX + id, keys.marshal());

        metrics.recordCreate(System.nanoTime() - start);
        logger.debug("Created key for id={} publicKey={}", id, keys.getPublicKeyHex());
        return keys;
    }

    /**
     * Store an existing key pair under {@code id}, replacing any existing one.
     *
     * @throws IllegalArgumentException if id or keys is missing
     */
    public void addKey(String id, IdentityKeyPair keys) {
        requireId(id, "id needed to add a key");
        if (keys == null) {
            throw new IllegalArgumentException("key pair needed to add a key");
        }
        ensureOpen();
        storage.put(PRIVATE_KEY_PREFIX + id, keys.marshal());
        logger.debug("Added key for id={}", id);
    }

    /**
     * Look up the key pair for {@code id}.
     *
     * @return the key pair, or empty if none is stored or it could not be read
     * @throws IllegalArgumentException if id is null or empty
     */
    public Optional<IdentityKeyPair> getKey(String id) {
        requireId(id, "id needed to get a key");
        ensureOpen();
        long start = System.nanoTime();
        KeyLookup lookup = lookup(id);
        metrics.recordGet(System.nanoTime() - start);
        return Optional.ofNullable(lookup.keys);
    }

    /**
     * @return true if a key pair is stored for {@code id}; false if none is, or if it could not be read
     * @throws IllegalArgumentException if id is null or empty
     */
    public boolean hasKey(String id) {
        requireId(id, "id needed to check a key");
        ensureOpen();
        metrics.recordHas();
        return lookup(id).status == LookupStatus.FOUND;
    }

    /**
     * @return the public key of {@code keys} as lowercase hex
     */
    public String getPublicKey(IdentityKeyPair keys) {
        return getPublicKey(keys, PublicKeyFormat.HEX);
    }

    /**
     * Serialise the public key of {@code keys}.
     *
     * @throws IllegalArgumentException if keys or format is missing
     */
    public <T> T getPublicKey(IdentityKeyPair keys, PublicKeyFormat<T> format) {
        if (keys == null) {
            throw new IllegalArgumentException("key pair needed to get a public key");
        }
        if (format == null) {
            throw new IllegalArgumentException("Supported formats are `hex` and `buffer`");
        }
        return format.encode(keys.getPublicKey());
    }

    /**
     * Serialise the public key of {@code keys} in the format named {@code format}
     * ({@code "hex"} or {@code "buffer"}; null means hex).
     *
     * @return a String for hex, a byte[] for buffer
     * @throws IllegalArgumentException for a missing key pair or an unsupported format
     */
    public Object getPublicKey(IdentityKeyPair keys, String format) {
        PublicKeyFormat<?> resolved = PublicKeyFormat.named(format);
        return getPublicKey(keys, resolved);
    }

    /**
     * Remove every stored key from both tiers. Irreversible.
     */
    public void clear() {
        ensureOpen();
        storage.clear();
        logger.info("Key store cleared");
    }

    /**
     * Release the storage. Later calls other than close fail with IllegalStateException.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        storage.close();
        logger.info("Key store closed");
    }

    /**
     * @return the directory of the default persistent tier
     */
    public Path getPath() {
        return path;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    private KeyLookup lookup(String id) {
        String key = PRIVATE_KEY_PREFIX + id;
        Optional<byte[]> stored;
        try {
            stored = storage.get(key);
        } catch (StorageException e) {
            return fault(id, "storage read failed", e);
        }
        if (stored.isEmpty()) {
            logger.trace("No key for id={}", id);
            return KeyLookup.NOT_FOUND;
        }
        try {
            return new KeyLookup(LookupStatus.FOUND, IdentityKeyPair.fromPrivateKey(stored.get()));
        } catch (IllegalArgumentException e) {
            return fault(id, "stored record is not a valid private key", e);
        }
    }

    private KeyLookup fault(String id, String reason, Exception cause) {
        metrics.recordStorageFault();
        logger.warn("Reporting key for id={} as absent: {}", id, reason, cause);
        return KeyLookup.FAULT;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Key store is closed");
        }
    }

    private static void requireId(String id, String message) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException(message);
        }
    }

    private enum LookupStatus {
        FOUND,
        NOT_FOUND,
        FAULT
    }

    private static final class KeyLookup {
        static final KeyLookup NOT_FOUND = new KeyLookup(LookupStatus.NOT_FOUND, null);
        static final KeyLookup FAULT = new KeyLookup(LookupStatus.FAULT, null);

        final LookupStatus status;
        final IdentityKeyPair keys;

        KeyLookup(LookupStatus status, IdentityKeyPair keys) {
            this.status = status;
            this.keys = keys;
        }
    }
}
