package com.peerkeys.config;

import com.peerkeys.storage.LogStorage;
import com.peerkeys.storage.LruStorage;
import com.peerkeys.storage.Storage;
import com.peerkeys.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Configuration for a {@link com.peerkeys.PeerKeyStore}.
 * Defaults are read from environment variables first, then system properties.
 */
public class KeyStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(KeyStoreConfig.class);

    public static final String DEFAULT_PATH = "./keystore";

    private static final long BYTES_PER_MB = 1024L * 1024;

    private Path path;
    private int cacheSize;
    private boolean walFsync;
    private long walMaxBytes;
    private Storage<byte[]> storage;
    private MetricsCollector metrics;

    public KeyStoreConfig() {
        this.path = Path.of(lookup("PEERKEYS_PATH", "peerkeys.path", DEFAULT_PATH));
        this.cacheSize = (int) lookupPositive("PEERKEYS_CACHE_SIZE", "peerkeys.cache.size",
                LruStorage.DEFAULT_CAPACITY, Integer.MAX_VALUE);
        this.walFsync = lookupBoolean("PEERKEYS_WAL_FSYNC", "peerkeys.wal.fsync", true);
        this.walMaxBytes = lookupPositive("PEERKEYS_WAL_MAX_MB", "peerkeys.wal.max.mb",
                LogStorage.DEFAULT_WAL_MAX_BYTES / BYTES_PER_MB, Long.MAX_VALUE / BYTES_PER_MB) * BYTES_PER_MB;
    }

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private static String lookup(String envKey, String propKey, String fallback) {
        String value = System.getenv(envKey);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(propKey);
        }
        return value == null || value.isEmpty() ? fallback : value.trim();
    }

    private static boolean lookupBoolean(String envKey, String propKey, boolean fallback) {
        String value = lookup(envKey, propKey, null);
        if (value == null) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    private static long lookupPositive(String envKey, String propKey, long fallback, long max) {
        String value = lookup(envKey, propKey, null);
        if (value == null) {
            return fallback;
        }
        try {
            long parsed = Long.parseLong(value);
            if (parsed > max) {
                logger.warn("Out of range {} value: {} (max {}), using default", propKey, value, max);
                return fallback;
            }
            if (parsed > 0) {
                logger.info("Using {}={}", propKey, parsed);
                return parsed;
            }
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value: {}, using default", propKey, value);
            return fallback;
        }
        logger.warn("Non-positive {} value: {}, using default", propKey, value);
        return fallback;
    }

    public Path getPath() {
        return path;
    }

    public void setPath(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        this.path = path;
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
        this.cacheSize = cacheSize;
    }

    public boolean isWalFsync() {
        return walFsync;
    }

    public void setWalFsync(boolean walFsync) {
        this.walFsync = walFsync;
    }

    public long getWalMaxBytes() {
        return walMaxBytes;
    }

    public void setWalMaxBytes(long walMaxBytes) {
        if (walMaxBytes <= 0) {
            throw new IllegalArgumentException("walMaxBytes must be positive, got: " + walMaxBytes);
        }
        this.walMaxBytes = walMaxBytes;
    }

    /**
     * @return a caller-supplied storage, or null to build the default composed storage
     */
    public Storage<byte[]> getStorage() {
        return storage;
    }

    public void setStorage(Storage<byte[]> storage) {
        this.storage = storage;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsCollector metrics) {
        this.metrics = metrics;
    }

    /**
     * Builder for KeyStoreConfig.
     */
    public static class Builder {
        private final KeyStoreConfig config = new KeyStoreConfig();

        public Builder path(Path path) {
            config.setPath(path);
            return this;
        }

        public Builder path(String path) {
            if (path == null || path.isEmpty()) {
                throw new IllegalArgumentException("path cannot be null or empty");
            }
            config.setPath(Path.of(path));
            return this;
        }

        public Builder cacheSize(int size) {
            config.setCacheSize(size);
            return this;
        }

        public Builder walFsync(boolean fsync) {
            config.setWalFsync(fsync);
            return this;
        }

        public Builder walMaxBytes(long bytes) {
            config.setWalMaxBytes(bytes);
            return this;
        }

        public Builder storage(Storage<byte[]> storage) {
            config.setStorage(storage);
            return this;
        }

        public Builder metrics(MetricsCollector metrics) {
            config.setMetrics(metrics);
            return this;
        }

        public KeyStoreConfig build() {
            return config;
        }
    }
}
