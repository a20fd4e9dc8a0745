package com.peerkeys.config;

import com.peerkeys.storage.LruStorage;
import com.peerkeys.util.MetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class KeyStoreConfigTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("peerkeys.path");
        System.clearProperty("peerkeys.cache.size");
        System.clearProperty("peerkeys.wal.fsync");
        System.clearProperty("peerkeys.wal.max.mb");
    }

    @Test
    void builder_defaultValues() {
        KeyStoreConfig config = KeyStoreConfig.builder().build();

        assertThat(config.getPath()).isEqualTo(Path.of("./keystore"));
        assertThat(config.getCacheSize()).isEqualTo(1000);
        assertThat(config.isWalFsync()).isTrue();
        assertThat(config.getWalMaxBytes()).isEqualTo(16L * 1024 * 1024);
        assertThat(config.getStorage()).isNull();
        assertThat(config.getMetrics()).isNull();
    }

    @Test
    void systemProperties_overrideDefaults() {
        System.setProperty("peerkeys.path", "/tmp/other-keys");
        System.setProperty("peerkeys.cache.size", "42");
        System.setProperty("peerkeys.wal.fsync", "false");
        System.setProperty("peerkeys.wal.max.mb", "2");

        KeyStoreConfig config = new KeyStoreConfig();

        assertThat(config.getPath()).isEqualTo(Path.of("/tmp/other-keys"));
        assertThat(config.getCacheSize()).isEqualTo(42);
        assertThat(config.isWalFsync()).isFalse();
        assertThat(config.getWalMaxBytes()).isEqualTo(2L * 1024 * 1024);
    }

    @Test
    void invalidSystemProperties_fallBackToDefaults() {
        System.setProperty("peerkeys.cache.size", "lots");
        System.setProperty("peerkeys.wal.max.mb", "-3");

        KeyStoreConfig config = new KeyStoreConfig();

        assertThat(config.getCacheSize()).isEqualTo(1000);
        assertThat(config.getWalMaxBytes()).isEqualTo(16L * 1024 * 1024);
    }

    @Test
    void outOfRangeSystemProperties_fallBackToDefaults() {
        System.setProperty("peerkeys.cache.size", "4294967297");
        System.setProperty("peerkeys.wal.max.mb", String.valueOf(Long.MAX_VALUE / 1024));

        KeyStoreConfig config = new KeyStoreConfig();

        assertThat(config.getCacheSize()).isEqualTo(1000);
        assertThat(config.getWalMaxBytes()).isEqualTo(16L * 1024 * 1024);
    }

    @Test
    void largestAllowedWalSize_doesNotOverflow() {
        long maxMb = Long.MAX_VALUE / (1024 * 1024);
        System.setProperty("peerkeys.wal.max.mb", String.valueOf(maxMb));
        System.setProperty("peerkeys.cache.size", String.valueOf(Integer.MAX_VALUE));

        KeyStoreConfig config = new KeyStoreConfig();

        assertThat(config.getWalMaxBytes()).isEqualTo(maxMb * 1024 * 1024).isPositive();
        assertThat(config.getCacheSize()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void builder_allCustomValues() {
        LruStorage<byte[]> storage = new LruStorage<>(10);
        MetricsCollector metrics = new MetricsCollector();

        KeyStoreConfig config = KeyStoreConfig.builder()
            .path("custom-keys")
            .cacheSize(50)
            .walFsync(false)
            .walMaxBytes(4096)
            .storage(storage)
            .metrics(metrics)
            .build();

        assertThat(config.getPath()).isEqualTo(Path.of("custom-keys"));
        assertThat(config.getCacheSize()).isEqualTo(50);
        assertThat(config.isWalFsync()).isFalse();
        assertThat(config.getWalMaxBytes()).isEqualTo(4096);
        assertThat(config.getStorage()).isSameAs(storage);
        assertThat(config.getMetrics()).isSameAs(metrics);
    }

    @Test
    void builder_invalidValues_throw() {
        assertThatThrownBy(() -> KeyStoreConfig.builder().cacheSize(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cacheSize");
        assertThatThrownBy(() -> KeyStoreConfig.builder().walMaxBytes(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("walMaxBytes");
        assertThatThrownBy(() -> KeyStoreConfig.builder().path(""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> KeyStoreConfig.builder().path((Path) null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
