package com.poolradar.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolradar.domain.PoolFixtures;
import com.poolradar.domain.PoolRecord;
import com.poolradar.domain.PoolSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilePoolCacheSnapshotStoreTest {

    @TempDir
    Path dir;

    @Test
    void loadReturnsEmptyWhenNoFileYet() throws IOException {
        FilePoolCacheSnapshotStore store = new FilePoolCacheSnapshotStore(dir, "uniswap_pool_cache", new ObjectMapper());
        assertThat(store.load()).isEmpty();
        assertThat(store.getFile()).isEqualTo(dir.resolve("uniswap_pool_cache.json"));
    }

    @Test
    void savedSnapshotLoadsBackWithRecordsAndCounters() throws IOException {
        FilePoolCacheSnapshotStore store = new FilePoolCacheSnapshotStore(dir.resolve("nested"), "pools", new ObjectMapper());
        PoolRecord pool = PoolFixtures.usdcWeth();
        CacheEntry entry = new CacheEntry(pool, 1_000L, 60_000L, PoolSource.CHAIN);
        PoolCacheSnapshot snapshot = new PoolCacheSnapshot(
                Map.of(PoolCacheKey.forAddress(pool).value(), entry),
                new CacheStats(3, 1, 2, 1, 0.75, 0),
                5_000L);

        store.save(snapshot);

        assertThat(Files.exists(dir.resolve("nested").resolve("pools.json"))).isTrue();
        assertThat(Files.readString(store.getFile())).contains("\"chain\"");
        Optional<PoolCacheSnapshot> loaded = store.load();
        assertThat(loaded).isPresent();
        assertThat(loaded.get().timestamp()).isEqualTo(5_000L);
        assertThat(loaded.get().stats().hits()).isEqualTo(3);
        CacheEntry restored = loaded.get().cache().get(PoolCacheKey.forAddress(pool).value());
        assertThat(restored.source()).isEqualTo(PoolSource.CHAIN);
        assertThat(restored.data().sqrtPriceX96()).isEqualTo(pool.sqrtPriceX96());
        assertThat(restored.data().totalValueLockedUSD()).isEqualByComparingTo(pool.totalValueLockedUSD());
        assertThat(restored.data().tokenA()).isEqualTo(pool.tokenA());
    }

    @Test
    void corruptFileFailsLoad() throws IOException {
        FilePoolCacheSnapshotStore store = new FilePoolCacheSnapshotStore(dir, "pools", new ObjectMapper());
        Files.writeString(store.getFile(), "{not json");
        assertThatThrownBy(store::load).isInstanceOf(IOException.class);
    }
}
