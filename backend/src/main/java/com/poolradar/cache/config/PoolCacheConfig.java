package com.poolradar.cache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolradar.cache.FilePoolCacheSnapshotStore;
import com.poolradar.cache.PoolCache;
import com.poolradar.cache.PoolCacheSnapshotStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Pool cache module configuration: the shared PoolCache and its snapshot store.
 */
@Configuration
@EnableConfigurationProperties(PoolCacheProperties.class)
public class PoolCacheConfig {

    @Bean
    public PoolCacheSnapshotStore poolCacheSnapshotStore(PoolCacheProperties properties, ObjectMapper objectMapper) {
        if (!properties.isEnablePersistence()) {
            return PoolCacheSnapshotStore.NONE;
        }
        return new FilePoolCacheSnapshotStore(Path.of(properties.getStorageDir()), properties.getStorageKey(), objectMapper);
    }

    /** Restored from the last snapshot on startup; saved again on shutdown. */
    @Bean(destroyMethod = "shutdown")
    public PoolCache poolCache(PoolCacheProperties properties, PoolCacheSnapshotStore snapshotStore, Clock clock) {
        PoolCache cache = new PoolCache(properties, snapshotStore, clock);
        cache.restore();
        return cache;
    }
}
