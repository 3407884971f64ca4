package com.poolradar.cache.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pool cache sizing, expiry and persistence. Documented in application.yml under poolradar.cache.
 */
@ConfigurationProperties(prefix = "poolradar.cache")
@NoArgsConstructor
@Getter
@Setter
public class PoolCacheProperties {

    /** Maximum number of keys held; the least recently used key is evicted beyond this. Default 1000. */
    private int maxSize = 1000;

    /** TTL applied when an entry is stored without its own. Default 5 minutes. */
    private long defaultTtlMs = 5 * 60 * 1000L;

    /** Interval of the background sweep that evicts expired entries. Default 1 minute. */
    private long cleanupIntervalMs = 60 * 1000L;

    /** Save unexpired entries on sweep and shutdown, reload them on startup. */
    private boolean enablePersistence = false;

    /** Snapshot name; the file is {storageDir}/{storageKey}.json. */
    private String storageKey = "uniswap_pool_cache";

    /** Directory for the snapshot file. */
    private String storageDir = System.getProperty("java.io.tmpdir") + "/pool-radar";
}
