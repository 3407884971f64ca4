package com.poolradar.cache.job;

import com.poolradar.cache.PoolCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic eviction of expired pool cache entries; also writes the snapshot when persistence is on.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PoolCacheSweepJob {

    private final PoolCache poolCache;

    @Scheduled(
            fixedDelayString = "${poolradar.cache.cleanup-interval-ms:60000}",
            initialDelayString = "${poolradar.cache.cleanup-interval-ms:60000}")
    public void runScheduled() {
        int evicted = poolCache.sweepExpired();
        if (evicted > 0) {
            log.info("Pool cache sweep evicted {} expired entries", evicted);
        }
    }
}
