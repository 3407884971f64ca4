package com.poolradar.cache;

import com.poolradar.cache.config.PoolCacheProperties;
import com.poolradar.domain.PoolRecord;
import com.poolradar.domain.PoolSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TTL-aware pool cache over an {@link LruStore}. One shared instance per process; reads and writes hold the
 * instance lock, so the store, the pair index and the counters are never mutated concurrently.
 * <p>
 * Each record is stored once, under its address key, and counts once toward {@code maxSize}, {@code size}
 * and evictions. Its token-pair key is a secondary index onto the address key; the index entry goes
 * whenever the record goes. Expired entries are never returned: a read that finds one removes it and
 * counts a miss and an eviction. Synthetic records are refused. Persistence failures are logged and
 * swallowed; the cache keeps working in memory.
 */
@Slf4j
public class PoolCache {

    private final LruStore<String, CacheEntry> store;
    /** pair key -> address key of the stored record. */
    private final Map<String, String> pairIndex = new HashMap<>();
    private final long defaultTtlMs;
    private final boolean persistenceEnabled;
    private final PoolCacheSnapshotStore snapshotStore;
    private final Object persistLock = new Object();
    private final Clock clock;

    private long hits;
    private long misses;
    private long evictions;

    public PoolCache(PoolCacheProperties properties, PoolCacheSnapshotStore snapshotStore, Clock clock) {
        if (properties.getDefaultTtlMs() <= 0) {
            throw new IllegalArgumentException("defaultTtlMs must be positive");
        }
        this.store = new LruStore<>(properties.getMaxSize(), (key, entry) -> {
            unindex(key, entry);
            evictions++;
            log.debug("LRU evicted {}", key);
        });
        this.defaultTtlMs = properties.getDefaultTtlMs();
        this.persistenceEnabled = properties.isEnablePersistence() && snapshotStore != null;
        this.snapshotStore = snapshotStore != null ? snapshotStore : PoolCacheSnapshotStore.NONE;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public Optional<PoolRecord> get(PoolCacheKey key) {
        return getEntry(key).map(CacheEntry::data);
    }

    /**
     * Unexpired entry for the key, counting a hit; empty on miss or expiry, counting a miss.
     */
    public synchronized Optional<CacheEntry> getEntry(PoolCacheKey key) {
        String primary = primaryKey(key);
        CacheEntry entry = primary != null ? store.get(primary) : null;
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(now())) {
            drop(primary);
            misses++;
            evictions++;
            log.debug("Cache entry {} expired on read", key);
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry);
    }

    /**
     * Unexpired record for the key without touching the counters. Expired entries are left for the sweep.
     */
    public synchronized Optional<PoolRecord> peek(PoolCacheKey key) {
        String primary = primaryKey(key);
        CacheEntry entry = primary != null ? store.get(primary) : null;
        return entry != null && !entry.isExpired(now()) ? Optional.of(entry.data()) : Optional.empty();
    }

    public boolean put(PoolRecord record, PoolSource source) {
        return put(record, source, null);
    }

    /**
     * Stores the record under its address key and indexes its pair key, overwriting earlier values.
     *
     * @param ttl entry TTL; the configured default when null
     * @return false when the record was refused (synthetic or missing)
     */
    public synchronized boolean put(PoolRecord record, PoolSource source, Duration ttl) {
        if (record == null || source == null) {
            return false;
        }
        if (!source.isReal()) {
            log.debug("Refusing to cache synthetic pool {}", record.address());
            return false;
        }
        long ttlMs = ttl != null && !ttl.isNegative() && !ttl.isZero() ? ttl.toMillis() : defaultTtlMs;
        store(new CacheEntry(record, now(), ttlMs, source));
        return true;
    }

    /**
     * True only if the key is present and unexpired. Does not change the counters.
     */
    public boolean has(PoolCacheKey key) {
        return peek(key).isPresent();
    }

    /**
     * Removes the record the key points to, under both its address and pair keys.
     */
    public synchronized boolean remove(PoolCacheKey key) {
        String primary = primaryKey(key);
        return primary != null && drop(primary) != null;
    }

    /**
     * Drops every entry and resets the counters.
     */
    public void clear() {
        synchronized (this) {
            store.clear();
            pairIndex.clear();
            hits = 0;
            misses = 0;
            evictions = 0;
        }
        persist();
    }

    /**
     * Preloads frequently used pools.
     */
    public void warmUp(Collection<PoolRecord> records, PoolSource source) {
        if (records == null) {
            return;
        }
        records.forEach(r -> put(r, source));
    }

    public synchronized CacheStats stats() {
        long memory = 0;
        for (Map.Entry<String, CacheEntry> e : store.entries()) {
            memory += e.getValue().approxSizeBytes() + e.getKey().length() * 2L;
        }
        for (String pairKey : pairIndex.keySet()) {
            memory += pairKey.length() * 2L;
        }
        return new CacheStats(hits, misses, evictions, store.size(), CacheStats.hitRate(hits, misses), memory);
    }

    /**
     * Evicts every expired entry, then saves the snapshot.
     *
     * @return number of entries evicted
     */
    public int sweepExpired() {
        int swept;
        synchronized (this) {
            long now = now();
            List<String> expired = new ArrayList<>();
            for (Map.Entry<String, CacheEntry> e : store.entries()) {
                if (e.getValue().isExpired(now)) {
                    expired.add(e.getKey());
                }
            }
            expired.forEach(this::drop);
            evictions += expired.size();
            swept = expired.size();
            if (swept > 0) {
                log.debug("Swept {} expired pool cache entries, {} remain", swept, store.size());
            }
        }
        persist();
        return swept;
    }

    /**
     * Reloads the last snapshot, skipping entries that expired while the process was down.
     *
     * @return number of pools restored
     */
    public synchronized int restore() {
        if (!persistenceEnabled) {
            return 0;
        }
        try {
            Optional<PoolCacheSnapshot> snapshot = snapshotStore.load();
            if (snapshot.isEmpty()) {
                return 0;
            }
            long now = now();
            for (CacheEntry entry : snapshot.get().cache().values()) {
                if (entry != null && entry.data() != null && entry.source() != null && entry.source().isReal()
                        && !entry.isExpired(now)) {
                    store(entry);
                }
            }
            CacheStats saved = snapshot.get().stats();
            hits = saved.hits();
            misses = saved.misses();
            evictions = saved.evictions();
            log.info("Restored {} pool cache entries from snapshot", store.size());
            return store.size();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load pool cache from storage: {}", e.getMessage());
            return 0;
        }
    }

    /**
     * Saves the snapshot; called on sweep, clear and shutdown. The state is copied under the cache lock and
     * written outside it, so lookups never wait on storage.
     */
    public void persist() {
        if (!persistenceEnabled) {
            return;
        }
        synchronized (persistLock) {
            PoolCacheSnapshot snapshot = snapshot();
            try {
                snapshotStore.save(snapshot);
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to save pool cache to storage: {}", e.getMessage());
            }
        }
    }

    public void shutdown() {
        persist();
        log.info("Pool cache shut down with {} entries", size());
    }

    public synchronized int size() {
        return store.size();
    }

    public long getDefaultTtlMs() {
        return defaultTtlMs;
    }

    private synchronized PoolCacheSnapshot snapshot() {
        long now = now();
        Map<String, CacheEntry> live = new HashMap<>();
        for (Map.Entry<String, CacheEntry> e : store.entries()) {
            if (!e.getValue().isExpired(now)) {
                live.put(e.getKey(), e.getValue());
            }
        }
        CacheStats stats = new CacheStats(hits, misses, evictions, live.size(), CacheStats.hitRate(hits, misses), 0);
        return new PoolCacheSnapshot(live, stats, now);
    }

    private void store(CacheEntry entry) {
        String address = PoolCacheKey.forAddress(entry.data()).value();
        String pair = PoolCacheKey.forPair(entry.data()).value();
        String previousAddress = pairIndex.get(pair);
        if (previousAddress != null && !previousAddress.equals(address)) {
            // the pair now resolves to a different pool; the old record has no pair key left
            drop(previousAddress);
        }
        CacheEntry previous = store.remove(address);
        if (previous != null) {
            unindex(address, previous);
        }
        store.put(address, entry);
        pairIndex.put(pair, address);
    }

    /** Address key for either kind of key; null when a pair key is not indexed. */
    private String primaryKey(PoolCacheKey key) {
        return key.isAddressKey() ? key.value() : pairIndex.get(key.value());
    }

    private CacheEntry drop(String addressKey) {
        CacheEntry removed = store.remove(addressKey);
        if (removed != null) {
            unindex(addressKey, removed);
        }
        return removed;
    }

    private void unindex(String addressKey, CacheEntry entry) {
        pairIndex.remove(PoolCacheKey.forPair(entry.data()).value(), addressKey);
    }

    private long now() {
        return clock.millis();
    }
}
