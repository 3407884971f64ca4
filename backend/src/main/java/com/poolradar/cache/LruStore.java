package com.poolradar.cache;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Fixed-capacity map with least-recently-used eviction. {@link #get} promotes the key to most recently used;
 * {@link #containsKey} does not. Not thread-safe: callers serialize access.
 */
public class LruStore<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> entries;
    private final BiConsumer<K, V> evictionListener;

    public LruStore(int maxSize) {
        this(maxSize, (k, v) -> { });
    }

    public LruStore(int maxSize, BiConsumer<K, V> evictionListener) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.maxSize = maxSize;
        this.evictionListener = evictionListener;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                if (size() > LruStore.this.maxSize) {
                    LruStore.this.evictionListener.accept(eldest.getKey(), eldest.getValue());
                    return true;
                }
                return false;
            }
        };
    }

    public V get(K key) {
        return entries.get(key);
    }

    /**
     * Inserts or overwrites. Overwriting also moves the key to most recently used.
     */
    public void put(K key, V value) {
        entries.put(key, value);
    }

    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public V remove(K key) {
        return entries.remove(key);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public int maxSize() {
        return maxSize;
    }

    /**
     * Copy of the entries from least to most recently used.
     */
    public List<Map.Entry<K, V>> entries() {
        List<Map.Entry<K, V>> copy = new ArrayList<>(entries.size());
        for (Map.Entry<K, V> e : entries.entrySet()) {
            copy.add(Map.entry(e.getKey(), e.getValue()));
        }
        return copy;
    }
}
