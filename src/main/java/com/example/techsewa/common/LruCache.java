package com.example.techsewa.common;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Bounded access-ordered cache.  All operations are synchronized on the instance.
 */
public class LruCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> map;

    public LruCache(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.map = new LinkedHashMap<>(Math.max(16, maxSize), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > LruCache.this.maxSize;
            }
        };
    }

    public synchronized V get(K key) {
        return map.get(key);
    }

    public synchronized void put(K key, V value) {
        map.put(key, value);
    }

    /**
     * Return the cached value or compute, store and return it.  The loader runs
     * outside the lock, so two racing misses may both compute.
     */
    public V computeIfAbsent(K key, Function<? super K, ? extends V> loader) {
        V hit = get(key);
        if (hit != null) {
            return hit;
        }
        V value = loader.apply(key);
        if (value != null) {
            put(key, value);
        }
        return value;
    }

    public synchronized void invalidateAll() {
        map.clear();
    }

    public synchronized int size() {
        return map.size();
    }

    public int maxSize() {
        return maxSize;
    }
}
