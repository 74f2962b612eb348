package com.sahd.search.cache;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

public class TtlCache<V> {
    private final ConcurrentHashMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> insertionOrder = new ConcurrentLinkedQueue<>();
    private final int maxEntries;
    private final Clock clock;

    public TtlCache(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public TtlCache(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        CacheEntry<V> previous = entries.put(key, new CacheEntry<>(value, clock.millis() + ttlMs));
        if (previous == null) {
            insertionOrder.add(key);
        }
        while (entries.size() > maxEntries) {
            String eldest = insertionOrder.poll();
            if (eldest == null) {
                break;
            }
            entries.remove(eldest);
        }
    }

    public int size() {
        return entries.size();
    }
}
