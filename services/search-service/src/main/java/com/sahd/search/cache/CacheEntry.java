package com.sahd.search.cache;

public record CacheEntry<V>(V value, long expiresAtMs) {
    public boolean isExpired(long nowMs) {
        return nowMs > expiresAtMs;
    }
}
