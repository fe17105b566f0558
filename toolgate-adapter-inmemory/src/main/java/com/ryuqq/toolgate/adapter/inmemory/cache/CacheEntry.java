package com.ryuqq.toolgate.adapter.inmemory.cache;

/**
 * Cached value with its expiry deadline.
 *
 * @param value cached value
 * @param expiring whether the entry has a deadline
 * @param expiresAtNanos monotonic deadline, meaningful only when {@code expiring}
 * @param <V> value type
 */
record CacheEntry<V>(V value, boolean expiring, long expiresAtNanos) {

    static <V> CacheEntry<V> permanent(V value) {
        return new CacheEntry<>(value, false, 0L);
    }

    static <V> CacheEntry<V> expiring(V value, long expiresAtNanos) {
        return new CacheEntry<>(value, true, expiresAtNanos);
    }

    boolean isExpired(long nowNanos) {
        return expiring && nowNanos - expiresAtNanos >= 0;
    }
}
