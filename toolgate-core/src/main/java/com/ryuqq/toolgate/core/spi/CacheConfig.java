package com.ryuqq.toolgate.core.spi;

/**
 * 캐시 설정.
 *
 * @param maxSize 최대 항목 수 (양수)
 * @param ttlMs 기본 TTL (밀리초, null이면 만료 없음, 지정 시 양수)
 * @author ToolGate Team
 * @since 1.0.0
 */
public record CacheConfig(int maxSize, Long ttlMs) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxSize is not positive
     * @throws IllegalArgumentException if ttlMs is specified and not positive
     */
    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException(
                "maxSize must be positive (current: " + maxSize + ")"
            );
        }
        if (ttlMs != null && ttlMs <= 0) {
            throw new IllegalArgumentException(
                "ttlMs must be positive if specified (current: " + ttlMs + ")"
            );
        }
    }

    /**
     * 만료 없는 캐시 설정.
     *
     * @param maxSize 최대 항목 수
     * @return CacheConfig
     */
    public static CacheConfig of(int maxSize) {
        return new CacheConfig(maxSize, null);
    }

    /**
     * 기본 TTL이 있는 캐시 설정.
     *
     * @param maxSize 최대 항목 수
     * @param ttlMs 기본 TTL (밀리초)
     * @return CacheConfig
     */
    public static CacheConfig of(int maxSize, long ttlMs) {
        return new CacheConfig(maxSize, ttlMs);
    }

    /**
     * 기본 TTL 지정 여부.
     *
     * @return TTL이 있으면 true
     */
    public boolean hasTtl() {
        return ttlMs != null;
    }
}
