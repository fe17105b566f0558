package com.ryuqq.toolgate.adapter.inmemory.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;

/**
 * Builds stable cache keys from request parameters.
 *
 * <p>The key is the parameters serialized as JSON with Jackson. Map entries are ordered by key
 * at every nesting level, so two maps with the same content always produce the same key
 * regardless of insertion order. Arrays and collections both become JSON arrays.</p>
 *
 * <pre>
 * CacheKeys.of(Map.of("width", 512, "prompt", "cat"));   // {"prompt":"cat","width":512}
 * </pre>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class CacheKeys {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private CacheKeys() {
    }

    /**
     * Creates a key from a parameter map.
     *
     * @param params request parameters (null values allowed)
     * @return stable key
     * @throws IllegalArgumentException if params is null or cannot be serialized
     */
    public static String of(Map<String, ?> params) {
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        try {
            return MAPPER.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("params cannot be serialized to a cache key: " + e.getOriginalMessage(), e);
        }
    }
}
