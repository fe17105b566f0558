/**
 * In-memory Cache adapter implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.toolgate.adapter.inmemory.cache.BoundedCache}:
 *       LRU + TTL implementation of {@link com.ryuqq.toolgate.core.spi.Cache}</li>
 *   <li>{@link com.ryuqq.toolgate.adapter.inmemory.cache.CachePresets}:
 *       sizes and TTLs for the model, image and response caches</li>
 *   <li>{@link com.ryuqq.toolgate.adapter.inmemory.cache.CacheKeys}:
 *       stable keys from request parameter maps</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Single process only</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @see com.ryuqq.toolgate.core.spi.Cache
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.adapter.inmemory.cache;
