package com.ryuqq.toolgate.core.spi;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * LRU + TTL 캐시 SPI.
 *
 * <p>반복 요청되는 값의 메모리를 제한하고, 비용이 큰(과금될 수 있는) 중복 호출을 피합니다.</p>
 *
 * <p><strong>LRU 순서:</strong> head가 가장 오래 사용되지 않은 항목, tail이 가장 최근 사용 항목입니다.
 * {@link #get(Object)}와 {@link #set(Object, Object)}만 순서를 바꿉니다.</p>
 *
 * <p><strong>만료:</strong> 만료된 항목은 {@link #get(Object)}나 {@link #prune()}에서 지연 제거됩니다.
 * 따라서 {@link #size()}는 살아있는 항목 수의 상한입니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입 (null 불가)
 * @author ToolGate Team
 * @since 1.0.0
 */
public interface Cache<K, V> {

    /**
     * 값 조회.
     *
     * <p>만료된 항목은 제거 후 miss로 처리하고, 살아있는 항목은 tail로 이동합니다.</p>
     *
     * @param key 키
     * @return 값 또는 empty (miss)
     */
    Optional<V> get(K key);

    /**
     * 기본 TTL로 값 저장.
     *
     * @param key 키
     * @param value 값
     */
    void set(K key, V value);

    /**
     * TTL을 지정하여 값 저장.
     *
     * @param key 키
     * @param value 값
     * @param ttlMs 이 항목의 TTL (밀리초, 양수)
     */
    void set(K key, V value, long ttlMs);

    /**
     * 존재 여부 확인 (순서 변경 없음).
     *
     * <p>만료된 항목은 false를 반환하지만 제거하지 않습니다.</p>
     *
     * @param key 키
     * @return 살아있는 항목이 있으면 true
     */
    boolean has(K key);

    /**
     * 항목 삭제.
     *
     * @param key 키
     * @return 삭제했으면 true, 없었으면 false
     */
    boolean delete(K key);

    /**
     * 전체 삭제.
     */
    void clear();

    /**
     * 항목 수 (아직 제거되지 않은 만료 항목 포함).
     *
     * @return 항목 수
     */
    int size();

    /**
     * 키 스냅샷 (LRU → MRU 순서, 만료 항목 포함 가능).
     *
     * @return 키 목록
     */
    List<K> keys();

    /**
     * 값 스냅샷 (LRU → MRU 순서, 만료 항목 포함 가능).
     *
     * @return 값 목록
     */
    List<V> values();

    /**
     * 만료 항목 일괄 제거.
     *
     * @return 제거된 항목 수
     */
    int prune();

    /**
     * 비동기 read-through.
     *
     * <p>miss 시 factory를 호출해 결과를 저장하고 반환합니다.
     * 같은 키에 대한 동시 요청은 하나의 계산을 공유합니다 (single-flight).</p>
     *
     * @param key 키
     * @param factory 값 생성 함수
     * @return 캐시된 값 또는 새로 생성된 값
     */
    CompletableFuture<V> getOrSet(K key, Supplier<CompletableFuture<V>> factory);

    /**
     * 동기 read-through.
     *
     * @param key 키
     * @param factory 값 생성 함수
     * @return 캐시된 값 또는 새로 생성된 값
     */
    V getOrSetSync(K key, Supplier<V> factory);
}
