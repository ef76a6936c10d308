package com.ryuqq.conduit.application.lookup;

import com.ryuqq.conduit.core.statemachine.CacheKeyState;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * TTL 캐시 + 진행 중 호출 병합 조회기.
 *
 * <p>같은 키에 대한 동시 호출은 하나의 fetch 결과를 공유합니다.
 * 실패는 캐시하지 않으며, 다음 호출자가 새로 조회합니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public interface CachedLookup<K, V> {

    /**
     * 캐시 조회, 없으면 fetch.
     *
     * @param key 키
     * @param fetcher 조회 함수 (보통 orchestrator.execute 경유)
     * @return 값 future
     */
    CompletableFuture<V> getOrFetch(K key, Supplier<CompletableFuture<V>> fetcher);

    /**
     * 캐시 조회, forceRefresh가 true면 유효한 레코드가 있어도 새로 조회.
     *
     * <p>강제 조회도 이미 진행 중인 fetch가 있으면 그 결과에 합류합니다.</p>
     *
     * @param key 키
     * @param fetcher 조회 함수
     * @param forceRefresh 유효한 레코드 무시 여부
     * @return 값 future
     */
    CompletableFuture<V> getOrFetch(K key, Supplier<CompletableFuture<V>> fetcher, boolean forceRefresh);

    /**
     * 레코드와 In-flight Marker 제거.
     *
     * <p>무효화된 fetch가 나중에 완료되어도 캐시를 다시 채우지 않습니다.</p>
     *
     * @param key 키
     */
    void invalidate(K key);

    /**
     * 모든 레코드와 Marker 제거.
     */
    void invalidateAll();

    /**
     * 대량 조회 결과로 캐시를 미리 채움.
     *
     * @param values 키-값 맵 (null 값은 무시)
     */
    void seed(Map<K, V> values);

    /**
     * fetch 없이 유효한 값 조회.
     *
     * @param key 키
     * @return 유효한 값, 없거나 만료되었으면 empty
     */
    Optional<V> peek(K key);

    /**
     * 키별 상태 조회.
     *
     * @param key 키
     * @return 상태
     */
    CacheKeyState stateOf(K key);
}
