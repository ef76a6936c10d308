package com.ryuqq.conduit.application.lookup;

import com.ryuqq.conduit.core.outcome.LookupResult;
import com.ryuqq.conduit.core.statemachine.BatchState;

import java.util.concurrent.CompletableFuture;

/**
 * 자동 배칭 조회기.
 *
 * <p>짧은 윈도우 안에 들어온 단일 키 조회를 모아 하나의 다중 키 호출로 보냅니다.</p>
 *
 * <p><strong>정산 규칙:</strong></p>
 * <ul>
 *   <li>결과에 키가 있으면 {@code Found}</li>
 *   <li>결과에 키가 없으면 {@code Missing} (호출자를 누락시키지 않음)</li>
 *   <li>키 단위 {@code Failed}는 해당 호출자만 TERMINAL로 실패</li>
 *   <li>결합 호출 자체가 실패하면 모든 호출자가 같은 예외로 실패</li>
 * </ul>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public interface BatchLookup<K, V> {

    /**
     * 단일 키 조회 요청.
     *
     * @param key 키
     * @return Found 또는 Missing으로 완료되는 future
     * @throws IllegalArgumentException key가 null인 경우
     */
    CompletableFuture<LookupResult<V>> enqueue(K key);

    /**
     * 윈도우를 기다리지 않고 즉시 flush.
     *
     * <p>대기 중인 항목이 없으면 아무 일도 하지 않습니다.</p>
     */
    void flushNow();

    /**
     * 현재 윈도우에 쌓인 항목 수 (중복 포함).
     *
     * @return 대기 항목 수
     */
    int pendingCount();

    /**
     * 현재 상태.
     *
     * @return 배치 상태
     */
    BatchState state();

    /**
     * 남은 항목을 flush하고 이후 enqueue를 거부.
     */
    void close();
}
