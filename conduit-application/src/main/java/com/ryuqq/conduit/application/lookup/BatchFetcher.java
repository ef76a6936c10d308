package com.ryuqq.conduit.application.lookup;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.outcome.LookupResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 다중 키 조회 함수.
 *
 * <p>배치 flush 시 중복 제거된 키 목록으로 한 번 호출됩니다. 게이트와 재시도를 거치므로
 * 시도마다 다시 호출될 수 있습니다.</p>
 *
 * <p>결과 맵에 없는 키는 {@code Missing}으로 간주됩니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author Conduit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BatchFetcher<K, V> {

    /**
     * 결합 조회.
     *
     * @param keys 중복 제거된 키 (enqueue 순서)
     * @param attemptToken 시도 범위 취소 토큰
     * @return 키별 결과
     */
    CompletableFuture<Map<K, LookupResult<V>>> fetch(List<K> keys, CancellationToken attemptToken);
}
