package com.ryuqq.conduit.application.orchestrator;

import com.ryuqq.conduit.application.lookup.BatchConfig;
import com.ryuqq.conduit.application.lookup.BatchFetcher;
import com.ryuqq.conduit.application.lookup.BatchLookup;
import com.ryuqq.conduit.application.lookup.CacheConfig;
import com.ryuqq.conduit.application.lookup.CachedLookup;
import com.ryuqq.conduit.core.contract.CallOptions;
import com.ryuqq.conduit.core.contract.TransportRequest;
import com.ryuqq.conduit.core.contract.TransportResponse;
import com.ryuqq.conduit.core.protection.ConcurrencyGate;

import java.util.concurrent.CompletableFuture;

/**
 * 클라이언트 측 요청 조정자.
 *
 * <p>애플리케이션의 모든 원격 호출이 통과하는 단일 진입점입니다.
 * 전역 Concurrency Gate, 재시도/백오프, 협력적 취소, 자동 배칭, TTL 캐시를 제공합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RequestOrchestrator orchestrator = DefaultRequestOrchestrator.builder()
 *     .transport(transport)
 *     .build();
 *
 * // 1. 게이트를 통과하는 일반 호출
 * TransportResponse page = orchestrator.send(TransportRequest.get("/produtos?page=1"),
 *     CallOptions.named("catalog.list")).join();
 *
 * // 2. 배치 조회 (80ms 윈도우 동안 모인 키를 한 번에 요청)
 * BatchLookup&lt;String, JsonNode&gt; stock = orchestrator.batchLookup("stock", new BatchConfig(), fetcher);
 * LookupResult&lt;JsonNode&gt; result = stock.enqueue("sku-123").join();
 *
 * // 3. 캐시 조회 (동시 호출은 한 번의 fetch를 공유)
 * CachedLookup&lt;String, Integer&gt; stars = orchestrator.cachedLookup("review-stars", new CacheConfig());
 * Integer value = stars.getOrFetch("sku-123", () -&gt; loadStars("sku-123")).join();
 * </pre>
 *
 * <p>모든 future는 값으로 완료되거나 {@code ConduitException}(CANCELLED, TIMEOUT, TRANSIENT, TERMINAL)으로
 * 예외 완료됩니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public interface RequestOrchestrator {

    /**
     * 게이트 Slot을 획득한 뒤 재시도 정책에 따라 실행.
     *
     * @param operation 실행할 작업
     * @param options 호출 옵션
     * @param <T> 결과 타입
     * @return 결과 future
     * @throws IllegalArgumentException operation 또는 options가 null인 경우
     */
    <T> CompletableFuture<T> execute(Operation<T> operation, CallOptions options);

    /**
     * 공유 게이트를 거치지 않는 우선 실행.
     *
     * <p>재시도/타임아웃/취소 의미는 {@link #execute}와 같습니다.
     * 허용 목록에 있는 이름만 사용할 수 있으며, 별도의 상한을 가진 Priority 게이트만 통과합니다.</p>
     *
     * @param operation 실행할 작업
     * @param options 호출 옵션 (operation 이름이 허용 목록에 있어야 함)
     * @param <T> 결과 타입
     * @return 결과 future
     * @throws IllegalArgumentException 허용 목록에 없는 이름인 경우
     */
    <T> CompletableFuture<T> executePriority(Operation<T> operation, CallOptions options);

    /**
     * Transport 요청 전송 (게이트 경유).
     *
     * <p>2xx가 아닌 응답은 상태 코드를 담은 {@code ConduitException}으로 실패합니다.</p>
     *
     * @param request 요청
     * @param options 호출 옵션
     * @return 2xx 응답 future
     */
    CompletableFuture<TransportResponse> send(TransportRequest request, CallOptions options);

    /**
     * Transport 요청 전송 (Priority 경로).
     *
     * @param request 요청
     * @param options 호출 옵션
     * @return 2xx 응답 future
     */
    CompletableFuture<TransportResponse> sendPriority(TransportRequest request, CallOptions options);

    /**
     * 리소스 타입별 배치 조회기 생성.
     *
     * <p>큐와 타이머는 리소스 타입당 하나입니다. 호출자는 반환된 조회기를 보관해 재사용합니다.</p>
     *
     * @param resource 리소스 타입 이름
     * @param config 배치 설정
     * @param fetcher 다중 키 조회 함수
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return BatchLookup
     * @throws IllegalStateException 같은 이름이 이미 등록된 경우
     */
    <K, V> BatchLookup<K, V> batchLookup(String resource, BatchConfig config, BatchFetcher<K, V> fetcher);

    /**
     * 리소스 타입별 캐시 조회기 생성.
     *
     * @param resource 리소스 타입 이름
     * @param config 캐시 설정
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return CachedLookup
     * @throws IllegalStateException 같은 이름이 이미 등록된 경우
     */
    <K, V> CachedLookup<K, V> cachedLookup(String resource, CacheConfig config);

    /**
     * 공유 Concurrency Gate (관측용).
     *
     * @return 게이트
     */
    ConcurrencyGate gate();

    /**
     * 종료.
     *
     * <p>열린 배치를 flush하고 내부 스케줄러를 중지합니다. 이후 호출은 CANCELLED로 실패합니다.</p>
     */
    void shutdown();
}
