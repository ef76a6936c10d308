package com.ryuqq.conduit.core.protection;

import com.ryuqq.conduit.core.cancel.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * Concurrency Gate SPI.
 *
 * <p>공유 Transport에 대한 동시 실행 수를 제한합니다.
 * 초과 호출자는 FIFO 대기열에서 기다리며, 대기 중 취소할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ConcurrencyGate gate = ...;
 *
 * gate.acquire(token).thenCompose(slot ->
 *     operation.run()
 *         .whenComplete((result, error) -> gate.release(slot)));
 * }</pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>반납되지 않은 Slot 수는 {@link GateConfig#maxConcurrent()}를 넘지 않음</li>
 *   <li>대기자는 도착 순서(FIFO)대로 Slot을 받음</li>
 *   <li>취소된 대기자는 Slot을 소비하지 않고 대기열에서 제거됨</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public interface ConcurrencyGate {

    /**
     * Slot 획득.
     *
     * <p>활성 수가 C 미만이면 이미 완료된 future를 반환합니다.
     * 그렇지 않으면 대기열 끝에 추가되어, 이후 release()에서 Slot을 넘겨받거나
     * 토큰이 취소되어 CANCELLED로 실패할 때까지 대기합니다.</p>
     *
     * @param cancellationToken 대기 중 취소 신호
     * @return Slot future (취소 시 ConduitException(CANCELLED)로 실패)
     */
    CompletableFuture<Slot> acquire(CancellationToken cancellationToken);

    /**
     * Slot 반납.
     *
     * <p>대기자가 있으면 반납된 Slot을 대기열 맨 앞 호출자에게 직접 넘기고,
     * 없으면 활성 수를 감소시킵니다. 이미 반납된 Slot은 무시합니다.</p>
     *
     * @param slot 반납할 Slot
     */
    void release(Slot slot);

    /**
     * 현재 반납되지 않은 Slot 수.
     *
     * @return 활성 Slot 수
     */
    int activeCount();

    /**
     * 현재 대기 중인 호출자 수.
     *
     * @return 대기자 수
     */
    int waitingCount();

    /**
     * Gate 설정 조회.
     *
     * @return 설정
     */
    GateConfig config();
}
