package com.ryuqq.conduit.core.spi;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.contract.TransportRequest;
import com.ryuqq.conduit.core.contract.TransportResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Transport SPI.
 *
 * <p>원격 API Gateway와의 불투명한 요청/응답 왕복을 담당합니다.
 * Conduit은 target의 의미를 알지 못하며, 상태 코드 해석은 호출 측(Executor)이 수행합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>모든 상태 코드(4xx, 5xx 포함)는 정상 완료된 {@link TransportResponse}로 반환</li>
 *   <li>네트워크 수준 실패는 {@link TransportException}으로 예외 완료</li>
 *   <li>cancellationToken이 취소되면 진행 중인 왕복을 중단하고 future를 취소/실패 처리</li>
 *   <li>thread-safe해야 함 (여러 Slot에서 동시 호출)</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public interface Transport {

    /**
     * 요청 전송.
     *
     * @param request 요청
     * @param cancellationToken 시도 범위의 취소 토큰 (타임아웃 또는 호출자 취소 시 발화)
     * @return 응답 future
     */
    CompletableFuture<TransportResponse> send(TransportRequest request, CancellationToken cancellationToken);
}
