package com.ryuqq.conduit.application.orchestrator;

import com.ryuqq.conduit.core.cancel.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * 하나의 논리 작업 (재시도 단위).
 *
 * <p>Executor는 시도마다 {@link #run(CancellationToken)}을 새로 호출합니다.
 * 구현체는 전달된 시도 토큰이 발화하면 진행 중인 작업을 중단해야 합니다.</p>
 *
 * <p><strong>실패 규약:</strong></p>
 * <ul>
 *   <li>{@code ConduitException} - 분류가 이미 끝난 실패 (상태 코드 포함 가능)</li>
 *   <li>{@code TransportException} - 네트워크 실패 (TRANSIENT)</li>
 *   <li>그 외 예외 - TERMINAL</li>
 * </ul>
 *
 * @param <T> 결과 타입
 * @author Conduit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Operation<T> {

    /**
     * 한 번의 시도 실행.
     *
     * @param attemptToken 시도 범위 취소 토큰 (타임아웃 또는 외부 취소 시 발화)
     * @return 결과 future
     */
    CompletableFuture<T> run(CancellationToken attemptToken);
}
