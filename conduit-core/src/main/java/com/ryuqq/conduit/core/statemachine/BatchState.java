package com.ryuqq.conduit.core.statemachine;

/**
 * 배치 수집기의 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *   │
 *   ▼ (첫 enqueue, 타이머 시작)
 * COLLECTING
 *   │
 *   ▼ (타이머 만료 또는 maxBatchSize 도달)
 * FLUSHING
 *   │
 *   ▼ (대기열 인출 완료, 결합 요청 발송)
 * IDLE
 * </pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public enum BatchState {

    /**
     * 대기열 비어 있음, 타이머 없음.
     */
    IDLE,

    /**
     * 배치 윈도우 진행 중 (타이머 무장).
     */
    COLLECTING,

    /**
     * 대기열 인출 및 결합 요청 발송 중.
     */
    FLUSHING;

    /**
     * enqueue가 현재 윈도우에 합류할 수 있는 상태인지 확인.
     *
     * @return COLLECTING인 경우 true
     */
    public boolean isCollecting() {
        return this == COLLECTING;
    }
}
