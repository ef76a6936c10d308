package com.ryuqq.conduit.core.failure;

/**
 * 실패 분류.
 *
 * <p>모든 호출은 값으로 완료되거나 아래 네 가지 중 하나로 실패합니다.</p>
 *
 * <pre>
 * CANCELLED  → 재시도 없음, 즉시 전파
 * TIMEOUT    → 한도까지 재시도, 이후 종료 TIMEOUT
 * TRANSIENT  → 백오프 재시도, 이후 마지막 오류 전파
 * TERMINAL   → 재시도 없음, 즉시 전파
 * </pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * 호출자 취소 또는 외부 신호.
     */
    CANCELLED,

    /**
     * 시도별 마감 시간 초과.
     */
    TIMEOUT,

    /**
     * 네트워크 실패 또는 재시도 대상 상태 코드 (429, 502, 503, 504 등).
     */
    TRANSIENT,

    /**
     * 그 외 모든 실패 (재시도 불가 상태 코드, 응답 형식 오류 등).
     */
    TERMINAL;

    /**
     * 재시도 정책 적용 대상인지 확인.
     *
     * @return TIMEOUT 또는 TRANSIENT인 경우 true
     */
    public boolean isRetryable() {
        return this == TIMEOUT || this == TRANSIENT;
    }
}
