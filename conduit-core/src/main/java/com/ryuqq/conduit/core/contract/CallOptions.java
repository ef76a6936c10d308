package com.ryuqq.conduit.core.contract;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.model.OperationName;
import com.ryuqq.conduit.core.protection.RetryPolicy;

/**
 * 단일 호출 옵션.
 *
 * <p>호출 이름, 재시도 정책, 외부 취소 토큰을 담습니다.
 * retryPolicy가 null이면 Orchestrator 기본 정책이 적용됩니다.</p>
 *
 * @param operation 호출 이름 (로그, Priority 허용 목록 검사용)
 * @param retryPolicy 재시도 정책 (null이면 기본값 사용)
 * @param cancellationToken 외부 취소 토큰 (null 불가, 취소 없음은 {@link CancellationToken#none()})
 * @author Conduit Team
 * @since 1.0.0
 */
public record CallOptions(
    OperationName operation,
    RetryPolicy retryPolicy,
    CancellationToken cancellationToken
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operation 또는 cancellationToken이 null인 경우
     */
    public CallOptions {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }
        // retryPolicy는 null 허용 (기본 정책 사용)
    }

    /**
     * 기본 옵션 (이름 없음, 기본 정책, 취소 없음).
     *
     * @return CallOptions
     */
    public static CallOptions defaults() {
        return new CallOptions(OperationName.ANONYMOUS, null, CancellationToken.none());
    }

    /**
     * 이름만 지정한 옵션.
     *
     * @param operation 호출 이름
     * @return CallOptions
     */
    public static CallOptions named(String operation) {
        return new CallOptions(OperationName.of(operation), null, CancellationToken.none());
    }

    public CallOptions withRetryPolicy(RetryPolicy retryPolicy) {
        return new CallOptions(operation, retryPolicy, cancellationToken);
    }

    public CallOptions withCancellation(CancellationToken cancellationToken) {
        return new CallOptions(operation, retryPolicy, cancellationToken);
    }

    /**
     * 적용할 재시도 정책 결정.
     *
     * @param fallback 기본 정책
     * @return 호출별 정책이 있으면 그것, 없으면 fallback
     */
    public RetryPolicy retryPolicyOr(RetryPolicy fallback) {
        return retryPolicy != null ? retryPolicy : fallback;
    }
}
