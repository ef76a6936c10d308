package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.failure.FailureKind;
import com.ryuqq.conduit.core.protection.RetryPolicy;
import com.ryuqq.conduit.core.spi.TransportException;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * 시도 실패 분류기.
 *
 * <p>분류 우선순위:</p>
 * <ol>
 *   <li>외부 토큰이 발화했으면 원인과 무관하게 CANCELLED (취소가 재시도 정책보다 우선)</li>
 *   <li>시도 타임아웃으로 중단되었으면 TIMEOUT</li>
 *   <li>상태 코드가 있으면 retryableStatus 포함 여부로 TRANSIENT / TERMINAL</li>
 *   <li>네트워크 실패({@link TransportException}, {@link IOException})는 TRANSIENT</li>
 *   <li>그 외는 TERMINAL</li>
 * </ol>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class FailureClassifier {

    private final RetryPolicy policy;

    public FailureClassifier(RetryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.policy = policy;
    }

    /**
     * 실패 분류.
     *
     * @param error 시도 실패 원인 (래핑 제거 후)
     * @param externalCancelReason 외부 토큰 취소 사유 (취소되지 않았으면 null)
     * @param timedOut 이 시도의 타임아웃 타이머가 발화했는지 여부
     * @param attempts 지금까지 수행한 시도 횟수
     * @return 분류된 예외
     */
    public ConduitException classify(Throwable error, String externalCancelReason, boolean timedOut, int attempts) {
        if (externalCancelReason != null) {
            return ConduitException.cancelled(externalCancelReason, attempts, error);
        }
        if (timedOut && isAbort(error)) {
            return ConduitException.timeout(
                "Attempt timed out after " + policy.perAttemptTimeoutMs() + "ms", attempts, error);
        }
        if (error instanceof ConduitException) {
            ConduitException failure = (ConduitException) error;
            Integer status = failure.statusCode();
            if (status != null) {
                return policy.isRetryableStatus(status)
                    ? ConduitException.transientFailure(failure.getMessage(), attempts, status, failure)
                    : ConduitException.terminal(failure.getMessage(), attempts, status, failure);
            }
            return failure.withAttempts(attempts);
        }
        if (error instanceof TransportException || error instanceof IOException) {
            return ConduitException.transientFailure(
                "Network failure: " + error.getMessage(), attempts, null, error);
        }
        if (error instanceof TimeoutException) {
            return ConduitException.timeout("Operation timed out: " + error.getMessage(), attempts, error);
        }
        return ConduitException.terminal(
            "Unexpected failure: " + error.getClass().getSimpleName() + ": " + error.getMessage(),
            attempts, null, error);
    }

    /**
     * 재시도 여부 판단.
     *
     * @param failure 분류된 예외
     * @param attempt 방금 실패한 시도 번호 (0부터)
     * @return 재시도해야 하면 true
     */
    public boolean shouldRetry(ConduitException failure, int attempt) {
        return failure.kind().isRetryable() && attempt < policy.maxRetries();
    }

    private static boolean isAbort(Throwable error) {
        if (error instanceof CancellationException || error instanceof TimeoutException) {
            return true;
        }
        return error instanceof ConduitException && ((ConduitException) error).kind() == FailureKind.CANCELLED;
    }
}
