package com.ryuqq.conduit.core.protection;

import java.util.Set;

/**
 * 재시도 및 시도별 타임아웃 정책.
 *
 * <p>ResilientExecutor가 한 논리 Operation을 실행할 때 적용하는 수치 정책입니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxRetries = 3 (총 4회 시도)</li>
 *   <li>perAttemptTimeoutMs = 45000</li>
 *   <li>retryableStatus = 429, 502, 503, 504</li>
 *   <li>baseDelayMs = 1000, maxDelayMs = 4000, maxJitterMs = 400</li>
 * </ul>
 *
 * <p>대기 시간: {@code min(baseDelay * 2^attempt, maxDelay) + random(0, maxJitter)}</p>
 *
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param perAttemptTimeoutMs 시도별 타임아웃 (밀리초, 양수)
 * @param retryableStatus 일시적 실패로 간주할 상태 코드 집합
 * @param baseDelayMs 백오프 기본 지연 (밀리초, 0 이상)
 * @param maxDelayMs 지수 백오프 상한 (밀리초, baseDelayMs 이상)
 * @param maxJitterMs 최대 jitter (밀리초, 0 이상)
 * @author Conduit Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxRetries,
    long perAttemptTimeoutMs,
    Set<Integer> retryableStatus,
    long baseDelayMs,
    long maxDelayMs,
    long maxJitterMs
) {

    public static final Set<Integer> DEFAULT_RETRYABLE_STATUS = Set.of(429, 502, 503, 504);

    /**
     * 기본 설정 생성자.
     */
    public RetryPolicy() {
        this(3, 45_000, DEFAULT_RETRYABLE_STATUS, 1000, 4000, 400);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative (current: " + maxRetries + ")");
        }
        if (perAttemptTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "perAttemptTimeoutMs must be positive (current: " + perAttemptTimeoutMs + ")");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs cannot be negative (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (maxJitterMs < 0) {
            throw new IllegalArgumentException("maxJitterMs cannot be negative (current: " + maxJitterMs + ")");
        }
        retryableStatus = retryableStatus == null ? Set.of() : Set.copyOf(retryableStatus);
    }

    /**
     * 재시도 없는 정책 (단일 시도).
     *
     * @param perAttemptTimeoutMs 시도 타임아웃
     * @return RetryPolicy
     */
    public static RetryPolicy noRetry(long perAttemptTimeoutMs) {
        return new RetryPolicy(0, perAttemptTimeoutMs, DEFAULT_RETRYABLE_STATUS, 0, 0, 0);
    }

    /**
     * 상태 코드가 재시도 대상인지 확인.
     *
     * @param statusCode HTTP 상태 코드
     * @return 재시도 대상이면 true
     */
    public boolean isRetryableStatus(int statusCode) {
        return retryableStatus.contains(statusCode);
    }

    /**
     * 최대 시도 횟수 (maxRetries + 1).
     *
     * @return 총 시도 횟수
     */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, perAttemptTimeoutMs, retryableStatus, baseDelayMs, maxDelayMs, maxJitterMs);
    }

    public RetryPolicy withPerAttemptTimeoutMs(long perAttemptTimeoutMs) {
        return new RetryPolicy(maxRetries, perAttemptTimeoutMs, retryableStatus, baseDelayMs, maxDelayMs, maxJitterMs);
    }

    public RetryPolicy withRetryableStatus(Set<Integer> retryableStatus) {
        return new RetryPolicy(maxRetries, perAttemptTimeoutMs, retryableStatus, baseDelayMs, maxDelayMs, maxJitterMs);
    }

    /**
     * 백오프 파라미터를 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBackoff(long baseDelayMs, long maxDelayMs, long maxJitterMs) {
        return new RetryPolicy(maxRetries, perAttemptTimeoutMs, retryableStatus, baseDelayMs, maxDelayMs, maxJitterMs);
    }
}
