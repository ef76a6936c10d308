package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.core.protection.RetryPolicy;

import java.util.Random;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * 동시에 실패한 호출들이 같은 순간에 몰리지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^attempt, maxDelay) + jitter
 * jitter = random(0, maxJitter)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, maxDelay=4000ms, maxJitter=400ms):</strong></p>
 * <ul>
 *   <li>attempt=0: 1000ms + jitter(0-400ms)</li>
 *   <li>attempt=1: 2000ms + jitter(0-400ms)</li>
 *   <li>attempt=2: 4000ms + jitter(0-400ms)</li>
 *   <li>attempt=3: 8000ms → 4000ms (capped) + jitter(0-400ms)</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final long maxJitterMs;
    private final Random random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1000ms, maxDelay=4000ms, maxJitter=400ms</p>
     */
    public BackoffCalculator() {
        this(1000, 4000, 400, new Random());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
     * @param maxDelayMs 지수 증가 상한 (밀리초, baseDelayMs 이상)
     * @param maxJitterMs 최대 Jitter (밀리초, 0 이상)
     * @param random 난수 생성기 (테스트에서 고정 seed 주입)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, long maxJitterMs, Random random) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs cannot be negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (maxJitterMs < 0) {
            throw new IllegalArgumentException(
                "maxJitterMs cannot be negative (current: " + maxJitterMs + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxJitterMs = maxJitterMs;
        this.random = random;
    }

    /**
     * 재시도 정책의 백오프 수치로 생성.
     *
     * @param policy 재시도 정책
     * @param random 난수 생성기
     * @return BackoffCalculator
     */
    public static BackoffCalculator of(RetryPolicy policy, Random random) {
        return new BackoffCalculator(policy.baseDelayMs(), policy.maxDelayMs(), policy.maxJitterMs(), random);
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 방금 실패한 시도 번호 (0부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    public long calculate(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException(
                "attempt cannot be negative (current: " + attempt + ")"
            );
        }

        // 1. 지수적 백오프 (overflow 방지: 시프트 전에 상한과 비교)
        long exponential;
        if (attempt >= Long.SIZE - 1 || baseDelayMs > (maxDelayMs >> attempt)) {
            exponential = maxDelayMs;
        } else {
            exponential = baseDelayMs << attempt;
        }

        // 2. Jitter 추가 (0 ~ maxJitter), 상한 적용 후에 더함
        long jitter = maxJitterMs == 0 ? 0 : random.nextLong(maxJitterMs + 1);
        return exponential + jitter;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public long getMaxJitterMs() {
        return maxJitterMs;
    }
}
