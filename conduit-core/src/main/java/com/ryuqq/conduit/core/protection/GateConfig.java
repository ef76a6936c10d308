package com.ryuqq.conduit.core.protection;

/**
 * Concurrency Gate 설정.
 *
 * @param maxConcurrent 최대 동시 실행 수 C (양수)
 * @author Conduit Team
 * @since 1.0.0
 */
public record GateConfig(int maxConcurrent) {

    /**
     * 상한이 사실상 없는 설정 (NoOp Gate용).
     */
    public static final GateConfig UNBOUNDED = new GateConfig(Integer.MAX_VALUE);

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxConcurrent is not positive
     */
    public GateConfig {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive (current: " + maxConcurrent + ")");
        }
    }

    public boolean isUnbounded() {
        return maxConcurrent == Integer.MAX_VALUE;
    }
}
