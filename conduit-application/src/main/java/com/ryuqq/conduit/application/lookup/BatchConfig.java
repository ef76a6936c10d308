package com.ryuqq.conduit.application.lookup;

/**
 * Auto-Batching Collector 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>windowMs: 80ms</li>
 *   <li>maxBatchSize: 30</li>
 * </ul>
 *
 * @param windowMs 수집 윈도우 (밀리초, 양수)
 * @param maxBatchSize 즉시 flush 기준 대기 항목 수 (양수)
 * @author Conduit Team
 * @since 1.0.0
 */
public record BatchConfig(long windowMs, int maxBatchSize) {

    /**
     * 기본 설정 생성자.
     */
    public BatchConfig() {
        this(80, 30);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchConfig {
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive (current: " + windowMs + ")");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive (current: " + maxBatchSize + ")");
        }
    }

    public BatchConfig withWindowMs(long windowMs) {
        return new BatchConfig(windowMs, maxBatchSize);
    }

    public BatchConfig withMaxBatchSize(int maxBatchSize) {
        return new BatchConfig(windowMs, maxBatchSize);
    }
}
