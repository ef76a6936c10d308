package com.ryuqq.conduit.application.lookup;

/**
 * Response Cache 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>ttlMs: 300000ms (5분)</li>
 *   <li>maxEntries: 0 (상한 없음)</li>
 * </ul>
 *
 * @param ttlMs 레코드 유효 시간 (밀리초, 양수)
 * @param maxEntries 최대 레코드 수 (0이면 상한 없음, 양수면 LRU 제거)
 * @author Conduit Team
 * @since 1.0.0
 */
public record CacheConfig(long ttlMs, int maxEntries) {

    /**
     * 기본 설정 생성자.
     */
    public CacheConfig() {
        this(300_000, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CacheConfig {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive (current: " + ttlMs + ")");
        }
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries cannot be negative (current: " + maxEntries + ")");
        }
    }

    public CacheConfig withTtlMs(long ttlMs) {
        return new CacheConfig(ttlMs, maxEntries);
    }

    public CacheConfig withMaxEntries(int maxEntries) {
        return new CacheConfig(ttlMs, maxEntries);
    }

    /**
     * 레코드 수 상한 여부.
     *
     * @return maxEntries가 양수이면 true
     */
    public boolean isBounded() {
        return maxEntries > 0;
    }
}
