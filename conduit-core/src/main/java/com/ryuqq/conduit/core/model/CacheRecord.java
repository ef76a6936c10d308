package com.ryuqq.conduit.core.model;

/**
 * 캐시 레코드.
 *
 * <p>값과 생성 시각, 고정 TTL을 함께 보관합니다.
 * TTL이 지난 레코드는 절대 반환되지 않으며, 다음 조회 시 지연 제거(lazy eviction)됩니다.</p>
 *
 * @param value 캐시된 값 (null 불가)
 * @param createdAtMillis 생성 시각 (epoch 밀리초)
 * @param ttlMillis 유효 시간 (밀리초, 양수)
 * @param <V> 값 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public record CacheRecord<V>(V value, long createdAtMillis, long ttlMillis) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException value가 null이거나 ttlMillis가 양수가 아닌 경우
     */
    public CacheRecord {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (ttlMillis <= 0) {
            throw new IllegalArgumentException("ttlMillis must be positive (current: " + ttlMillis + ")");
        }
    }

    /**
     * 주어진 시각 기준으로 만료 여부 확인.
     *
     * <p>경과 시간이 TTL 이상이면 만료로 간주합니다.</p>
     *
     * @param nowMillis 현재 시각 (epoch 밀리초)
     * @return 만료 여부
     */
    public boolean isExpiredAt(long nowMillis) {
        return ageMillisAt(nowMillis) >= ttlMillis;
    }

    /**
     * 주어진 시각 기준 경과 시간.
     *
     * @param nowMillis 현재 시각 (epoch 밀리초)
     * @return 경과 시간 (밀리초, 음수가 되지 않음)
     */
    public long ageMillisAt(long nowMillis) {
        return Math.max(0, nowMillis - createdAtMillis);
    }
}
