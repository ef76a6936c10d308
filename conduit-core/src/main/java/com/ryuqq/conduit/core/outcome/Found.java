package com.ryuqq.conduit.core.outcome;

/**
 * 값이 존재하는 조회 결과.
 *
 * @param value 조회된 값 (null 불가)
 * @param <V> 값 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public record Found<V>(V value) implements LookupResult<V> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우 (없음은 {@link Missing}으로 표현)
     */
    public Found {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null, use Missing for absent keys");
        }
    }
}
