package com.ryuqq.conduit.core.outcome;

/**
 * 명시적 "없음" 결과.
 *
 * <p>배치 응답에 키가 포함되지 않았을 때 해당 호출자에게 전달됩니다.</p>
 *
 * @param <V> 값 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public record Missing<V>() implements LookupResult<V> {
}
