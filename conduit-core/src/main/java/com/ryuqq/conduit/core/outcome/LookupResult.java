package com.ryuqq.conduit.core.outcome;

/**
 * 단일 키 조회 결과.
 *
 * <p>배치/캐시 계층으로 들어오는 응답 형태는 경계에서 이 고정 계약으로 좁혀집니다.
 * 내부 로직은 검증되지 않은 응답 구조에 따라 분기하지 않습니다.</p>
 * <ul>
 *   <li>{@link Found}: 키에 해당하는 값이 존재</li>
 *   <li>{@link Missing}: 명시적 "없음" (호출자를 조용히 누락시키지 않음)</li>
 *   <li>{@link Failed}: 해당 키에 대해서만 원격이 오류를 보고</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 알려집니다.</p>
 *
 * @param <V> 값 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public sealed interface LookupResult<V> permits Found, Missing, Failed {

    static <V> LookupResult<V> found(V value) {
        return new Found<>(value);
    }

    static <V> LookupResult<V> missing() {
        return new Missing<>();
    }

    static <V> LookupResult<V> failed(String errorCode, String message) {
        return new Failed<>(errorCode, message);
    }

    /**
     * 값이 존재하는지 확인.
     *
     * @return Found인 경우 true
     */
    default boolean isFound() {
        return this instanceof Found;
    }

    /**
     * 명시적 없음인지 확인.
     *
     * @return Missing인 경우 true
     */
    default boolean isMissing() {
        return this instanceof Missing;
    }

    /**
     * 키 단위 실패인지 확인.
     *
     * @return Failed인 경우 true
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * 값 조회 (Found가 아니면 null).
     *
     * @return 값 또는 null
     */
    default V valueOrNull() {
        if (this instanceof Found) {
            return ((Found<V>) this).value();
        }
        return null;
    }
}
