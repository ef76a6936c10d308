package com.ryuqq.conduit.core.outcome;

/**
 * 키 단위 실패 결과.
 *
 * <p>다중 키 응답 자체는 성공했지만 원격이 특정 키에 대해서만 오류를 보고한 경우입니다.
 * 배치 수집기는 이 키의 호출자만 TERMINAL 실패로 완료시킵니다.</p>
 *
 * @param errorCode 오류 코드 (예: SIGE-404)
 * @param message 오류 메시지
 * @param <V> 값 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public record Failed<V>(String errorCode, String message) implements LookupResult<V> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Failed {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }
}
