package com.ryuqq.conduit.core.contract;

import java.util.Map;

/**
 * 불투명(opaque) 응답.
 *
 * @param statusCode HTTP 상태 코드
 * @param headers 응답 헤더 (불변 사본)
 * @param body 응답 본문 (null 가능)
 * @author Conduit Team
 * @since 1.0.0
 */
public record TransportResponse(
    int statusCode,
    Map<String, String> headers,
    String body
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException statusCode가 100~599 범위를 벗어난 경우
     */
    public TransportResponse {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be between 100 and 599 (current: " + statusCode + ")");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, Map.of(), body);
    }

    /**
     * 2xx 응답인지 확인.
     *
     * @return 성공 응답 여부
     */
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
