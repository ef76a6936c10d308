package com.ryuqq.conduit.core.contract;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 불투명(opaque) 요청.
 *
 * <p>Conduit은 target의 의미를 알지 못합니다. 경로, 메서드, 헤더, 본문을 그대로 Transport에 전달합니다.</p>
 *
 * @param target 요청 대상 (예: "/produtos/saldos")
 * @param method HTTP 메서드 (예: GET, POST)
 * @param headers 요청 헤더 (불변 사본으로 보관)
 * @param body 요청 본문 (null 가능)
 * @author Conduit Team
 * @since 1.0.0
 */
public record TransportRequest(
    String target,
    String method,
    Map<String, String> headers,
    String body
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException target 또는 method가 null이거나 빈 문자열인 경우
     */
    public TransportRequest {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target cannot be null or blank");
        }
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        // body는 null 허용
    }

    public static TransportRequest get(String target) {
        return new TransportRequest(target, "GET", Map.of(), null);
    }

    public static TransportRequest post(String target, String body) {
        return new TransportRequest(target, "POST", Map.of(), body);
    }

    /**
     * 헤더 하나를 추가한 새 인스턴스 생성.
     *
     * @param name 헤더 이름
     * @param value 헤더 값
     * @return 새 TransportRequest
     */
    public TransportRequest withHeader(String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("header name cannot be null or blank");
        }
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.put(name, value);
        return new TransportRequest(target, method, merged, body);
    }
}
