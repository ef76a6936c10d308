package com.ryuqq.conduit.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.conduit.application.lookup.BatchFetcher;
import com.ryuqq.conduit.core.contract.TransportRequest;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.outcome.LookupResult;
import com.ryuqq.conduit.core.spi.Transport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 다중 키 조회의 JSON 요청/응답 변환기.
 *
 * <p><strong>요청:</strong> {@code {"skus": ["a", "b"]}}</p>
 * <p><strong>응답:</strong></p>
 * <pre>
 * {
 *   "results": [
 *     { "sku": "a", "found": true, "quantidade": 3 },
 *     { "sku": "b", "found": false },
 *     { "sku": "c", "error": "warehouse offline", "code": "UPSTREAM" }
 *   ]
 * }
 * </pre>
 *
 * <p>항목별 변환 규칙:</p>
 * <ul>
 *   <li>{@code error} 필드가 있으면 {@code Failed(code, error)} (code 없으면 "ERROR")</li>
 *   <li>{@code found == false}면 {@code Missing}</li>
 *   <li>그 외는 항목 전체를 값으로 하는 {@code Found}</li>
 * </ul>
 *
 * <p>형식이 맞지 않는 응답은 {@code ConduitException(TERMINAL)}로 거부합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class JsonBatchCodec {

    static final String RESULTS_FIELD = "results";
    static final String DEFAULT_ERROR_CODE = "ERROR";

    private final ObjectMapper mapper;
    private final String requestField;
    private final String keyField;

    /**
     * 생성자.
     *
     * @param requestField 요청 본문에서 키 배열을 담는 필드 (예: "skus")
     * @param keyField 응답 항목에서 키를 담는 필드 (예: "sku")
     */
    public JsonBatchCodec(String requestField, String keyField) {
        this(new ObjectMapper(), requestField, keyField);
    }

    public JsonBatchCodec(ObjectMapper mapper, String requestField, String keyField) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (requestField == null || requestField.isBlank()) {
            throw new IllegalArgumentException("requestField cannot be null or blank");
        }
        if (keyField == null || keyField.isBlank()) {
            throw new IllegalArgumentException("keyField cannot be null or blank");
        }
        this.mapper = mapper;
        this.requestField = requestField;
        this.keyField = keyField;
    }

    /**
     * 키 목록을 요청 본문으로 변환.
     *
     * @param keys 키 목록
     * @return JSON 문자열
     */
    public String encode(List<String> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        ObjectNode root = mapper.createObjectNode();
        ArrayNode array = root.putArray(requestField);
        keys.forEach(array::add);
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw ConduitException.terminal("Failed to encode batch request: " + e.getOriginalMessage(), 0, null, e);
        }
    }

    /**
     * 응답 본문을 키별 결과로 변환.
     *
     * @param body 응답 본문
     * @return 키별 결과 (응답 순서 유지, 중복 키는 마지막 항목 사용)
     * @throws ConduitException 형식이 맞지 않는 경우 (TERMINAL)
     */
    public Map<String, LookupResult<JsonNode>> decode(String body) {
        if (body == null || body.isBlank()) {
            throw malformed("empty body");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw ConduitException.terminal("Malformed batch response: " + e.getOriginalMessage(), 0, null, e);
        }
        JsonNode results = root.get(RESULTS_FIELD);
        if (results == null || !results.isArray()) {
            throw malformed("'" + RESULTS_FIELD + "' array is missing");
        }

        Map<String, LookupResult<JsonNode>> decoded = new LinkedHashMap<>();
        for (JsonNode item : results) {
            JsonNode key = item.get(keyField);
            if (!item.isObject() || key == null || !key.isValueNode() || key.isNull()) {
                throw malformed("result item without '" + keyField + "': " + item);
            }
            decoded.put(key.asText(), toResult(item));
        }
        return decoded;
    }

    /**
     * Transport를 통해 POST로 조회하는 BatchFetcher 생성.
     *
     * <p>non-2xx 응답은 상태 코드를 담은 예외로 실패하므로 Executor의 재시도 대상 판단을 받습니다.</p>
     *
     * @param transport Transport
     * @param target 다중 조회 엔드포인트 (예: /produtos/saldos)
     * @return BatchFetcher
     */
    public BatchFetcher<String, JsonNode> fetcher(Transport transport, String target) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        return (keys, attemptToken) -> transport
            .send(TransportRequest.post(target, encode(keys)), attemptToken)
            .thenApply(response -> {
                if (!response.isSuccessful()) {
                    throw ConduitException.unexpectedStatus(response.statusCode(), "POST " + target);
                }
                return decode(response.body());
            });
    }

    private LookupResult<JsonNode> toResult(JsonNode item) {
        JsonNode error = item.get("error");
        if (error != null && !error.isNull()) {
            String code = item.path("code").asText("");
            String message = error.isValueNode() ? error.asText() : error.toString();
            return LookupResult.failed(
                code.isBlank() ? DEFAULT_ERROR_CODE : code,
                message.isBlank() ? "unspecified error" : message);
        }
        JsonNode found = item.get("found");
        if (found != null && found.isBoolean() && !found.booleanValue()) {
            return LookupResult.missing();
        }
        return LookupResult.found(item);
    }

    private static ConduitException malformed(String detail) {
        return ConduitException.terminal("Malformed batch response: " + detail, 0, null, null);
    }

    public String getRequestField() {
        return requestField;
    }

    public String getKeyField() {
        return keyField;
    }
}
