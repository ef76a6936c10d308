package com.ryuqq.conduit.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.contract.TransportRequest;
import com.ryuqq.conduit.core.contract.TransportResponse;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.failure.FailureKind;
import com.ryuqq.conduit.core.outcome.Failed;
import com.ryuqq.conduit.core.outcome.LookupResult;
import com.ryuqq.conduit.core.spi.Transport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * JsonBatchCodec 테스트.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class JsonBatchCodecTest {

    private final JsonBatchCodec codec = new JsonBatchCodec("skus", "sku");

    @Mock
    private Transport transport;

    @Test
    @DisplayName("키 목록을 요청 필드 배열로 인코딩한다")
    void encode_요청_본문() {
        assertThat(codec.encode(List.of("1001", "1002"))).isEqualTo("{\"skus\":[\"1001\",\"1002\"]}");
    }

    @Test
    @DisplayName("found/미발견/오류 항목을 Found/Missing/Failed로 변환한다")
    void decode_항목별_변환() {
        // given
        String body = "{\"results\":["
            + "{\"sku\":\"1001\",\"found\":true,\"quantidade\":7},"
            + "{\"sku\":\"1002\",\"found\":false},"
            + "{\"sku\":\"1003\",\"error\":\"warehouse offline\",\"code\":\"UPSTREAM\"}"
            + "],\"total\":3}";

        // when
        Map<String, LookupResult<JsonNode>> results = codec.decode(body);

        // then
        assertThat(results).containsOnlyKeys("1001", "1002", "1003");
        assertThat(results.get("1001").isFound()).isTrue();
        assertThat(results.get("1001").valueOrNull().get("quantidade").asInt()).isEqualTo(7);
        assertThat(results.get("1002").isMissing()).isTrue();
        Failed<JsonNode> failed = (Failed<JsonNode>) results.get("1003");
        assertThat(failed.errorCode()).isEqualTo("UPSTREAM");
        assertThat(failed.message()).isEqualTo("warehouse offline");
    }

    @Test
    @DisplayName("code가 없는 오류 항목은 ERROR 코드를 사용하고 숫자 키는 문자열로 읽는다")
    void decode_기본_오류_코드() {
        Map<String, LookupResult<JsonNode>> results = codec.decode(
            "{\"results\":[{\"sku\":42,\"error\":\"timeout\"}]}");

        Failed<JsonNode> failed = (Failed<JsonNode>) results.get("42");
        assertThat(failed.errorCode()).isEqualTo(JsonBatchCodec.DEFAULT_ERROR_CODE);
    }

    @Test
    @DisplayName("형식이 맞지 않는 응답은 TERMINAL로 거부한다")
    void decode_형식_오류() {
        assertTerminal(() -> codec.decode("not json"));
        assertTerminal(() -> codec.decode(""));
        assertTerminal(() -> codec.decode("{\"items\":[]}"));
        assertTerminal(() -> codec.decode("{\"results\":{}}"));
        assertTerminal(() -> codec.decode("{\"results\":[{\"found\":true}]}"));
        assertTerminal(() -> codec.decode("{\"results\":[\"1001\"]}"));
    }

    private static void assertTerminal(Runnable decode) {
        assertThatThrownBy(decode::run)
            .isInstanceOf(ConduitException.class)
            .satisfies(error -> assertThat(((ConduitException) error).kind()).isEqualTo(FailureKind.TERMINAL));
    }

    @Test
    @DisplayName("fetcher는 POST로 보내고 응답을 디코딩한다")
    void fetcher_POST_후_디코딩() {
        // given
        CancellationToken token = CancellationToken.create();
        when(transport.send(any(), eq(token))).thenReturn(CompletableFuture.completedFuture(
            TransportResponse.of(200, "{\"results\":[{\"sku\":\"1001\",\"found\":true}]}")));

        // when
        Map<String, LookupResult<JsonNode>> results = codec.fetcher(transport, "/produtos/saldos")
            .fetch(List.of("1001"), token).join();

        // then
        ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).send(captor.capture(), eq(token));
        assertThat(captor.getValue().method()).isEqualTo("POST");
        assertThat(captor.getValue().target()).isEqualTo("/produtos/saldos");
        assertThat(captor.getValue().body()).isEqualTo("{\"skus\":[\"1001\"]}");
        assertThat(results.get("1001").isFound()).isTrue();
    }

    @Test
    @DisplayName("fetcher는 non-2xx 응답을 상태 코드를 담은 예외로 실패시킨다")
    void fetcher_non_2xx_실패() {
        // given
        when(transport.send(any(), any())).thenReturn(CompletableFuture.completedFuture(
            TransportResponse.of(503, "")));

        // when
        Throwable failure = codec.fetcher(transport, "/produtos/saldos")
            .fetch(List.of("1001"), CancellationToken.none())
            .handle((value, error) -> ConduitException.unwrap(error))
            .join();

        // then
        assertThat(failure).isInstanceOf(ConduitException.class);
        assertThat(((ConduitException) failure).statusCode()).isEqualTo(503);
    }
}
