package com.ryuqq.conduit.adapter.http;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.contract.TransportRequest;
import com.ryuqq.conduit.core.contract.TransportResponse;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.spi.Transport;
import com.ryuqq.conduit.core.spi.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * JDK {@link HttpClient} 기반 Transport.
 *
 * <p>요청 대상(target)은 기본 URI 뒤에 이어 붙입니다. 절대 URL이면 그대로 사용합니다.</p>
 *
 * <p><strong>실패 매핑:</strong></p>
 * <ul>
 *   <li>{@link IOException} (연결 실패, HTTP 타임아웃 등) → {@link TransportException}</li>
 *   <li>취소 토큰 발화 → 응답 future 취소 + {@code ConduitException(CANCELLED)}</li>
 *   <li>상태 코드는 해석하지 않음 (non-2xx도 정상 응답으로 반환)</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class HttpClientTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(HttpClientTransport.class);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final String CONTENT_TYPE = "Content-Type";

    private final URI baseUri;
    private final HttpClient client;

    /**
     * 기본 HttpClient로 생성 (연결 타임아웃 10초).
     *
     * @param baseUri 기본 URI (예: https://gateway.example.com/api)
     */
    public HttpClientTransport(URI baseUri) {
        this(baseUri, HttpClient.newBuilder().connectTimeout(DEFAULT_CONNECT_TIMEOUT).build());
    }

    /**
     * 외부 HttpClient로 생성.
     *
     * @param baseUri 기본 URI
     * @param client HttpClient
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public HttpClientTransport(URI baseUri, HttpClient client) {
        if (baseUri == null) {
            throw new IllegalArgumentException("baseUri cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.baseUri = baseUri;
        this.client = client;
    }

    @Override
    public CompletableFuture<TransportResponse> send(TransportRequest request, CancellationToken cancellationToken) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        CancellationToken token = cancellationToken == null ? CancellationToken.none() : cancellationToken;
        if (token.isCancelled()) {
            return CompletableFuture.failedFuture(ConduitException.cancelled(token.reason()));
        }

        HttpRequest httpRequest = toHttpRequest(request);
        CompletableFuture<HttpResponse<String>> exchange =
            client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        CompletableFuture<TransportResponse> result = new CompletableFuture<>();

        CancellationToken.Registration registration = token.onCancel(() -> {
            exchange.cancel(true);
            result.completeExceptionally(ConduitException.cancelled(token.reason()));
        });

        exchange.whenComplete((response, error) -> {
            registration.close();
            if (error == null) {
                result.complete(toTransportResponse(response));
                return;
            }
            Throwable cause = ConduitException.unwrap(error);
            if (cause instanceof IOException) {
                log.debug("{} {} failed at network level: {}", request.method(), request.target(), cause.toString());
                result.completeExceptionally(new TransportException(request.target(), cause.getMessage(), cause));
            } else {
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    /**
     * 요청 대상을 절대 URI로 변환.
     *
     * @param target 요청 대상
     * @return 절대 URI
     * @throws IllegalArgumentException URI 문법이 잘못된 경우
     */
    URI resolve(String target) {
        if (target.startsWith("http://") || target.startsWith("https://")) {
            return URI.create(target);
        }
        String base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + (target.startsWith("/") ? target : "/" + target));
    }

    private HttpRequest toHttpRequest(TransportRequest request) {
        HttpRequest.BodyPublisher publisher = request.body() == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(request.body());
        HttpRequest.Builder builder = HttpRequest.newBuilder(resolve(request.target()))
            .method(request.method(), publisher);

        boolean hasContentType = false;
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
            hasContentType |= CONTENT_TYPE.equalsIgnoreCase(header.getKey());
        }
        if (request.body() != null && !hasContentType) {
            builder.header(CONTENT_TYPE, "application/json");
        }
        return builder.build();
    }

    private static TransportResponse toTransportResponse(HttpResponse<String> response) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> header : response.headers().map().entrySet()) {
            if (!header.getValue().isEmpty()) {
                headers.put(header.getKey(), header.getValue().get(0));
            }
        }
        return new TransportResponse(response.statusCode(), headers, response.body());
    }

    public URI getBaseUri() {
        return baseUri;
    }
}
