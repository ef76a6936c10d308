package com.ryuqq.conduit.adapter.inmemory.transport;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.contract.TransportRequest;
import com.ryuqq.conduit.core.contract.TransportResponse;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.spi.Transport;
import com.ryuqq.conduit.core.spi.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link Transport} SPI backed by a route table.
 *
 * <p>Stands in for the remote API gateway in local runs and tests. Each route is keyed
 * by {@code METHOD target} and answered by a {@link Handler}. Unknown routes answer 404.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Scripted responses per route (the last scripted response repeats)</li>
 *   <li>Optional fixed latency, completed on an internal scheduler</li>
 *   <li>Cancellation: a fired token fails the pending call with {@code CANCELLED}</li>
 *   <li>Call log and in-flight high-water mark for assertions</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryTransport transport = new InMemoryTransport()
 *     .withLatency(100)
 *     .respondInSequence("GET", "/produtos/1",
 *         TransportResponse.of(503, ""),
 *         TransportResponse.of(200, "{\"sku\":\"1\"}"));
 * </pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class InMemoryTransport implements Transport, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransport.class);

    private final Map<String, Handler> routes = new ConcurrentHashMap<>();
    private final List<TransportRequest> calls = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final ScheduledExecutorService latencyScheduler;
    private volatile long latencyMs;

    /**
     * Creates a transport with no routes and no latency.
     */
    public InMemoryTransport() {
        this.latencyScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "conduit-inmemory-transport");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Answers one route with a handler.
     *
     * @param method HTTP method
     * @param target request target
     * @param handler route handler
     * @return this transport
     */
    public InMemoryTransport on(String method, String target, Handler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        routes.put(routeKey(method, target), handler);
        return this;
    }

    /**
     * Answers one route with a fixed response.
     *
     * @param method HTTP method
     * @param target request target
     * @param statusCode status code
     * @param body response body
     * @return this transport
     */
    public InMemoryTransport respond(String method, String target, int statusCode, String body) {
        TransportResponse response = TransportResponse.of(statusCode, body);
        return on(method, target, request -> response);
    }

    /**
     * Answers one route with responses in order; the last one repeats.
     *
     * @param method HTTP method
     * @param target request target
     * @param responses scripted responses (at least one)
     * @return this transport
     */
    public InMemoryTransport respondInSequence(String method, String target, TransportResponse... responses) {
        if (responses == null || responses.length == 0) {
            throw new IllegalArgumentException("responses cannot be empty");
        }
        Deque<TransportResponse> script = new ArrayDeque<>(List.of(responses));
        return on(method, target, request -> {
            synchronized (script) {
                return script.size() > 1 ? script.pollFirst() : script.peekFirst();
            }
        });
    }

    /**
     * Makes every call for the route fail at the network level.
     *
     * @param method HTTP method
     * @param target request target
     * @return this transport
     */
    public InMemoryTransport failNetwork(String method, String target) {
        return on(method, target, request -> {
            throw new TransportException(request.target(), "connection refused");
        });
    }

    /**
     * Sets a fixed latency applied to every call.
     *
     * @param latencyMs latency in milliseconds (0 = complete synchronously)
     * @return this transport
     */
    public InMemoryTransport withLatency(long latencyMs) {
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs cannot be negative (current: " + latencyMs + ")");
        }
        this.latencyMs = latencyMs;
        return this;
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

        calls.add(request);
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);

        CompletableFuture<TransportResponse> future = new CompletableFuture<>();
        future.whenComplete((response, error) -> inFlight.decrementAndGet());

        CancellationToken.Registration registration = token.onCancel(
            () -> future.completeExceptionally(ConduitException.cancelled(token.reason())));
        future.whenComplete((response, error) -> registration.close());

        if (latencyMs == 0) {
            answer(request, future);
        } else {
            ScheduledFuture<?> scheduled = latencyScheduler.schedule(
                () -> answer(request, future), latencyMs, TimeUnit.MILLISECONDS);
            future.whenComplete((response, error) -> scheduled.cancel(false));
        }
        return future;
    }

    private void answer(TransportRequest request, CompletableFuture<TransportResponse> future) {
        if (future.isDone()) {
            return;
        }
        Handler handler = routes.get(routeKey(request.method(), request.target()));
        if (handler == null) {
            log.debug("No route for {} {}, answering 404", request.method(), request.target());
            future.complete(TransportResponse.of(404, ""));
            return;
        }
        try {
            future.complete(handler.handle(request));
        } catch (TransportException | RuntimeException e) {
            future.completeExceptionally(e);
        }
    }

    /**
     * Snapshot of the call log in send order.
     *
     * @return requests sent so far
     */
    public List<TransportRequest> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    /**
     * Number of calls for one route.
     *
     * @param method HTTP method
     * @param target request target
     * @return call count
     */
    public int callCount(String method, String target) {
        synchronized (calls) {
            return (int) calls.stream()
                .filter(call -> call.method().equalsIgnoreCase(method) && call.target().equals(target))
                .count();
        }
    }

    public int inFlightCount() {
        return inFlight.get();
    }

    /**
     * Highest number of calls observed in flight at once.
     *
     * @return high-water mark
     */
    public int maxObservedInFlight() {
        return maxInFlight.get();
    }

    /**
     * Clears routes, the call log and the in-flight high-water mark.
     */
    public void reset() {
        routes.clear();
        calls.clear();
        maxInFlight.set(inFlight.get());
    }

    @Override
    public void close() {
        latencyScheduler.shutdownNow();
    }

    private static String routeKey(String method, String target) {
        if (method == null || method.isBlank() || target == null || target.isBlank()) {
            throw new IllegalArgumentException("method and target cannot be null or blank");
        }
        return method.toUpperCase() + " " + target;
    }

    /**
     * Route handler.
     */
    @FunctionalInterface
    public interface Handler {

        /**
         * Answers one request.
         *
         * @param request request
         * @return response (any status)
         * @throws TransportException to simulate a network failure
         */
        TransportResponse handle(TransportRequest request) throws TransportException;
    }
}
