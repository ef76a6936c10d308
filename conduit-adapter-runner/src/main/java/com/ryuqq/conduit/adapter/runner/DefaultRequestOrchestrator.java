package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.adapter.inmemory.store.InMemoryCacheStore;
import com.ryuqq.conduit.application.lookup.BatchConfig;
import com.ryuqq.conduit.application.lookup.BatchFetcher;
import com.ryuqq.conduit.application.lookup.BatchLookup;
import com.ryuqq.conduit.application.lookup.CacheConfig;
import com.ryuqq.conduit.application.lookup.CachedLookup;
import com.ryuqq.conduit.application.orchestrator.Operation;
import com.ryuqq.conduit.application.orchestrator.RequestOrchestrator;
import com.ryuqq.conduit.core.contract.CallOptions;
import com.ryuqq.conduit.core.contract.TransportRequest;
import com.ryuqq.conduit.core.contract.TransportResponse;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.protection.ConcurrencyGate;
import com.ryuqq.conduit.core.protection.Slot;
import com.ryuqq.conduit.core.spi.CacheStore;
import com.ryuqq.conduit.core.spi.Transport;
import com.ryuqq.conduit.core.time.SystemTimeSource;
import com.ryuqq.conduit.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link RequestOrchestrator} 기본 구현.
 *
 * <p>프로세스 시작 시 한 번 생성해 모든 호출 지점에 주입합니다. 전역 정적 상태를 갖지 않으므로
 * 테스트마다 독립된 인스턴스를 만들 수 있습니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>{@link FifoConcurrencyGate} - 공유 게이트 (상한 C)</li>
 *   <li>{@link PriorityLane} - 우회 경로 (별도 상한 + 허용 목록)</li>
 *   <li>{@link ResilientExecutor} - 타임아웃/재시도/취소</li>
 *   <li>{@link AutoBatchCollector} - 리소스 타입별 배치 수집기</li>
 *   <li>{@link DeduplicatingResponseCache} - 리소스 타입별 캐시</li>
 *   <li>스케줄러 - 데몬 스레드 {@code conduit-scheduler-N} (타임아웃, 백오프, 배치 타이머 공용)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RequestOrchestrator orchestrator = DefaultRequestOrchestrator.builder()
 *     .transport(new HttpClientTransport(URI.create("https://gateway.example.com")))
 *     .config(new OrchestratorConfig().withMaxConcurrent(4).withPriorityOperations(Set.of("auth.me")))
 *     .build();
 * </pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class DefaultRequestOrchestrator implements RequestOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultRequestOrchestrator.class);

    private final Transport transport;
    private final OrchestratorConfig config;
    private final TimeSource timeSource;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final FifoConcurrencyGate gate;
    private final PriorityLane priorityLane;
    private final ResilientExecutor executor;
    private final Map<String, AutoBatchCollector<?, ?>> batchLookups = new ConcurrentHashMap<>();
    private final Map<String, DeduplicatingResponseCache<?, ?>> cachedLookups = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    private DefaultRequestOrchestrator(Builder builder) {
        this.transport = builder.transport;
        this.config = builder.config;
        this.timeSource = builder.timeSource;
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler ? newScheduler(config.schedulerThreads()) : builder.scheduler;
        this.gate = new FifoConcurrencyGate(config.maxConcurrent());
        this.priorityLane = new PriorityLane(config.priorityMaxConcurrent(), config.priorityOperations());
        this.executor = new ResilientExecutor(scheduler, config.retryPolicy(), builder.random);
        log.info("RequestOrchestrator started (maxConcurrent={}, priorityMaxConcurrent={}, priorityOperations={})",
            config.maxConcurrent(), config.priorityMaxConcurrent(), config.priorityOperations());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public <T> CompletableFuture<T> execute(Operation<T> operation, CallOptions options) {
        validate(operation, options);
        return runThrough(gate, operation, options);
    }

    @Override
    public <T> CompletableFuture<T> executePriority(Operation<T> operation, CallOptions options) {
        validate(operation, options);
        priorityLane.admit(options.operation());
        return runThrough(priorityLane.gate(), operation, options);
    }

    @Override
    public CompletableFuture<TransportResponse> send(TransportRequest request, CallOptions options) {
        return execute(transportCall(request), options);
    }

    @Override
    public CompletableFuture<TransportResponse> sendPriority(TransportRequest request, CallOptions options) {
        return executePriority(transportCall(request), options);
    }

    @Override
    public <K, V> BatchLookup<K, V> batchLookup(String resource, BatchConfig config, BatchFetcher<K, V> fetcher) {
        BatchConfig effective = config == null ? new BatchConfig() : config;
        AutoBatchCollector<K, V> collector = new AutoBatchCollector<>(
            resource, effective, fetcher, this, new FlushAlarm(scheduler, effective.windowMs()));
        register(batchLookups, resource, collector, "batch lookup");
        return collector;
    }

    @Override
    public <K, V> CachedLookup<K, V> cachedLookup(String resource, CacheConfig config) {
        CacheConfig effective = config == null ? new CacheConfig() : config;
        CacheStore<K, V> store = effective.isBounded()
            ? new InMemoryCacheStore<>(effective.maxEntries())
            : new InMemoryCacheStore<>();
        DeduplicatingResponseCache<K, V> cache = new DeduplicatingResponseCache<>(resource, effective, store, timeSource);
        register(cachedLookups, resource, cache, "cached lookup");
        return cache;
    }

    /**
     * 리소스 이름 등록. 이름당 인스턴스는 하나이며 호출자가 반환된 핸들을 보관합니다.
     *
     * @throws IllegalStateException 이미 등록된 이름인 경우
     */
    private static <L> void register(Map<String, L> registry, String resource, L lookup, String kind) {
        L existing = registry.putIfAbsent(resource, lookup);
        if (existing != null) {
            throw new IllegalStateException(
                kind + " already registered for resource '" + resource + "'; reuse the handle returned by the first call");
        }
    }

    @Override
    public ConcurrencyGate gate() {
        return gate;
    }

    /**
     * Priority Lane (관측용).
     *
     * @return PriorityLane
     */
    public PriorityLane priorityLane() {
        return priorityLane;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        for (AutoBatchCollector<?, ?> collector : batchLookups.values()) {
            collector.close();
        }
        shutdown = true;
        if (ownsScheduler) {
            scheduler.shutdown();
        }
        log.info("RequestOrchestrator shut down (active={}, waiting={})", gate.activeCount(), gate.waitingCount());
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private <T> CompletableFuture<T> runThrough(ConcurrencyGate lane, Operation<T> operation, CallOptions options) {
        if (shutdown) {
            return CompletableFuture.failedFuture(ConduitException.cancelled("orchestrator is shut down"));
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        lane.acquire(options.cancellationToken()).whenComplete((slot, acquireError) -> {
            if (acquireError != null) {
                result.completeExceptionally(ConduitException.unwrap(acquireError));
                return;
            }
            runWithSlot(lane, slot, operation, options, result);
        });
        return result;
    }

    private <T> void runWithSlot(ConcurrencyGate lane, Slot slot, Operation<T> operation,
                                 CallOptions options, CompletableFuture<T> result) {
        CompletableFuture<T> running;
        try {
            running = executor.execute(operation, options);
        } catch (RuntimeException e) {
            running = CompletableFuture.failedFuture(e);
        }
        running.whenComplete((value, error) -> {
            // Slot 반환이 결과 전달보다 먼저
            lane.release(slot);
            if (error != null) {
                result.completeExceptionally(ConduitException.unwrap(error));
            } else {
                result.complete(value);
            }
        });
    }

    private Operation<TransportResponse> transportCall(TransportRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (transport == null) {
            throw new IllegalStateException("No Transport configured for this orchestrator");
        }
        return attemptToken -> transport.send(request, attemptToken).thenApply(response -> {
            if (!response.isSuccessful()) {
                throw ConduitException.unexpectedStatus(response.statusCode(), request.method() + " " + request.target());
            }
            return response;
        });
    }

    private static void validate(Operation<?> operation, CallOptions options) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
    }

    private static ScheduledExecutorService newScheduler(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(threads, runnable -> {
            Thread thread = new Thread(runnable, "conduit-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * 스케줄러 종료 대기 (소유한 경우만).
     *
     * @param timeout 대기 시간
     * @param unit 단위
     * @return 종료되었으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        if (!ownsScheduler) {
            return true;
        }
        return scheduler.awaitTermination(timeout, unit);
    }

    /**
     * DefaultRequestOrchestrator 빌더.
     */
    public static final class Builder {

        private Transport transport;
        private OrchestratorConfig config = new OrchestratorConfig();
        private TimeSource timeSource = SystemTimeSource.instance();
        private ScheduledExecutorService scheduler;
        private Random random = new Random();

        private Builder() {
        }

        /**
         * Transport 지정 (send/sendPriority 사용 시 필수).
         *
         * @param transport Transport
         * @return this
         */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder config(OrchestratorConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            this.config = config;
            return this;
        }

        public Builder timeSource(TimeSource timeSource) {
            if (timeSource == null) {
                throw new IllegalArgumentException("timeSource cannot be null");
            }
            this.timeSource = timeSource;
            return this;
        }

        /**
         * 외부 스케줄러 지정. 지정하면 shutdown()이 스케줄러를 종료하지 않습니다.
         *
         * @param scheduler 스케줄러
         * @return this
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Jitter 난수 생성기 지정 (테스트에서 고정 seed 주입).
         *
         * @param random 난수 생성기
         * @return this
         */
        public Builder random(Random random) {
            if (random == null) {
                throw new IllegalArgumentException("random cannot be null");
            }
            this.random = random;
            return this;
        }

        public DefaultRequestOrchestrator build() {
            return new DefaultRequestOrchestrator(this);
        }
    }
}
