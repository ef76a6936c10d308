package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.application.lookup.CacheConfig;
import com.ryuqq.conduit.application.lookup.CachedLookup;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.model.CacheRecord;
import com.ryuqq.conduit.core.spi.CacheStore;
import com.ryuqq.conduit.core.statemachine.CacheKeyState;
import com.ryuqq.conduit.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * TTL 캐시 + In-flight 호출 병합.
 *
 * <p><strong>getOrFetch 흐름:</strong></p>
 * <ol>
 *   <li>유효한 Cache Record가 있으면 fetch 없이 반환 (만료 레코드는 이때 제거)</li>
 *   <li>In-flight Marker가 있으면 그 결과에 합류</li>
 *   <li>없으면 Marker를 만들고 fetch 1회, 완료 시 Marker 제거 후 성공 결과만 캐시</li>
 * </ol>
 *
 * <p>Marker 제거와 레코드 저장은 키 단위로 원자적입니다. 같은 키의 새 호출자는
 * "Marker도 레코드도 없는" 중간 상태를 관측하지 않습니다.</p>
 *
 * <p>invalidate()는 Marker를 레코드보다 먼저 제거합니다. 그 뒤에 완료되는 이전 fetch는
 * 호출자에게 결과를 전달하지만 캐시를 다시 채우지 않습니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public class DeduplicatingResponseCache<K, V> implements CachedLookup<K, V> {

    private static final Logger log = LoggerFactory.getLogger(DeduplicatingResponseCache.class);

    private final String resource;
    private final CacheConfig config;
    private final CacheStore<K, V> store;
    private final TimeSource timeSource;
    private final ConcurrentHashMap<K, InFlight<V>> inFlight = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param resource 리소스 타입 이름 (로그용)
     * @param config 캐시 설정
     * @param store 레코드 저장소
     * @param timeSource 시각 공급자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DeduplicatingResponseCache(String resource, CacheConfig config, CacheStore<K, V> store, TimeSource timeSource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.resource = resource;
        this.config = config;
        this.store = store;
        this.timeSource = timeSource;
    }

    @Override
    public CompletableFuture<V> getOrFetch(K key, Supplier<CompletableFuture<V>> fetcher) {
        return getOrFetch(key, fetcher, false);
    }

    @Override
    public CompletableFuture<V> getOrFetch(K key, Supplier<CompletableFuture<V>> fetcher, boolean forceRefresh) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }

        if (!forceRefresh) {
            Optional<V> cached = freshValue(key);
            if (cached.isPresent()) {
                log.debug("Cache hit: {}[{}]", resource, key);
                return CompletableFuture.completedFuture(cached.get());
            }
        }

        InFlight<V> marker = new InFlight<>();
        InFlight<V> existing = inFlight.putIfAbsent(key, marker);
        if (existing != null) {
            log.debug("Joining in-flight fetch: {}[{}]", resource, key);
            return Futures.detach(existing.future);
        }

        // Marker 획득 직전에 다른 fetch가 끝났을 수 있음
        if (!forceRefresh) {
            Optional<V> cached = freshValue(key);
            if (cached.isPresent()) {
                inFlight.remove(key, marker);
                marker.future.complete(cached.get());
                return Futures.detach(marker.future);
            }
        }

        CompletableFuture<V> fetched;
        try {
            fetched = fetcher.get();
            if (fetched == null) {
                fetched = CompletableFuture.failedFuture(new IllegalStateException("fetcher returned null future"));
            }
        } catch (RuntimeException e) {
            fetched = CompletableFuture.failedFuture(e);
        }

        fetched.whenComplete((value, error) -> settle(key, marker, value, error));
        return Futures.detach(marker.future);
    }

    private void settle(K key, InFlight<V> marker, V value, Throwable error) {
        AtomicBoolean cached = new AtomicBoolean(false);
        inFlight.compute(key, (k, current) -> {
            if (current != marker) {
                // invalidate 되었거나 다른 fetch로 교체됨
                return current;
            }
            if (error == null && value != null) {
                store.put(k, new CacheRecord<>(value, timeSource.currentTimeMillis(), config.ttlMs()));
                cached.set(true);
            }
            return null;
        });

        if (error != null) {
            Throwable cause = ConduitException.unwrap(error);
            log.debug("Fetch failed, not cached: {}[{}] ({})", resource, key, cause.toString());
            marker.future.completeExceptionally(cause);
        } else {
            if (!cached.get()) {
                log.debug("Fetch settled without caching: {}[{}]", resource, key);
            }
            marker.future.complete(value);
        }
    }

    @Override
    public void invalidate(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        // Marker 먼저: 이후 완료되는 이전 fetch는 current != marker로 레코드를 쓰지 않음
        boolean hadMarker = inFlight.remove(key) != null;
        boolean hadRecord = store.remove(key);
        log.debug("Invalidated {}[{}] (record={}, inFlight={})", resource, key, hadRecord, hadMarker);
    }

    @Override
    public void invalidateAll() {
        // Marker 먼저: 이후 완료되는 fetch는 레코드를 쓰지 않음
        inFlight.clear();
        store.clear();
        log.debug("Invalidated all entries of {}", resource);
    }

    @Override
    public void seed(Map<K, V> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        long now = timeSource.currentTimeMillis();
        int seeded = 0;
        for (Map.Entry<K, V> entry : values.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                store.put(entry.getKey(), new CacheRecord<>(entry.getValue(), now, config.ttlMs()));
                seeded++;
            }
        }
        log.debug("Seeded {} entries into {}", seeded, resource);
    }

    @Override
    public Optional<V> peek(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return freshValue(key);
    }

    @Override
    public CacheKeyState stateOf(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (inFlight.containsKey(key)) {
            return CacheKeyState.FETCHING;
        }
        Optional<CacheRecord<V>> record = store.get(key);
        if (record.isEmpty()) {
            return CacheKeyState.EMPTY;
        }
        return record.get().isExpiredAt(timeSource.currentTimeMillis()) ? CacheKeyState.EXPIRED : CacheKeyState.CACHED;
    }

    /**
     * 유효한 값 조회. 만료 레코드는 조건부로 제거합니다.
     */
    private Optional<V> freshValue(K key) {
        Optional<CacheRecord<V>> record = store.get(key);
        if (record.isEmpty()) {
            return Optional.empty();
        }
        CacheRecord<V> current = record.get();
        if (current.isExpiredAt(timeSource.currentTimeMillis())) {
            store.remove(key, current);
            log.debug("Evicted expired record {}[{}]", resource, key);
            return Optional.empty();
        }
        return Optional.of(current.value());
    }

    public String getResource() {
        return resource;
    }

    public CacheConfig getConfig() {
        return config;
    }

    public int size() {
        return store.size();
    }

    private static final class InFlight<V> {
        private final CompletableFuture<V> future = new CompletableFuture<>();
    }
}
