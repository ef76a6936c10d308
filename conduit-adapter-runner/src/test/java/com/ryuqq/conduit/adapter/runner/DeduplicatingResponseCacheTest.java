package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.adapter.inmemory.store.InMemoryCacheStore;
import com.ryuqq.conduit.application.lookup.CacheConfig;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.statemachine.CacheKeyState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DeduplicatingResponseCache 테스트.
 *
 * <p>시간은 수동으로 진행시킵니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class DeduplicatingResponseCacheTest {

    private static final long TTL_MS = 300_000;

    private final AtomicLong now = new AtomicLong(1_000_000);
    private final AtomicInteger fetchCount = new AtomicInteger();
    private DeduplicatingResponseCache<String, String> cache;

    @BeforeEach
    void setUp() {
        cache = new DeduplicatingResponseCache<>(
            "reviews", new CacheConfig(TTL_MS, 0), new InMemoryCacheStore<>(), now::get);
    }

    private Supplier<CompletableFuture<String>> fetching(String value) {
        return () -> {
            fetchCount.incrementAndGet();
            return CompletableFuture.completedFuture(value);
        };
    }

    @Test
    @DisplayName("같은 키의 동시 요청 20개는 한 번만 조회하고 모두 같은 값을 받는다")
    void getOrFetch_동시_요청_병합() throws Exception {
        // given
        CompletableFuture<String> slowFetch = new CompletableFuture<>();
        Supplier<CompletableFuture<String>> fetcher = () -> {
            fetchCount.incrementAndGet();
            return slowFetch;
        };
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch ready = new CountDownLatch(20);
        List<CompletableFuture<String>> callers = new ArrayList<>();
        List<CompletableFuture<CompletableFuture<String>>> submitted = new ArrayList<>();

        // when
        for (int i = 0; i < 20; i++) {
            submitted.add(CompletableFuture.supplyAsync(() -> {
                CompletableFuture<String> result = cache.getOrFetch("sku-123", fetcher);
                ready.countDown();
                return result;
            }, pool));
        }
        assertThat(ready.await(2, TimeUnit.SECONDS)).isTrue();
        for (CompletableFuture<CompletableFuture<String>> future : submitted) {
            callers.add(future.get());
        }
        slowFetch.complete("4.5 stars");

        // then
        for (CompletableFuture<String> caller : callers) {
            assertThat(caller.get(1, TimeUnit.SECONDS)).isEqualTo("4.5 stars");
        }
        assertThat(fetchCount.get()).isEqualTo(1);
        assertThat(cache.stateOf("sku-123")).isEqualTo(CacheKeyState.CACHED);
        pool.shutdown();
    }

    @Test
    @DisplayName("TTL 안에서는 캐시를 사용하고 TTL이 지나면 다시 조회한다")
    void getOrFetch_TTL_만료_후_재조회() throws Exception {
        // given
        cache.getOrFetch("sku-1", fetching("v1")).get();

        // when
        now.addAndGet(TTL_MS - 1);
        String beforeExpiry = cache.getOrFetch("sku-1", fetching("v2")).get();
        now.addAndGet(2);
        String afterExpiry = cache.getOrFetch("sku-1", fetching("v2")).get();

        // then
        assertThat(beforeExpiry).isEqualTo("v1");
        assertThat(afterExpiry).isEqualTo("v2");
        assertThat(fetchCount.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("invalidate 후 다음 요청은 새로 조회한다")
    void invalidate_후_재조회() throws Exception {
        // given
        cache.getOrFetch("sku-123", fetching("old")).get();

        // when
        cache.invalidate("sku-123");
        String value = cache.getOrFetch("sku-123", fetching("new")).get();

        // then
        assertThat(value).isEqualTo("new");
        assertThat(fetchCount.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("실패는 캐시되지 않고 대기 중인 모든 호출자에게 같은 원인이 전달된다")
    void getOrFetch_실패_전파_비캐시() throws Exception {
        // given
        CompletableFuture<String> failing = new CompletableFuture<>();
        CompletableFuture<String> first = cache.getOrFetch("sku-9", () -> failing);
        CompletableFuture<String> second = cache.getOrFetch("sku-9", fetching("unused"));
        ConduitException boom = ConduitException.terminal("HTTP 500", 1, 500, null);

        // when
        failing.completeExceptionally(boom);

        // then
        assertThat(first.handle((v, e) -> e).get()).isSameAs(boom);
        assertThat(second.handle((v, e) -> e).get()).isSameAs(boom);
        assertThat(fetchCount.get()).isZero();
        assertThat(cache.stateOf("sku-9")).isEqualTo(CacheKeyState.EMPTY);
        assertThat(cache.getOrFetch("sku-9", fetching("recovered")).get()).isEqualTo("recovered");
    }

    @Test
    @DisplayName("조회 함수가 동기적으로 예외를 던져도 실패 future로 전달된다")
    void getOrFetch_조회_함수_동기_예외() throws Exception {
        CompletableFuture<String> result = cache.getOrFetch("sku-1", () -> {
            throw new IllegalStateException("boom");
        });

        assertThat(result.handle((v, e) -> e).get()).isInstanceOf(IllegalStateException.class);
        assertThat(cache.stateOf("sku-1")).isEqualTo(CacheKeyState.EMPTY);
    }

    @Test
    @DisplayName("invalidate 이후 도착한 이전 조회 결과는 캐시되지 않는다")
    void settle_invalidate_이후_결과_비캐시() throws Exception {
        // given
        CompletableFuture<String> stale = new CompletableFuture<>();
        CompletableFuture<String> caller = cache.getOrFetch("sku-7", () -> stale);
        assertThat(cache.stateOf("sku-7")).isEqualTo(CacheKeyState.FETCHING);

        // when
        cache.invalidate("sku-7");
        stale.complete("stale");

        // then
        assertThat(caller.get()).isEqualTo("stale");
        assertThat(cache.stateOf("sku-7")).isEqualTo(CacheKeyState.EMPTY);
        assertThat(cache.peek("sku-7")).isEmpty();
    }

    @Test
    @DisplayName("invalidate 도중 레코드 제거 시점에 완료된 fetch도 캐시를 다시 채우지 않는다")
    void invalidate_진행_중_완료된_fetch_비캐시() throws Exception {
        // given
        CompletableFuture<String> pending = new CompletableFuture<>();
        DeduplicatingResponseCache<String, String> racing = new DeduplicatingResponseCache<>(
            "reviews", new CacheConfig(TTL_MS, 0), new SettlingStore(pending, "stale-before-invalidate"), now::get);
        CompletableFuture<String> caller = racing.getOrFetch("sku-123", () -> pending);

        // when
        racing.invalidate("sku-123");

        // then
        assertThat(caller.get()).isEqualTo("stale-before-invalidate");
        assertThat(racing.peek("sku-123")).isEmpty();
        assertThat(racing.stateOf("sku-123")).isEqualTo(CacheKeyState.EMPTY);
    }

    @Test
    @DisplayName("invalidateAll 도중 완료된 fetch도 캐시를 다시 채우지 않는다")
    void invalidateAll_진행_중_완료된_fetch_비캐시() throws Exception {
        // given
        CompletableFuture<String> pending = new CompletableFuture<>();
        DeduplicatingResponseCache<String, String> racing = new DeduplicatingResponseCache<>(
            "reviews", new CacheConfig(TTL_MS, 0), new SettlingStore(pending, "stale"), now::get);
        CompletableFuture<String> caller = racing.getOrFetch("sku-9", () -> pending);

        // when
        racing.invalidateAll();

        // then
        assertThat(caller.get()).isEqualTo("stale");
        assertThat(racing.peek("sku-9")).isEmpty();
        assertThat(racing.size()).isZero();
    }

    @Test
    @DisplayName("forceRefresh는 유효한 캐시가 있어도 다시 조회한다")
    void getOrFetch_forceRefresh() throws Exception {
        // given
        cache.getOrFetch("sku-1", fetching("v1")).get();

        // when
        String refreshed = cache.getOrFetch("sku-1", fetching("v2"), true).get();

        // then
        assertThat(refreshed).isEqualTo("v2");
        assertThat(cache.peek("sku-1")).contains("v2");
        assertThat(fetchCount.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("seed로 넣은 값은 조회 없이 반환된다")
    void seed_조회_없이_반환() throws Exception {
        // when
        cache.seed(Map.of("sku-1", "seeded", "sku-2", "also"));

        // then
        assertThat(cache.getOrFetch("sku-1", fetching("fetched")).get()).isEqualTo("seeded");
        assertThat(cache.peek("sku-2")).contains("also");
        assertThat(fetchCount.get()).isZero();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("stateOf는 EMPTY, FETCHING, CACHED, EXPIRED를 구분한다")
    void stateOf_상태_구분() {
        // given
        CompletableFuture<String> pending = new CompletableFuture<>();
        assertThat(cache.stateOf("sku-1")).isEqualTo(CacheKeyState.EMPTY);

        // when & then
        cache.getOrFetch("sku-1", () -> pending);
        assertThat(cache.stateOf("sku-1")).isEqualTo(CacheKeyState.FETCHING);

        pending.complete("value");
        assertThat(cache.stateOf("sku-1")).isEqualTo(CacheKeyState.CACHED);

        now.addAndGet(TTL_MS + 1);
        assertThat(cache.stateOf("sku-1")).isEqualTo(CacheKeyState.EXPIRED);
        assertThat(cache.peek("sku-1")).isEmpty();
        assertThat(cache.stateOf("sku-1")).isEqualTo(CacheKeyState.EMPTY);
    }

    @Test
    @DisplayName("한 호출자가 자신의 future를 취소해도 다른 호출자에게는 영향이 없다")
    void getOrFetch_호출자_취소_격리() throws Exception {
        // given
        CompletableFuture<String> pending = new CompletableFuture<>();
        CompletableFuture<String> first = cache.getOrFetch("sku-1", () -> pending);
        CompletableFuture<String> second = cache.getOrFetch("sku-1", fetching("unused"));

        // when
        first.cancel(false);
        pending.complete("value");

        // then
        assertThat(second.get()).isEqualTo("value");
        assertThat(cache.peek("sku-1")).contains("value");
    }

    @Test
    @DisplayName("invalidateAll은 모든 레코드를 제거한다")
    void invalidateAll_전체_제거() throws Exception {
        // given
        cache.seed(Map.of("a", "1", "b", "2"));

        // when
        cache.invalidateAll();

        // then
        assertThat(cache.size()).isZero();
        assertThat(cache.stateOf("a")).isEqualTo(CacheKeyState.EMPTY);
    }

    /**
     * 레코드 제거 직후 대기 중인 fetch를 완료시키는 저장소.
     */
    private static final class SettlingStore extends InMemoryCacheStore<String, String> {

        private final CompletableFuture<String> pending;
        private final String value;

        SettlingStore(CompletableFuture<String> pending, String value) {
            this.pending = pending;
            this.value = value;
        }

        @Override
        public boolean remove(String key) {
            boolean removed = super.remove(key);
            pending.complete(value);
            return removed;
        }

        @Override
        public void clear() {
            super.clear();
            pending.complete(value);
        }
    }
}
