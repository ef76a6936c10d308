package com.ryuqq.conduit.adapter.inmemory.store;

import com.ryuqq.conduit.core.model.CacheRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryCacheStore tests.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class InMemoryCacheStoreTest {

    @Test
    @DisplayName("put 후 get은 같은 레코드를 반환한다")
    void put_get() {
        // given
        InMemoryCacheStore<String, Integer> store = new InMemoryCacheStore<>();
        CacheRecord<Integer> record = new CacheRecord<>(4, 0L, 1000L);

        // when
        store.put("sku-1", record);

        // then
        assertThat(store.get("sku-1")).contains(record);
        assertThat(store.get("sku-2")).isEmpty();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("조건부 remove는 저장된 레코드가 기대값과 같을 때만 제거한다")
    void remove_조건부() {
        // given
        InMemoryCacheStore<String, Integer> store = new InMemoryCacheStore<>();
        CacheRecord<Integer> stale = new CacheRecord<>(1, 0L, 10L);
        CacheRecord<Integer> fresh = new CacheRecord<>(2, 50L, 10L);
        store.put("sku-1", fresh);

        // when
        boolean removedStale = store.remove("sku-1", stale);

        // then
        assertThat(removedStale).isFalse();
        assertThat(store.get("sku-1")).contains(fresh);
        assertThat(store.remove("sku-1", fresh)).isTrue();
        assertThat(store.get("sku-1")).isEmpty();
    }

    @Test
    @DisplayName("상한이 있으면 가장 오래 사용되지 않은 레코드부터 제거된다")
    void bounded_LRU_제거() {
        // given
        InMemoryCacheStore<String, Integer> store = new InMemoryCacheStore<>(2);
        store.put("a", new CacheRecord<>(1, 0L, 1000L));
        store.put("b", new CacheRecord<>(2, 0L, 1000L));

        // when
        store.get("a");
        store.put("c", new CacheRecord<>(3, 0L, 1000L));

        // then
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.get("a")).isPresent();
        assertThat(store.get("b")).isEmpty();
        assertThat(store.get("c")).isPresent();
    }

    @Test
    @DisplayName("bounded 모드에서도 조건부 remove와 clear가 동작한다")
    void bounded_remove_clear() {
        // given
        InMemoryCacheStore<String, Integer> store = new InMemoryCacheStore<>(10);
        CacheRecord<Integer> record = new CacheRecord<>(1, 0L, 1000L);
        store.put("a", record);
        store.put("b", new CacheRecord<>(2, 0L, 1000L));

        // when
        boolean removed = store.remove("a", record);
        store.clear();

        // then
        assertThat(removed).isTrue();
        assertThat(store.size()).isZero();
        assertThat(store.isBounded()).isTrue();
    }

    @Test
    @DisplayName("양수가 아닌 상한은 거부된다")
    void bounded_검증() {
        assertThatThrownBy(() -> new InMemoryCacheStore<String, Integer>(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
