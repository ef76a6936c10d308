package com.ryuqq.conduit.adapter.inmemory.store;

import com.ryuqq.conduit.core.model.CacheRecord;
import com.ryuqq.conduit.core.spi.CacheStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CacheStore} SPI.
 *
 * <p>Two storage modes are supported:</p>
 * <ul>
 *   <li><strong>Unbounded:</strong> {@link ConcurrentHashMap}, lock-free reads (default)</li>
 *   <li><strong>Bounded:</strong> access-ordered {@link LinkedHashMap} guarded by the instance monitor;
 *       the least recently used record is evicted once size exceeds {@code maxEntries}</li>
 * </ul>
 *
 * <p>The store never inspects TTLs. Expired records stay until the cache removes them
 * on the next lookup or until LRU eviction pushes them out.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No size accounting by bytes, only by entry count</li>
 * </ul>
 *
 * @param <K> key type
 * @param <V> value type
 * @author Conduit Team
 * @since 1.0.0
 */
public class InMemoryCacheStore<K, V> implements CacheStore<K, V> {

    private final int maxEntries;
    private final Map<K, CacheRecord<V>> records;

    /**
     * Creates an unbounded store.
     */
    public InMemoryCacheStore() {
        this.maxEntries = 0;
        this.records = new ConcurrentHashMap<>();
    }

    /**
     * Creates a store bounded to {@code maxEntries} records with LRU eviction.
     *
     * @param maxEntries maximum number of records (must be positive)
     * @throws IllegalArgumentException if maxEntries is not positive
     */
    public InMemoryCacheStore(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive (current: " + maxEntries + ")");
        }
        this.maxEntries = maxEntries;
        this.records = new LinkedHashMap<>(Math.min(maxEntries, 1024), 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<K, CacheRecord<V>> eldest) {
                return size() > InMemoryCacheStore.this.maxEntries;
            }
        };
    }

    /**
     * Whether this store evicts by LRU.
     *
     * @return true if bounded
     */
    public boolean isBounded() {
        return maxEntries > 0;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    @Override
    public Optional<CacheRecord<V>> get(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (!isBounded()) {
            return Optional.ofNullable(records.get(key));
        }
        synchronized (this) {
            return Optional.ofNullable(records.get(key));
        }
    }

    @Override
    public void put(K key, CacheRecord<V> record) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(record, "record cannot be null");
        if (!isBounded()) {
            records.put(key, record);
            return;
        }
        synchronized (this) {
            records.put(key, record);
        }
    }

    @Override
    public boolean remove(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (!isBounded()) {
            return records.remove(key) != null;
        }
        synchronized (this) {
            return records.remove(key) != null;
        }
    }

    @Override
    public boolean remove(K key, CacheRecord<V> expected) {
        Objects.requireNonNull(key, "key cannot be null");
        if (!isBounded()) {
            return records.remove(key, expected);
        }
        synchronized (this) {
            CacheRecord<V> current = records.get(key);
            if (current != null && current.equals(expected)) {
                records.remove(key);
                return true;
            }
            return false;
        }
    }

    @Override
    public void clear() {
        if (!isBounded()) {
            records.clear();
            return;
        }
        synchronized (this) {
            records.clear();
        }
    }

    @Override
    public int size() {
        if (!isBounded()) {
            return records.size();
        }
        synchronized (this) {
            return records.size();
        }
    }
}
