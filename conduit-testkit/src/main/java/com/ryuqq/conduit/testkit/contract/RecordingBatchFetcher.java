package com.ryuqq.conduit.testkit.contract;

import com.ryuqq.conduit.application.lookup.BatchFetcher;
import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.outcome.LookupResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * {@link BatchFetcher} that records every combined call.
 *
 * <p>Each key is answered by a resolver function; a {@code null} from the resolver
 * leaves the key out of the result map (the collector then reports it as missing).</p>
 *
 * @param <V> value type
 * @author Conduit Team
 * @since 1.0.0
 */
public class RecordingBatchFetcher<V> implements BatchFetcher<String, V> {

    private final Function<String, LookupResult<V>> resolver;
    private final List<List<String>> batches = Collections.synchronizedList(new ArrayList<>());

    public RecordingBatchFetcher(Function<String, LookupResult<V>> resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        this.resolver = resolver;
    }

    @Override
    public CompletableFuture<Map<String, LookupResult<V>>> fetch(List<String> keys, CancellationToken attemptToken) {
        batches.add(List.copyOf(keys));
        Map<String, LookupResult<V>> results = new LinkedHashMap<>();
        for (String key : keys) {
            LookupResult<V> result = resolver.apply(key);
            if (result != null) {
                results.put(key, result);
            }
        }
        return CompletableFuture.completedFuture(results);
    }

    /**
     * Snapshot of the key lists sent so far, in call order.
     *
     * @return recorded batches
     */
    public List<List<String>> batches() {
        synchronized (batches) {
            return List.copyOf(batches);
        }
    }

    public int callCount() {
        return batches.size();
    }
}
