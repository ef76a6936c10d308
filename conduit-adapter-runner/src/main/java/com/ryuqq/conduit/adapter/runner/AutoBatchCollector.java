package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.application.lookup.BatchConfig;
import com.ryuqq.conduit.application.lookup.BatchFetcher;
import com.ryuqq.conduit.application.lookup.BatchLookup;
import com.ryuqq.conduit.application.orchestrator.RequestOrchestrator;
import com.ryuqq.conduit.core.contract.CallOptions;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.outcome.Failed;
import com.ryuqq.conduit.core.outcome.LookupResult;
import com.ryuqq.conduit.core.statemachine.BatchState;
import com.ryuqq.conduit.core.statemachine.BatchStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 윈도우 기반 자동 배칭 수집기 (리소스 타입당 하나).
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * IDLE ──(첫 enqueue, 알람 무장)──► COLLECTING
 * COLLECTING ──(알람 발화 / maxBatchSize 도달 / flushNow)──► FLUSHING
 * FLUSHING ──(결합 요청 발송)──► IDLE (대기 항목이 있으면 곧바로 다음 윈도우 COLLECTING)
 * </pre>
 *
 * <p><strong>Flush 처리:</strong></p>
 * <ol>
 *   <li>대기열 인출 (락 안에서 원자적으로)</li>
 *   <li>키 중복 제거 (enqueue 순서 유지)</li>
 *   <li>orchestrator.execute()로 결합 요청 1회 (게이트 + 재시도 경유)</li>
 *   <li>enqueue 순서대로 각 호출자 정산: Found / Missing / 키 단위 Failed는 TERMINAL</li>
 *   <li>결합 요청 실패 시 모든 호출자를 같은 예외로 실패</li>
 * </ol>
 *
 * <p>FLUSHING 동안 들어온 enqueue는 대기열에 쌓였다가 다음 윈도우에서 처리됩니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public class AutoBatchCollector<K, V> implements BatchLookup<K, V> {

    private static final Logger log = LoggerFactory.getLogger(AutoBatchCollector.class);

    private final String resource;
    private final BatchConfig config;
    private final BatchFetcher<K, V> fetcher;
    private final RequestOrchestrator orchestrator;
    private final CallOptions callOptions;
    private final FlushAlarm alarm;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Entry<K, V>> queue = new ArrayList<>();
    private BatchState state = BatchState.IDLE;
    private long windowId;
    private boolean closed;

    /**
     * 생성자.
     *
     * @param resource 리소스 타입 이름 (결합 호출의 operation 이름으로 사용)
     * @param config 배치 설정
     * @param fetcher 다중 키 조회 함수
     * @param orchestrator 결합 호출을 실행할 orchestrator (게이트 + 재시도 경유)
     * @param alarm 윈도우 타이머
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public AutoBatchCollector(String resource,
                              BatchConfig config,
                              BatchFetcher<K, V> fetcher,
                              RequestOrchestrator orchestrator,
                              FlushAlarm alarm) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (alarm == null) {
            throw new IllegalArgumentException("alarm cannot be null");
        }
        this.callOptions = CallOptions.named(resource);
        this.resource = resource;
        this.config = config;
        this.fetcher = fetcher;
        this.orchestrator = orchestrator;
        this.alarm = alarm;
    }

    @Override
    public CompletableFuture<LookupResult<V>> enqueue(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Entry<K, V> entry = new Entry<>(key);
        List<Entry<K, V>> ready = null;

        lock.lock();
        try {
            if (closed) {
                return CompletableFuture.failedFuture(
                    ConduitException.cancelled("batch lookup '" + resource + "' is closed"));
            }
            queue.add(entry);
            if (state == BatchState.IDLE) {
                ready = openWindowLocked();
            } else if (state == BatchState.COLLECTING && queue.size() >= config.maxBatchSize()) {
                ready = drainLocked();
            }
        } finally {
            lock.unlock();
        }

        if (ready != null) {
            flush(ready);
        }
        return entry.future;
    }

    @Override
    public void flushNow() {
        List<Entry<K, V>> ready = null;
        lock.lock();
        try {
            if (state == BatchState.COLLECTING) {
                ready = drainLocked();
            }
        } finally {
            lock.unlock();
        }
        if (ready != null) {
            flush(ready);
        }
    }

    @Override
    public int pendingCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BatchState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        List<Entry<K, V>> ready = null;
        lock.lock();
        try {
            closed = true;
            if (state == BatchState.COLLECTING) {
                ready = drainLocked();
            }
        } finally {
            lock.unlock();
        }
        if (ready != null) {
            flush(ready);
        }
    }

    /**
     * IDLE → COLLECTING, 알람 무장. 이미 상한에 도달했거나 닫혔으면 즉시 인출.
     */
    private List<Entry<K, V>> openWindowLocked() {
        state = BatchStateTransition.transition(state, BatchState.COLLECTING);
        if (closed || queue.size() >= config.maxBatchSize()) {
            return drainLocked();
        }
        long window = ++windowId;
        try {
            alarm.arm(() -> onAlarm(window));
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler unavailable for batch '{}', flushing immediately", resource);
            return drainLocked();
        }
        return null;
    }

    /**
     * COLLECTING → FLUSHING, 대기열 앞에서 최대 maxBatchSize개 인출.
     */
    private List<Entry<K, V>> drainLocked() {
        alarm.disarm();
        state = BatchStateTransition.transition(state, BatchState.FLUSHING);
        List<Entry<K, V>> head = queue.subList(0, Math.min(queue.size(), config.maxBatchSize()));
        List<Entry<K, V>> drained = new ArrayList<>(head);
        head.clear();
        return drained;
    }

    private void onAlarm(long window) {
        List<Entry<K, V>> ready = null;
        lock.lock();
        try {
            if (state == BatchState.COLLECTING && window == windowId) {
                ready = drainLocked();
            }
        } finally {
            lock.unlock();
        }
        if (ready != null) {
            flush(ready);
        }
    }

    private void flush(List<Entry<K, V>> entries) {
        while (entries != null) {
            dispatch(entries);
            entries = finishFlush();
        }
    }

    private void dispatch(List<Entry<K, V>> entries) {
        Set<K> distinct = new LinkedHashSet<>();
        for (Entry<K, V> entry : entries) {
            distinct.add(entry.key);
        }
        List<K> keys = List.copyOf(distinct);
        log.debug("Flushing batch '{}': {} callers, {} distinct keys", resource, entries.size(), keys.size());

        CompletableFuture<Map<K, LookupResult<V>>> combined;
        try {
            combined = orchestrator.execute(token -> fetcher.fetch(keys, token), callOptions);
        } catch (RuntimeException e) {
            combined = CompletableFuture.failedFuture(e);
        }
        combined.whenComplete((results, error) -> settle(entries, results, error));
    }

    /**
     * FLUSHING → IDLE. FLUSHING 동안 쌓인 항목이 있으면 다음 윈도우를 엽니다.
     *
     * @return 즉시 flush해야 할 항목 (없으면 null)
     */
    private List<Entry<K, V>> finishFlush() {
        lock.lock();
        try {
            state = BatchStateTransition.transition(state, BatchState.IDLE);
            if (queue.isEmpty()) {
                return null;
            }
            return openWindowLocked();
        } finally {
            lock.unlock();
        }
    }

    private void settle(List<Entry<K, V>> entries, Map<K, LookupResult<V>> results, Throwable error) {
        if (error != null) {
            Throwable cause = ConduitException.unwrap(error);
            log.debug("Batch '{}' failed for {} callers: {}", resource, entries.size(), cause.toString());
            for (Entry<K, V> entry : entries) {
                entry.future.completeExceptionally(cause);
            }
            return;
        }

        Map<K, LookupResult<V>> safeResults = results == null ? Map.of() : results;
        for (Entry<K, V> entry : entries) {
            LookupResult<V> result = safeResults.get(entry.key);
            if (result == null) {
                entry.future.complete(LookupResult.missing());
            } else if (result instanceof Failed) {
                Failed<V> failed = (Failed<V>) result;
                entry.future.completeExceptionally(ConduitException.terminal(
                    "Lookup of " + entry.key + " in '" + resource + "' failed: ["
                        + failed.errorCode() + "] " + failed.message(), 0, null, null));
            } else {
                entry.future.complete(result);
            }
        }
    }

    public String getResource() {
        return resource;
    }

    public BatchConfig getConfig() {
        return config;
    }

    private static final class Entry<K, V> {
        private final K key;
        private final CompletableFuture<LookupResult<V>> future = new CompletableFuture<>();

        private Entry(K key) {
            this.key = key;
        }
    }
}
