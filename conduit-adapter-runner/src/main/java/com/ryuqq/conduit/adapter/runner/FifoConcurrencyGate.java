package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.protection.ConcurrencyGate;
import com.ryuqq.conduit.core.protection.GateConfig;
import com.ryuqq.conduit.core.protection.Slot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO 대기열을 가진 Concurrency Gate.
 *
 * <p>동시에 발급된 Slot 수를 {@code maxConcurrent} 이하로 유지합니다.
 * 상한에 도달하면 호출자는 도착 순서대로 대기합니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ol>
 *   <li>acquire: active &lt; C이면 즉시 발급, 아니면 Waiter를 대기열 끝에 추가</li>
 *   <li>release: 대기열이 비어 있지 않으면 같은 임계 구역 안에서 head Waiter에게 Slot을 넘김
 *       (active 감소/증가 없음), 비어 있으면 active 감소</li>
 *   <li>대기 중 취소: Waiter를 대기열에서 제거하고 CANCELLED로 실패 (Slot 소비 없음)</li>
 * </ol>
 *
 * <p>Waiter future 완료는 락 밖에서 수행합니다. 완료 콜백이 같은 게이트를 다시 호출해도
 * 락을 쥔 채 재진입하지 않습니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class FifoConcurrencyGate implements ConcurrencyGate {

    private static final Logger log = LoggerFactory.getLogger(FifoConcurrencyGate.class);

    private final GateConfig config;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int active;
    private long sequence;

    /**
     * 생성자.
     *
     * @param config 게이트 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public FifoConcurrencyGate(GateConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    public FifoConcurrencyGate(int maxConcurrent) {
        this(new GateConfig(maxConcurrent));
    }

    @Override
    public CompletableFuture<Slot> acquire(CancellationToken cancellationToken) {
        CancellationToken token = cancellationToken == null ? CancellationToken.none() : cancellationToken;
        if (token.isCancelled()) {
            return CompletableFuture.failedFuture(ConduitException.cancelled(token.reason()));
        }

        Waiter waiter;
        int queued;
        lock.lock();
        try {
            if (active < config.maxConcurrent()) {
                active++;
                return CompletableFuture.completedFuture(Slot.issue(++sequence));
            }
            waiter = new Waiter();
            waiters.addLast(waiter);
            queued = waiters.size();
        } finally {
            lock.unlock();
        }

        log.debug("Gate saturated (max={}), caller queued at position {}", config.maxConcurrent(), queued);
        CancellationToken.Registration registration = token.onCancel(() -> abandon(waiter, token.reason()));
        waiter.future.whenComplete((slot, error) -> registration.close());
        return waiter.future;
    }

    @Override
    public void release(Slot slot) {
        if (slot == null) {
            throw new IllegalArgumentException("slot cannot be null");
        }
        if (!slot.markReleased()) {
            log.debug("Slot {} already released, ignoring", slot.getId());
            return;
        }

        Waiter next;
        Slot handed = null;
        lock.lock();
        try {
            next = waiters.pollFirst();
            if (next == null) {
                active--;
            } else {
                handed = Slot.issue(++sequence);
            }
        } finally {
            lock.unlock();
        }

        if (next != null && !next.future.complete(handed)) {
            // 호출자가 future를 직접 취소한 경우: 넘긴 Slot을 다시 반환
            release(handed);
        }
    }

    private void abandon(Waiter waiter, String reason) {
        boolean removed;
        lock.lock();
        try {
            removed = waiters.remove(waiter);
        } finally {
            lock.unlock();
        }
        if (removed) {
            log.debug("Queued caller cancelled before a slot was granted: {}", reason);
            waiter.future.completeExceptionally(ConduitException.cancelled(reason));
        }
    }

    @Override
    public int activeCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int waitingCount() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public GateConfig config() {
        return config;
    }

    private static final class Waiter {
        private final CompletableFuture<Slot> future = new CompletableFuture<>();
    }
}
