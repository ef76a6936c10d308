package com.ryuqq.conduit.core.protection.noop;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.protection.ConcurrencyGate;
import com.ryuqq.conduit.core.protection.GateConfig;
import com.ryuqq.conduit.core.protection.Slot;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NoOp Concurrency Gate 구현체.
 *
 * <p>모든 요청을 즉시 허용합니다. 대기열이 없으므로 waitingCount()는 항상 0입니다.
 * 상한 없는 Priority Lane이나 테스트 환경에서 사용됩니다.</p>
 *
 * <p>이미 취소된 토큰으로 호출하면 Slot을 발급하지 않고 CANCELLED로 실패합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class NoOpConcurrencyGate implements ConcurrencyGate {

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public CompletableFuture<Slot> acquire(CancellationToken cancellationToken) {
        if (cancellationToken != null && cancellationToken.isCancelled()) {
            return CompletableFuture.failedFuture(ConduitException.cancelled(cancellationToken.reason()));
        }
        active.incrementAndGet();
        return CompletableFuture.completedFuture(Slot.issue(sequence.incrementAndGet()));
    }

    @Override
    public void release(Slot slot) {
        if (slot != null && slot.markReleased()) {
            active.decrementAndGet();
        }
    }

    @Override
    public int activeCount() {
        return active.get();
    }

    @Override
    public int waitingCount() {
        return 0;
    }

    @Override
    public GateConfig config() {
        return GateConfig.UNBOUNDED;
    }
}
