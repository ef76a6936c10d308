package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.failure.FailureKind;
import com.ryuqq.conduit.core.protection.Slot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FifoConcurrencyGate 테스트.
 *
 * <ul>
 *   <li>동시 보유 Slot 수 상한</li>
 *   <li>FIFO 순서 보장</li>
 *   <li>대기 중 취소 시 대기열에서 제거</li>
 *   <li>중복 반환 무시</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class FifoConcurrencyGateTest {

    @Test
    @DisplayName("상한 이하에서는 즉시 Slot을 발급한다")
    void acquire_상한_이하_즉시_발급() {
        // given
        FifoConcurrencyGate gate = new FifoConcurrencyGate(2);

        // when
        CompletableFuture<Slot> first = gate.acquire(CancellationToken.none());
        CompletableFuture<Slot> second = gate.acquire(CancellationToken.none());

        // then
        assertThat(first).isCompleted();
        assertThat(second).isCompleted();
        assertThat(gate.activeCount()).isEqualTo(2);
        assertThat(gate.waitingCount()).isZero();
    }

    @Test
    @DisplayName("상한에 도달하면 대기하고 반환 시 도착 순서대로 넘겨받는다")
    void acquire_상한_도달_FIFO_순서() {
        // given
        FifoConcurrencyGate gate = new FifoConcurrencyGate(1);
        Slot held = gate.acquire(CancellationToken.none()).join();
        List<Integer> order = new ArrayList<>();
        List<CompletableFuture<Slot>> waiters = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            int index = i;
            CompletableFuture<Slot> waiter = gate.acquire(CancellationToken.none());
            waiter.thenAccept(slot -> order.add(index));
            waiters.add(waiter);
        }
        assertThat(gate.waitingCount()).isEqualTo(3);

        // when
        gate.release(held);
        gate.release(waiters.get(0).join());
        gate.release(waiters.get(1).join());

        // then
        assertThat(order).containsExactly(0, 1, 2);
        assertThat(gate.activeCount()).isEqualTo(1);
        assertThat(gate.waitingCount()).isZero();
    }

    @Test
    @DisplayName("Slot 반환 후 대기자가 없으면 활성 수가 감소한다")
    void release_대기자_없음_활성_감소() {
        // given
        FifoConcurrencyGate gate = new FifoConcurrencyGate(3);
        Slot slot = gate.acquire(CancellationToken.none()).join();

        // when
        gate.release(slot);

        // then
        assertThat(gate.activeCount()).isZero();
        assertThat(slot.isReleased()).isTrue();
    }

    @Test
    @DisplayName("같은 Slot을 두 번 반환해도 활성 수는 한 번만 감소한다")
    void release_중복_반환_무시() {
        // given
        FifoConcurrencyGate gate = new FifoConcurrencyGate(2);
        Slot first = gate.acquire(CancellationToken.none()).join();
        gate.acquire(CancellationToken.none()).join();

        // when
        gate.release(first);
        gate.release(first);

        // then
        assertThat(gate.activeCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("null Slot 반환은 IllegalArgumentException")
    void release_null_예외() {
        FifoConcurrencyGate gate = new FifoConcurrencyGate(1);

        assertThatThrownBy(() -> gate.release(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("대기 중 취소되면 CANCELLED로 실패하고 대기열에서 제거된다")
    void acquire_대기_중_취소() {
        // given
        FifoConcurrencyGate gate = new FifoConcurrencyGate(1);
        Slot held = gate.acquire(CancellationToken.none()).join();
        CancellationToken token = CancellationToken.create();
        CompletableFuture<Slot> waiting = gate.acquire(token);
        CompletableFuture<Slot> next = gate.acquire(CancellationToken.none());

        // when
        token.cancel("user navigated away");

        // then
        assertThat(waiting).isCompletedExceptionally();
        Throwable cause = waiting.handle((slot, error) -> error).join();
        assertThat(cause).isInstanceOf(ConduitException.class);
        assertThat(((ConduitException) cause).kind()).isEqualTo(FailureKind.CANCELLED);
        assertThat(gate.waitingCount()).isEqualTo(1);

        gate.release(held);
        assertThat(next).isCompleted();
        assertThat(gate.activeCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("이미 취소된 토큰으로 요청하면 Slot을 소비하지 않고 즉시 실패한다")
    void acquire_이미_취소된_토큰() {
        // given
        FifoConcurrencyGate gate = new FifoConcurrencyGate(1);
        CancellationToken token = CancellationToken.create();
        token.cancel("gone");

        // when
        CompletableFuture<Slot> result = gate.acquire(token);

        // then
        assertThat(result).isCompletedExceptionally();
        assertThat(gate.activeCount()).isZero();
    }

    @Test
    @DisplayName("대기자가 future를 직접 취소하면 넘겨질 Slot은 다음 대기자에게 간다")
    void release_대기자_future_취소_다음으로_전달() {
        // given
        FifoConcurrencyGate gate = new FifoConcurrencyGate(1);
        Slot held = gate.acquire(CancellationToken.none()).join();
        CompletableFuture<Slot> abandoned = gate.acquire(CancellationToken.none());
        CompletableFuture<Slot> next = gate.acquire(CancellationToken.none());
        abandoned.cancel(false);

        // when
        gate.release(held);

        // then
        assertThat(next).isCompleted();
        assertThat(gate.activeCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("여러 스레드가 경쟁해도 동시 보유 수는 상한을 넘지 않는다")
    void 동시성_상한_유지() throws Exception {
        // given
        int limit = 3;
        FifoConcurrencyGate gate = new FifoConcurrencyGate(limit);
        AtomicInteger holding = new AtomicInteger();
        AtomicInteger maxHolding = new AtomicInteger();
        int callers = 40;
        CountDownLatch done = new CountDownLatch(callers);
        ExecutorService pool = Executors.newFixedThreadPool(8);

        // when
        for (int i = 0; i < callers; i++) {
            pool.submit(() -> gate.acquire(CancellationToken.none()).thenAccept(slot -> {
                int now = holding.incrementAndGet();
                maxHolding.accumulateAndGet(now, Math::max);
                holding.decrementAndGet();
                gate.release(slot);
                done.countDown();
            }));
        }

        // then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(maxHolding.get()).isLessThanOrEqualTo(limit);
        assertThat(gate.activeCount()).isZero();
        assertThat(gate.waitingCount()).isZero();
    }
}
