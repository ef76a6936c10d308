package com.ryuqq.conduit.core.cancel;

import com.ryuqq.conduit.core.failure.ConduitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 협력적 취소(cooperative cancellation) 신호.
 *
 * <p>호출자가 대기 중이거나 진행 중인 작업을 포기할 때 사용합니다.
 * 한 번 취소된 토큰은 되돌릴 수 없으며, 등록된 콜백은 정확히 한 번 실행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * CompletableFuture<TransportResponse> future = orchestrator.send(request,
 *     CallOptions.named("catalog.list").withCancellation(token));
 *
 * // 화면 이탈 등으로 더 이상 결과가 필요 없을 때
 * token.cancel("view closed");
 * }</pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>cancel()과 onCancel()은 어느 스레드에서든 호출 가능</li>
 *   <li>취소 이후 등록된 콜백은 등록 스레드에서 즉시 실행</li>
 *   <li>콜백 예외는 로그만 남기고 다른 콜백 실행을 방해하지 않음</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final Set<Listener> listeners = ConcurrentHashMap.newKeySet();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * 새 취소 토큰 생성.
     *
     * @return 아직 취소되지 않은 토큰
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * 절대 취소되지 않는 토큰.
     *
     * <p>취소 신호가 없는 호출에 null 대신 사용합니다.</p>
     *
     * @return 공유 인스턴스
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * 토큰 취소.
     *
     * <p>처음 호출된 경우에만 등록된 콜백을 실행하고 true를 반환합니다.
     * 이미 취소된 토큰에 대한 호출은 아무 효과 없이 false를 반환합니다.</p>
     *
     * @param reason 취소 사유 (로그용)
     * @return 이번 호출로 취소되었으면 true
     * @throws UnsupportedOperationException {@link #none()} 토큰을 취소하려는 경우
     */
    public boolean cancel(String reason) {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        String effectiveReason = (reason == null || reason.isBlank()) ? "cancelled" : reason;
        if (!this.reason.compareAndSet(null, effectiveReason)) {
            return false;
        }
        for (Listener listener : listeners) {
            if (listeners.remove(listener)) {
                listener.fire();
            }
        }
        return true;
    }

    /**
     * 취소 여부 확인.
     *
     * @return 취소되었으면 true
     */
    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * 취소 사유 조회.
     *
     * @return 취소 사유, 취소되지 않았으면 null
     */
    public String reason() {
        return reason.get();
    }

    /**
     * 취소되었으면 CANCELLED 예외 발생.
     *
     * @throws ConduitException 이미 취소된 경우 (kind = CANCELLED)
     */
    public void throwIfCancelled() {
        String current = reason.get();
        if (current != null) {
            throw ConduitException.cancelled(current);
        }
    }

    /**
     * 취소 콜백 등록.
     *
     * <p>이미 취소된 토큰이면 콜백을 즉시 실행합니다.
     * 반환된 {@link Registration}을 닫으면 아직 실행되지 않은 콜백이 해제됩니다.</p>
     *
     * @param callback 취소 시 실행할 콜백
     * @return 등록 해제 핸들
     * @throws IllegalArgumentException callback이 null인 경우
     */
    public Registration onCancel(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (!cancellable) {
            return Registration.EMPTY;
        }
        Listener listener = new Listener(callback);
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.fire();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * 현재 등록된(아직 실행되지 않은) 콜백 수.
     *
     * @return 콜백 수
     */
    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "CancellationToken{none}";
        }
        String current = reason.get();
        return current == null ? "CancellationToken{active}" : "CancellationToken{cancelled: " + current + "}";
    }

    /**
     * 취소 콜백 등록 해제 핸들.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        /**
         * 아무 것도 하지 않는 핸들.
         */
        Registration EMPTY = () -> { };

        /**
         * 콜백 등록 해제 (멱등).
         */
        @Override
        void close();
    }

    private static final class Listener {

        private final Runnable callback;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Listener(Runnable callback) {
            this.callback = callback;
        }

        private void fire() {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed", e);
            }
        }
    }
}
