package com.ryuqq.conduit.adapter.runner;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 배치 윈도우 타이머.
 *
 * <p>Collector 하나가 하나의 Alarm을 소유합니다. 한 번에 하나의 예약만 무장할 수 있으며,
 * 무장 상태에서 다시 arm()하면 {@link IllegalStateException}을 던집니다.</p>
 *
 * <p>disarm() 이후에도 이미 실행 중인 콜백은 막을 수 없으므로,
 * 콜백 쪽에서 윈도우 식별자로 오래된 발화를 걸러야 합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class FlushAlarm {

    private final ScheduledExecutorService scheduler;
    private final long delayMs;
    private ScheduledFuture<?> pending;

    /**
     * 생성자.
     *
     * @param scheduler 스케줄러
     * @param delayMs 무장 후 발화까지의 시간 (밀리초, 양수)
     * @throws IllegalArgumentException 인자 검증 실패 시
     */
    public FlushAlarm(ScheduledExecutorService scheduler, long delayMs) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (delayMs <= 0) {
            throw new IllegalArgumentException("delayMs must be positive (current: " + delayMs + ")");
        }
        this.scheduler = scheduler;
        this.delayMs = delayMs;
    }

    /**
     * 타이머 무장.
     *
     * @param onFire 발화 시 실행할 작업
     * @throws IllegalStateException 이미 무장된 경우
     * @throws RejectedExecutionException 스케줄러가 종료된 경우
     */
    public synchronized void arm(Runnable onFire) {
        if (isArmed()) {
            throw new IllegalStateException("FlushAlarm is already armed");
        }
        pending = scheduler.schedule(onFire, delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 타이머 해제.
     *
     * @return 발화 전에 해제되었으면 true
     */
    public synchronized boolean disarm() {
        if (pending == null) {
            return false;
        }
        boolean cancelled = pending.cancel(false);
        pending = null;
        return cancelled;
    }

    /**
     * 무장 여부 (예약되었고 아직 발화하지 않음).
     *
     * @return 무장 상태면 true
     */
    public synchronized boolean isArmed() {
        return pending != null && !pending.isDone();
    }

    public long getDelayMs() {
        return delayMs;
    }
}
