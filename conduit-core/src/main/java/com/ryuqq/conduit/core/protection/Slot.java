package com.ryuqq.conduit.core.protection;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 공유 Transport에 대해 작업 하나를 수행할 수 있는 허가(permit).
 *
 * <p>물리적 자원이 아니라 Gate의 활성 카운트에 대한 영수증입니다.
 * 한 Slot은 최대 한 번만 반납되며, 두 번째 반납은 무시됩니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class Slot {

    private final long id;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private Slot(long id) {
        this.id = id;
    }

    /**
     * Slot 발급.
     *
     * @param id Gate 내 발급 순번
     * @return 새 Slot
     */
    public static Slot issue(long id) {
        return new Slot(id);
    }

    /**
     * 반납 표시 (최초 1회만 성공).
     *
     * @return 이번 호출로 반납 처리되었으면 true, 이미 반납된 Slot이면 false
     */
    public boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    public boolean isReleased() {
        return released.get();
    }

    public long getId() {
        return id;
    }

    @Override
    public String toString() {
        return "Slot{" + id + (released.get() ? ", released" : "") + '}';
    }
}
