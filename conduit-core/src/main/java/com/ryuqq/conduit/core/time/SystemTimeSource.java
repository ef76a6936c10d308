package com.ryuqq.conduit.core.time;

/**
 * 시스템 시계 - {@link System#currentTimeMillis()} 사용.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class SystemTimeSource implements TimeSource {

    private static final SystemTimeSource INSTANCE = new SystemTimeSource();

    private SystemTimeSource() {
    }

    public static SystemTimeSource instance() {
        return INSTANCE;
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }
}
