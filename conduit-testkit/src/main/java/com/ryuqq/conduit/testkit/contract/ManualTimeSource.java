package com.ryuqq.conduit.testkit.contract;

import com.ryuqq.conduit.core.time.TimeSource;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hand-driven {@link TimeSource} for TTL scenarios.
 *
 * <p>Time only moves when a test calls {@link #advance(long)} or {@link #set(long)}.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class ManualTimeSource implements TimeSource {

    private final AtomicLong now;

    public ManualTimeSource() {
        this(1_000_000L);
    }

    public ManualTimeSource(long startMillis) {
        this.now = new AtomicLong(startMillis);
    }

    @Override
    public long currentTimeMillis() {
        return now.get();
    }

    /**
     * Moves the clock forward.
     *
     * @param millis milliseconds to advance (must not be negative)
     * @return the new time
     */
    public long advance(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis cannot be negative (current: " + millis + ")");
        }
        return now.addAndGet(millis);
    }

    public void set(long millis) {
        now.set(millis);
    }
}
