package com.ryuqq.conduit.adapter.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * FlushAlarm 테스트.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class FlushAlarmTest {

    @Mock
    private ScheduledExecutorService scheduler;

    @Mock
    private ScheduledFuture<Object> future;

    @Test
    @DisplayName("arm은 지정한 지연으로 예약하고 무장 상태가 된다")
    void arm_예약() {
        // given
        doReturn(future).when(scheduler).schedule(any(Runnable.class), eq(80L), eq(TimeUnit.MILLISECONDS));
        FlushAlarm alarm = new FlushAlarm(scheduler, 80);

        // when
        alarm.arm(() -> { });

        // then
        verify(scheduler).schedule(any(Runnable.class), eq(80L), eq(TimeUnit.MILLISECONDS));
        assertThat(alarm.isArmed()).isTrue();
    }

    @Test
    @DisplayName("이미 무장된 상태에서 다시 arm하면 IllegalStateException")
    void arm_중복_예외() {
        // given
        doReturn(future).when(scheduler).schedule(any(Runnable.class), eq(80L), eq(TimeUnit.MILLISECONDS));
        FlushAlarm alarm = new FlushAlarm(scheduler, 80);
        alarm.arm(() -> { });

        // when & then
        assertThatThrownBy(() -> alarm.arm(() -> { }))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("disarm은 예약을 취소하고 다시 arm할 수 있게 한다")
    void disarm_후_재무장() {
        // given
        doReturn(future).when(scheduler).schedule(any(Runnable.class), eq(80L), eq(TimeUnit.MILLISECONDS));
        when(future.cancel(false)).thenReturn(true);
        FlushAlarm alarm = new FlushAlarm(scheduler, 80);
        alarm.arm(() -> { });

        // when
        boolean cancelled = alarm.disarm();

        // then
        assertThat(cancelled).isTrue();
        assertThat(alarm.isArmed()).isFalse();
        alarm.arm(() -> { });
        assertThat(alarm.isArmed()).isTrue();
    }

    @Test
    @DisplayName("무장되지 않은 상태의 disarm은 false")
    void disarm_미무장() {
        FlushAlarm alarm = new FlushAlarm(scheduler, 80);

        assertThat(alarm.disarm()).isFalse();
        assertThat(alarm.isArmed()).isFalse();
    }

    @Test
    @DisplayName("잘못된 인자는 IllegalArgumentException")
    void 생성_검증() {
        assertThatThrownBy(() -> new FlushAlarm(null, 80))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FlushAlarm(scheduler, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
