package com.ryuqq.conduit.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.conduit.core.statemachine.BatchState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * BatchStateTransition 테스트.
 *
 * <ul>
 *   <li>IDLE → COLLECTING → FLUSHING → IDLE 순환 성공</li>
 *   <li>단계를 건너뛰는 전이는 IllegalStateException</li>
 *   <li>null 상태는 IllegalArgumentException</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class BatchStateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_전체_순환_성공() {
        // Given
        BatchState state = IDLE;

        // When
        state = BatchStateTransition.transition(state, COLLECTING);
        assertTrue(state.isCollecting());
        state = BatchStateTransition.transition(state, FLUSHING);
        state = BatchStateTransition.transition(state, IDLE);

        // Then
        assertEquals(IDLE, state);
    }

    // ========== 비정상 전이 테스트 ==========

    @Test
    void validate_IdleToFlushing_Throws() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> BatchStateTransition.validate(IDLE, FLUSHING));

        assertTrue(e.getMessage().contains("IDLE"));
    }

    @Test
    void validate_FlushingToCollecting_Throws() {
        assertThrows(IllegalStateException.class, () -> BatchStateTransition.validate(FLUSHING, COLLECTING));
    }

    @Test
    void validate_CollectingToIdle_Throws() {
        assertThrows(IllegalStateException.class, () -> BatchStateTransition.validate(COLLECTING, IDLE));
    }

    @Test
    void validate_SameState_Throws() {
        assertThrows(IllegalStateException.class, () -> BatchStateTransition.validate(COLLECTING, COLLECTING));
    }

    @Test
    void validate_Null_Throws() {
        assertThrows(IllegalArgumentException.class, () -> BatchStateTransition.validate(null, IDLE));
        assertThrows(IllegalArgumentException.class, () -> BatchStateTransition.validate(IDLE, null));
    }
}
