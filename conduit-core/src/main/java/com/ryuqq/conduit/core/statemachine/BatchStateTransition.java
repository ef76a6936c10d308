package com.ryuqq.conduit.core.statemachine;

/**
 * 배치 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → COLLECTING</li>
 *   <li>COLLECTING → FLUSHING</li>
 *   <li>FLUSHING → IDLE</li>
 * </ul>
 *
 * <p>그 외 전이(예: IDLE → FLUSHING, FLUSHING → COLLECTING)는 타이머 관리 오류를 의미하므로
 * {@link IllegalStateException}으로 거부합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class BatchStateTransition {

    // Utility class - prevent instantiation
    private BatchStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(BatchState from, BatchState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid;
        switch (from) {
            case IDLE:
                valid = to == BatchState.COLLECTING;
                break;
            case COLLECTING:
                valid = to == BatchState.FLUSHING;
                break;
            case FLUSHING:
                valid = to == BatchState.IDLE;
                break;
            default:
                valid = false;
        }

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid batch state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static BatchState transition(BatchState current, BatchState next) {
        validate(current, next);
        return next;
    }
}
