package com.ryuqq.conduit.core.failure;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Conduit 호출 실패.
 *
 * <p>협력자(collaborator) 경계에서 관측되는 유일한 실패 타입입니다.
 * {@link FailureKind}로 분류되며, 시도 횟수와 (있다면) 마지막 HTTP 상태 코드를 함께 전달합니다.</p>
 *
 * <p><strong>전파 정책:</strong></p>
 * <ul>
 *   <li>분류와 재시도 판단은 ResilientExecutor 내부에서만 수행</li>
 *   <li>배치/캐시 계층은 이 예외를 재해석하지 않고 그대로 전달</li>
 *   <li>CANCELLED는 의도적 포기이므로 보통 화면에 노출하지 않음</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class ConduitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final FailureKind kind;
    private final int attempts;
    private final Integer statusCode;

    /**
     * 생성자.
     *
     * @param kind 실패 분류
     * @param message 메시지
     * @param attempts 수행된 시도 횟수 (0 이상)
     * @param statusCode 마지막 HTTP 상태 코드 (없으면 null)
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException kind가 null이거나 attempts가 음수인 경우
     */
    public ConduitException(FailureKind kind, String message, int attempts, Integer statusCode, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts cannot be negative (current: " + attempts + ")");
        }
        this.kind = kind;
        this.attempts = attempts;
        this.statusCode = statusCode;
    }

    public static ConduitException cancelled(String reason) {
        return new ConduitException(FailureKind.CANCELLED, "Cancelled: " + reason, 0, null, null);
    }

    public static ConduitException cancelled(String reason, int attempts, Throwable cause) {
        return new ConduitException(FailureKind.CANCELLED, "Cancelled: " + reason, attempts, null, cause);
    }

    public static ConduitException timeout(String message, int attempts, Throwable cause) {
        return new ConduitException(FailureKind.TIMEOUT, message, attempts, null, cause);
    }

    public static ConduitException transientFailure(String message, int attempts, Integer statusCode, Throwable cause) {
        return new ConduitException(FailureKind.TRANSIENT, message, attempts, statusCode, cause);
    }

    public static ConduitException terminal(String message, int attempts, Integer statusCode, Throwable cause) {
        return new ConduitException(FailureKind.TERMINAL, message, attempts, statusCode, cause);
    }

    /**
     * HTTP 상태 코드 기반 실패 생성.
     *
     * <p>시도 횟수는 아직 알 수 없으므로 0으로 두며, Executor가 분류 시 재작성합니다.</p>
     *
     * @param statusCode 응답 상태 코드
     * @param target 요청 대상 (메시지용)
     * @return TERMINAL로 분류된 예외 (Executor가 재시도 대상 여부를 다시 판단)
     */
    public static ConduitException unexpectedStatus(int statusCode, String target) {
        return new ConduitException(FailureKind.TERMINAL,
            "HTTP " + statusCode + " on " + target, 0, statusCode, null);
    }

    /**
     * 비동기 래퍼 예외를 벗겨 실제 원인 반환.
     *
     * <p>{@link CompletionException}, {@link ExecutionException}을 재귀적으로 제거합니다.</p>
     *
     * @param throwable 원본 예외
     * @return 래핑이 제거된 예외
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * 같은 분류/원인을 유지한 채 시도 횟수만 갱신한 사본.
     *
     * @param attempts 시도 횟수
     * @return 새 예외 인스턴스
     */
    public ConduitException withAttempts(int attempts) {
        ConduitException copy = new ConduitException(kind, getMessage(), attempts, statusCode, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public FailureKind kind() {
        return kind;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * 마지막 HTTP 상태 코드.
     *
     * @return 상태 코드, 없으면 null
     */
    public Integer statusCode() {
        return statusCode;
    }

    public boolean isCancelled() {
        return kind == FailureKind.CANCELLED;
    }
}
