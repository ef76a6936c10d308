package com.ryuqq.conduit.core.spi;

/**
 * 네트워크 수준 Transport 실패.
 *
 * <p>연결 실패, 연결 끊김, DNS 오류 등 응답 상태 코드를 받지 못한 경우입니다.
 * Executor는 이 예외를 TRANSIENT로 분류하여 재시도합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class TransportException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String target;

    public TransportException(String target, String message) {
        super(message);
        this.target = target;
    }

    public TransportException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
