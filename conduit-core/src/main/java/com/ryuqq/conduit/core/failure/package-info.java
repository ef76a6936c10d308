/**
 * 실패 분류 패키지.
 *
 * <p>CANCELLED / TIMEOUT / TRANSIENT / TERMINAL 네 가지 분류와
 * 협력자 경계의 단일 예외 타입 {@link com.ryuqq.conduit.core.failure.ConduitException}을 정의합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.core.failure;
