/**
 * 상태 기계 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conduit.core.statemachine.BatchState} - 배치 수집기 IDLE → COLLECTING → FLUSHING → IDLE</li>
 *   <li>{@link com.ryuqq.conduit.core.statemachine.BatchStateTransition} - 배치 전이 검증</li>
 *   <li>{@link com.ryuqq.conduit.core.statemachine.CacheKeyState} - 캐시 키별 상태</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.core.statemachine;
