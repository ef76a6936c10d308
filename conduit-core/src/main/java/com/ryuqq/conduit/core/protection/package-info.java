/**
 * Protection SPI 패키지.
 *
 * <p>공유 Transport를 보호하는 확장점과 정책 값을 정의합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conduit.core.protection.ConcurrencyGate} - 동시 실행 수 제한 (FIFO 대기, 취소 가능)</li>
 *   <li>{@link com.ryuqq.conduit.core.protection.Slot} - Gate가 발급하는 실행 허가</li>
 *   <li>{@link com.ryuqq.conduit.core.protection.GateConfig} - 최대 동시 실행 수 C</li>
 *   <li>{@link com.ryuqq.conduit.core.protection.RetryPolicy} - 재시도 횟수, 시도별 타임아웃, 백오프</li>
 * </ul>
 *
 * <h2>적용 순서</h2>
 * <pre>
 * 1. ConcurrencyGate  → Slot 획득 (또는 FIFO 대기)
 * 2. RetryPolicy      → 시도별 타임아웃 + 백오프 재시도
 * 3. Transport        → 실제 왕복
 * 4. ConcurrencyGate  → Slot 반납, 다음 대기자에게 직접 인계
 * </pre>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.conduit.core.protection.noop.NoOpConcurrencyGate}는
 * 모든 요청을 즉시 허용합니다. 상한 없는 Priority Lane 구성에 사용됩니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.core.protection;
