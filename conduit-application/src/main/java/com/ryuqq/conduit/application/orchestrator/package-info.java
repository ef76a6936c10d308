/**
 * Conduit Application Layer - 요청 조정 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conduit.application.orchestrator.RequestOrchestrator} - 호출 진입점</li>
 *   <li>{@link com.ryuqq.conduit.application.orchestrator.Operation} - 재시도 단위 작업</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>명시적 인스턴스:</strong> 전역 상태 대신 한 번 생성해 주입</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.application.orchestrator;
