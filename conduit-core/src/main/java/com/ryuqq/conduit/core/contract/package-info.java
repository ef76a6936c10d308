/**
 * 호출 계약 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conduit.core.contract.TransportRequest} - 불투명 요청 (target, method, headers, body)</li>
 *   <li>{@link com.ryuqq.conduit.core.contract.TransportResponse} - 불투명 응답 (statusCode, headers, body)</li>
 *   <li>{@link com.ryuqq.conduit.core.contract.CallOptions} - 호출 이름, 재시도 정책, 취소 토큰</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.core.contract;
