/**
 * Conduit 기본 값 타입 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conduit.core.model.OperationName} - 호출 지점 라벨 (로그, Priority 허용 목록)</li>
 *   <li>{@link com.ryuqq.conduit.core.model.CacheRecord} - 값 + 생성 시각 + TTL</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.core.model;
