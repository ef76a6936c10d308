/**
 * 고팬아웃 리소스를 위한 조회 계층.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conduit.application.lookup.BatchLookup} - 윈도우 기반 자동 배칭</li>
 *   <li>{@link com.ryuqq.conduit.application.lookup.CachedLookup} - TTL 캐시 + 중복 호출 병합</li>
 * </ul>
 *
 * <p>두 계층 모두 게이트 앞에 위치하며, 실패를 재해석하지 않고 그대로 전달합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.application.lookup;
