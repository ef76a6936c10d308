package com.ryuqq.conduit.core.statemachine;

/**
 * 응답 캐시의 키별 상태.
 *
 * <pre>
 * EMPTY ──► FETCHING ──► CACHED ──► EXPIRED ──► FETCHING ...
 *              │
 *              └──► EMPTY (실패: 캐시하지 않음)
 * </pre>
 *
 * <p>invalidate()는 어느 상태에서든 EMPTY로 되돌립니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public enum CacheKeyState {

    /**
     * 레코드도, 진행 중인 조회도 없음.
     */
    EMPTY,

    /**
     * In-flight Marker 존재 (조회 진행 중).
     */
    FETCHING,

    /**
     * 유효한 레코드 존재.
     */
    CACHED,

    /**
     * 레코드는 있으나 TTL 경과 (다음 조회 시 제거).
     */
    EXPIRED
}
