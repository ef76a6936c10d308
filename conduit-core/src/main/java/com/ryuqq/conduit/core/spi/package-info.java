/**
 * SPI (Service Provider Interface) 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conduit.core.spi.Transport} - 불투명 요청/응답 왕복</li>
 *   <li>{@link com.ryuqq.conduit.core.spi.CacheStore} - 캐시 레코드 저장소</li>
 * </ul>
 *
 * <p>기본 구현은 {@code conduit-adapter-inmemory}, {@code conduit-adapter-http} 모듈에 있습니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.core.spi;
