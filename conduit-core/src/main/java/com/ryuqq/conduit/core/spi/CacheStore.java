package com.ryuqq.conduit.core.spi;

import com.ryuqq.conduit.core.model.CacheRecord;

import java.util.Optional;

/**
 * Cache Record 저장소 SPI.
 *
 * <p>응답 캐시의 레코드를 보관합니다. 만료 판단은 호출 측(ResponseCache)이 하며,
 * 저장소는 단순 키-레코드 매핑만 책임집니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>thread-safe해야 함</li>
 *   <li>{@link #remove(Object, CacheRecord)}는 조건부 제거 (같은 레코드일 때만)</li>
 *   <li>영속화하지 않음 (프로세스 재시작 시 비워짐)</li>
 * </ul>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public interface CacheStore<K, V> {

    /**
     * 레코드 조회.
     *
     * @param key 키
     * @return 레코드 (만료 여부와 무관), 없으면 empty
     */
    Optional<CacheRecord<V>> get(K key);

    /**
     * 레코드 저장 (기존 레코드 덮어쓰기).
     *
     * @param key 키
     * @param record 레코드
     */
    void put(K key, CacheRecord<V> record);

    /**
     * 레코드 제거.
     *
     * @param key 키
     * @return 제거된 레코드가 있었으면 true
     */
    boolean remove(K key);

    /**
     * 조건부 제거 (저장된 레코드가 expected와 같을 때만).
     *
     * <p>만료 레코드 지연 제거 시, 그 사이 저장된 새 레코드를 지우지 않기 위해 사용합니다.</p>
     *
     * @param key 키
     * @param expected 기대 레코드
     * @return 제거되었으면 true
     */
    boolean remove(K key, CacheRecord<V> expected);

    /**
     * 모든 레코드 제거.
     */
    void clear();

    /**
     * 저장된 레코드 수 (만료 레코드 포함).
     *
     * @return 레코드 수
     */
    int size();
}
