package com.ryuqq.conduit.core.time;

/**
 * 벽시계 시각 공급자.
 *
 * <p>캐시 TTL 판단에 사용됩니다. 테스트에서는 수동으로 진행시키는 구현으로 교체합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * 현재 시각.
     *
     * @return epoch 밀리초
     */
    long currentTimeMillis();
}
