package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.core.failure.ConduitException;

import java.util.concurrent.CompletableFuture;

/**
 * CompletableFuture 연결 유틸리티.
 *
 * <p>호출자에게 돌려주는 future는 항상 래핑되지 않은 원인으로 예외 완료되어야 하므로,
 * {@code thenApply}/{@code thenCompose} 대신 이 유틸리티로 결과를 전달합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
final class Futures {

    // Utility class - prevent instantiation
    private Futures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * source의 결과를 target으로 전달 (예외는 CompletionException 래핑 제거).
     *
     * @param source 원본 future
     * @param target 전달받을 future
     * @param <T> 결과 타입
     */
    static <T> void relay(CompletableFuture<? extends T> source, CompletableFuture<T> target) {
        source.whenComplete((value, error) -> {
            if (error != null) {
                target.completeExceptionally(ConduitException.unwrap(error));
            } else {
                target.complete(value);
            }
        });
    }

    /**
     * 공유 future를 호출자별 사본으로 분리.
     *
     * <p>한 호출자가 사본을 complete/cancel해도 원본과 다른 호출자에게 영향이 없습니다.</p>
     *
     * @param shared 공유 future
     * @param <T> 결과 타입
     * @return 분리된 사본
     */
    static <T> CompletableFuture<T> detach(CompletableFuture<T> shared) {
        CompletableFuture<T> copy = new CompletableFuture<>();
        relay(shared, copy);
        return copy;
    }
}
