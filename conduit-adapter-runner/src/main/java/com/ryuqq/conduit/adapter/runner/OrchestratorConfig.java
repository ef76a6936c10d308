package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.core.protection.RetryPolicy;

import java.util.Set;

/**
 * DefaultRequestOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrent: 공유 게이트의 동시 실행 상한 C (기본 6)</li>
 *   <li>retryPolicy: 호출별 정책이 없을 때 적용할 재시도 정책 (기본 {@link RetryPolicy#RetryPolicy()})</li>
 *   <li>priorityMaxConcurrent: Priority Lane의 별도 상한 (기본 8, 0이면 상한 없음)</li>
 *   <li>priorityOperations: Priority Lane 허용 목록 (기본 빈 집합 = 모든 이름 허용)</li>
 *   <li>schedulerThreads: 타임아웃/백오프/배치 타이머 스레드 수 (기본 2)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>원격 Gateway가 쉽게 포화되면 maxConcurrent 감소 (6 → 2)</li>
 *   <li>인증/세션 호출이 대량 트래픽에 밀리면 priorityOperations에 해당 이름 등록</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 * @param maxConcurrent 공유 게이트 상한 (1 이상)
 * @param retryPolicy 기본 재시도 정책
 * @param priorityMaxConcurrent Priority Lane 상한 (0 이상, 0 = 상한 없음)
 * @param priorityOperations Priority Lane 허용 목록
 * @param schedulerThreads 스케줄러 스레드 수 (1 이상)
 */
public record OrchestratorConfig(
    int maxConcurrent,
    RetryPolicy retryPolicy,
    int priorityMaxConcurrent,
    Set<String> priorityOperations,
    int schedulerThreads
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrent=6, retryPolicy=기본, priorityMaxConcurrent=8,
     * priorityOperations=없음(전체 허용), schedulerThreads=2</p>
     */
    public OrchestratorConfig() {
        this(6, new RetryPolicy(), 8, Set.of(), 2);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrent must be positive (current: " + maxConcurrent + ")"
            );
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (priorityMaxConcurrent < 0) {
            throw new IllegalArgumentException(
                "priorityMaxConcurrent cannot be negative (current: " + priorityMaxConcurrent + ")"
            );
        }
        if (schedulerThreads <= 0) {
            throw new IllegalArgumentException(
                "schedulerThreads must be positive (current: " + schedulerThreads + ")"
            );
        }
        priorityOperations = priorityOperations == null ? Set.of() : Set.copyOf(priorityOperations);
    }

    public OrchestratorConfig withMaxConcurrent(int maxConcurrent) {
        return new OrchestratorConfig(maxConcurrent, retryPolicy, priorityMaxConcurrent, priorityOperations, schedulerThreads);
    }

    public OrchestratorConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new OrchestratorConfig(maxConcurrent, retryPolicy, priorityMaxConcurrent, priorityOperations, schedulerThreads);
    }

    public OrchestratorConfig withPriorityMaxConcurrent(int priorityMaxConcurrent) {
        return new OrchestratorConfig(maxConcurrent, retryPolicy, priorityMaxConcurrent, priorityOperations, schedulerThreads);
    }

    public OrchestratorConfig withPriorityOperations(Set<String> priorityOperations) {
        return new OrchestratorConfig(maxConcurrent, retryPolicy, priorityMaxConcurrent, priorityOperations, schedulerThreads);
    }

    public OrchestratorConfig withSchedulerThreads(int schedulerThreads) {
        return new OrchestratorConfig(maxConcurrent, retryPolicy, priorityMaxConcurrent, priorityOperations, schedulerThreads);
    }
}
