/**
 * Runner Adapter Layer - RequestOrchestrator 구현체.
 *
 * <p>이 패키지는 RequestOrchestrator 인터페이스의 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conduit.adapter.runner.DefaultRequestOrchestrator} - 게이트/재시도/배칭/캐시 조합</li>
 *   <li>{@link com.ryuqq.conduit.adapter.runner.FifoConcurrencyGate} - FIFO 동시성 게이트</li>
 *   <li>{@link com.ryuqq.conduit.adapter.runner.ResilientExecutor} - 타임아웃 + 재시도 + 취소</li>
 *   <li>{@link com.ryuqq.conduit.adapter.runner.AutoBatchCollector} - 윈도우 기반 배치 수집기</li>
 *   <li>{@link com.ryuqq.conduit.adapter.runner.DeduplicatingResponseCache} - TTL 캐시 + 중복 호출 병합</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultRequestOrchestrator)
 *   ↓ implements
 * application (RequestOrchestrator, BatchLookup, CachedLookup)
 *   ↓ depends on
 * core (CallOptions, RetryPolicy, ConcurrencyGate, LookupResult, ConduitException)
 *   ↓ depends on
 * core/spi (Transport, CacheStore)
 * </pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.adapter.runner;
