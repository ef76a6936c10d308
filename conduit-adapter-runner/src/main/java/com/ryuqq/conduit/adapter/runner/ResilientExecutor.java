package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.application.orchestrator.Operation;
import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.contract.CallOptions;
import com.ryuqq.conduit.core.failure.ConduitException;
import com.ryuqq.conduit.core.protection.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 한 논리 Operation을 타임아웃/재시도/취소 정책에 따라 실행합니다.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * execute(operation, options)
 *   ↓
 * 외부 토큰 이미 취소? → CANCELLED (시도 0회)
 *   ↓
 * for attempt in 0..maxRetries:
 *   1. 시도 토큰 생성 (perAttemptTimeout 또는 외부 토큰 발화 시 취소)
 *   2. operation.run(attemptToken)
 *   3. 성공 → 즉시 반환
 *   4. 실패 → FailureClassifier로 분류
 *      - 외부 취소 → CANCELLED (재시도 없음)
 *      - TIMEOUT / TRANSIENT이고 시도가 남음 → 백오프 대기 후 다음 시도
 *      - 그 외 → 최종 실패
 * </pre>
 *
 * <p>백오프 대기는 스케줄러에서 비동기로 진행되며, 대기 중 외부 토큰이 발화하면
 * 대기를 중단하고 즉시 CANCELLED로 실패합니다.</p>
 *
 * <p>이 클래스는 게이트를 알지 못합니다. Slot 획득/반환은 호출 측이 담당합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class ResilientExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResilientExecutor.class);

    private final ScheduledExecutorService scheduler;
    private final RetryPolicy defaultPolicy;
    private final Random random;

    /**
     * 생성자.
     *
     * @param scheduler 타임아웃/백오프 스케줄러
     * @param defaultPolicy 호출별 정책이 없을 때 적용할 정책
     * @param random Jitter 난수 생성기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResilientExecutor(ScheduledExecutorService scheduler, RetryPolicy defaultPolicy, Random random) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (defaultPolicy == null) {
            throw new IllegalArgumentException("defaultPolicy cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.scheduler = scheduler;
        this.defaultPolicy = defaultPolicy;
        this.random = random;
    }

    public ResilientExecutor(ScheduledExecutorService scheduler, RetryPolicy defaultPolicy) {
        this(scheduler, defaultPolicy, new Random());
    }

    /**
     * Operation 실행.
     *
     * @param operation 작업
     * @param options 호출 옵션
     * @param <T> 결과 타입
     * @return 결과 future (실패 시 ConduitException)
     * @throws IllegalArgumentException operation 또는 options가 null인 경우
     */
    public <T> CompletableFuture<T> execute(Operation<T> operation, CallOptions options) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        Execution<T> execution = new Execution<>(operation, options, options.retryPolicyOr(defaultPolicy));
        execution.start();
        return execution.result;
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    /**
     * 한 번의 execute 호출 상태.
     */
    private final class Execution<T> {

        private final Operation<T> operation;
        private final CallOptions options;
        private final RetryPolicy policy;
        private final CancellationToken external;
        private final FailureClassifier classifier;
        private final BackoffCalculator backoff;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        private Execution(Operation<T> operation, CallOptions options, RetryPolicy policy) {
            this.operation = operation;
            this.options = options;
            this.policy = policy;
            this.external = options.cancellationToken();
            this.classifier = new FailureClassifier(policy);
            this.backoff = BackoffCalculator.of(policy, random);
        }

        private void start() {
            runAttempt(0, 0L);
        }

        private void runAttempt(int attempt, long previousDelayMs) {
            if (external.isCancelled()) {
                result.completeExceptionally(ConduitException.cancelled(external.reason(), attempt, null));
                return;
            }

            CancellationToken attemptToken = CancellationToken.create();
            AtomicBoolean timedOut = new AtomicBoolean(false);
            CompletableFuture<T> attemptResult = new CompletableFuture<>();

            CancellationToken.Registration abort = attemptToken.onCancel(
                () -> attemptResult.completeExceptionally(new CancellationException(attemptToken.reason())));
            CancellationToken.Registration link = external.onCancel(
                () -> attemptToken.cancel("external cancellation: " + external.reason()));

            ScheduledFuture<?> timer;
            try {
                timer = scheduler.schedule(() -> {
                    timedOut.set(true);
                    attemptToken.cancel("timeout after " + policy.perAttemptTimeoutMs() + "ms");
                }, policy.perAttemptTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                link.close();
                abort.close();
                result.completeExceptionally(ConduitException.cancelled("scheduler shut down", attempt, e));
                return;
            }

            attemptResult.whenComplete((value, error) -> {
                timer.cancel(false);
                link.close();
                abort.close();
                if (error == null) {
                    result.complete(value);
                } else {
                    onAttemptFailed(attempt, previousDelayMs, ConduitException.unwrap(error), timedOut.get());
                }
            });

            if (attemptResult.isDone()) {
                // 등록 사이에 외부 토큰이 발화: 시도를 시작하지 않음
                return;
            }
            CompletableFuture<T> running;
            try {
                running = operation.run(attemptToken);
                if (running == null) {
                    running = CompletableFuture.failedFuture(new IllegalStateException("Operation returned null future"));
                }
            } catch (RuntimeException e) {
                running = CompletableFuture.failedFuture(e);
            }
            Futures.relay(running, attemptResult);
        }

        private void onAttemptFailed(int attempt, long previousDelayMs, Throwable error, boolean timedOut) {
            int attempts = attempt + 1;
            String externalReason = external.isCancelled() ? external.reason() : null;
            ConduitException failure = classifier.classify(error, externalReason, timedOut, attempts);

            if (!classifier.shouldRetry(failure, attempt)) {
                result.completeExceptionally(failure);
                return;
            }

            // 상한 도달 후 jitter로 인해 대기가 줄어들지 않도록 이전 대기 이상 유지
            long delayMs = Math.max(backoff.calculate(attempt), previousDelayMs);
            log.warn("Retrying operation={} after attempt={} failed ({}{}), delayMs={}",
                options.operation(), attempt, failure.kind(),
                failure.statusCode() == null ? "" : ", status=" + failure.statusCode(), delayMs);

            sleep(delayMs, attempts, failure).whenComplete((ignored, sleepError) -> {
                if (sleepError != null) {
                    result.completeExceptionally(ConduitException.unwrap(sleepError));
                } else {
                    runAttempt(attempt + 1, delayMs);
                }
            });
        }

        private CompletableFuture<Void> sleep(long delayMs, int attempts, ConduitException lastFailure) {
            CompletableFuture<Void> wake = new CompletableFuture<>();
            CancellationToken.Registration registration = external.onCancel(() -> wake.completeExceptionally(
                ConduitException.cancelled(external.reason(), attempts, lastFailure)));
            try {
                ScheduledFuture<?> timer = scheduler.schedule(
                    () -> wake.complete(null), delayMs, TimeUnit.MILLISECONDS);
                wake.whenComplete((ignored, error) -> timer.cancel(false));
            } catch (RejectedExecutionException e) {
                wake.completeExceptionally(ConduitException.cancelled("scheduler shut down", attempts, lastFailure));
            }
            wake.whenComplete((ignored, error) -> registration.close());
            return wake;
        }
    }
}
