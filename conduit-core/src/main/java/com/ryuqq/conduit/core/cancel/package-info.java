/**
 * 협력적 취소 패키지.
 *
 * <p>{@link com.ryuqq.conduit.core.cancel.CancellationToken}은 Gate 대기열, 시도(attempt) 타임아웃,
 * 백오프 대기를 하나의 메커니즘으로 중단시킵니다. 타임아웃은 시도 범위로 한정된 취소의 특수한 경우입니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.core.cancel;
