package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.core.model.OperationName;
import com.ryuqq.conduit.core.protection.ConcurrencyGate;
import com.ryuqq.conduit.core.protection.noop.NoOpConcurrencyGate;

import java.util.Set;

/**
 * 공유 게이트를 우회하는 지연 민감 호출 경로.
 *
 * <p>인증/세션 확인처럼 비용이 작고 팬아웃하지 않는 호출만 허용 목록으로 등록해 사용합니다.
 * 대량 백그라운드 조회가 공유 게이트를 채워도 이 경로의 호출은 밀리지 않습니다.</p>
 *
 * <p><strong>상한:</strong></p>
 * <ul>
 *   <li>maxConcurrent &gt; 0: 별도의 {@link FifoConcurrencyGate}로 제한</li>
 *   <li>maxConcurrent = 0: {@link NoOpConcurrencyGate} (상한 없음)</li>
 * </ul>
 *
 * <p>허용 목록이 비어 있으면 모든 이름을 허용합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class PriorityLane {

    private final ConcurrencyGate gate;
    private final Set<String> allowList;

    /**
     * 생성자.
     *
     * @param maxConcurrent Priority 상한 (0 = 상한 없음)
     * @param allowList 허용 목록 (빈 집합 = 전체 허용)
     * @throws IllegalArgumentException maxConcurrent가 음수인 경우
     */
    public PriorityLane(int maxConcurrent, Set<String> allowList) {
        if (maxConcurrent < 0) {
            throw new IllegalArgumentException("maxConcurrent cannot be negative (current: " + maxConcurrent + ")");
        }
        this.gate = maxConcurrent == 0 ? new NoOpConcurrencyGate() : new FifoConcurrencyGate(maxConcurrent);
        this.allowList = allowList == null ? Set.of() : Set.copyOf(allowList);
    }

    /**
     * 호출 이름이 허용 목록에 있는지 검사.
     *
     * @param operation 호출 이름
     * @throws IllegalArgumentException 허용 목록에 없는 이름인 경우
     */
    public void admit(OperationName operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (!isAllowed(operation)) {
            throw new IllegalArgumentException(
                "Operation '" + operation + "' is not on the priority allow-list " + allowList);
        }
    }

    public boolean isAllowed(OperationName operation) {
        return allowList.isEmpty() || allowList.contains(operation.getValue());
    }

    public ConcurrencyGate gate() {
        return gate;
    }

    public Set<String> allowList() {
        return allowList;
    }
}
