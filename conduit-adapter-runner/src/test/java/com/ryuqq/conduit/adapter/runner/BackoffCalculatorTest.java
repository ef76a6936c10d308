package com.ryuqq.conduit.adapter.runner;

import com.ryuqq.conduit.core.protection.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    @DisplayName("Jitter가 없으면 기본값에서 두 배씩 증가하다 상한에서 멈춘다")
    void calculate_지수_증가_후_상한() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 4000, 0, new Random(1));

        // when & then
        assertThat(calculator.calculate(0)).isEqualTo(1000);
        assertThat(calculator.calculate(1)).isEqualTo(2000);
        assertThat(calculator.calculate(2)).isEqualTo(4000);
        assertThat(calculator.calculate(3)).isEqualTo(4000);
        assertThat(calculator.calculate(10)).isEqualTo(4000);
    }

    @Test
    @DisplayName("Jitter는 상한 적용 후 0 ~ maxJitter 범위로 더해진다")
    void calculate_jitter_범위() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 4000, 400, new Random(42));

        // when & then
        for (int attempt = 0; attempt < 8; attempt++) {
            long base = Math.min(1000L << attempt, 4000L);
            for (int i = 0; i < 50; i++) {
                assertThat(calculator.calculate(attempt)).isBetween(base, base + 400);
            }
        }
    }

    @Test
    @DisplayName("매우 큰 시도 번호에서도 overflow 없이 상한을 반환한다")
    void calculate_큰_시도_번호_overflow_없음() {
        BackoffCalculator calculator = new BackoffCalculator(1000, 4000, 0, new Random());

        assertThat(calculator.calculate(62)).isEqualTo(4000);
        assertThat(calculator.calculate(Integer.MAX_VALUE)).isEqualTo(4000);
    }

    @Test
    @DisplayName("RetryPolicy의 백오프 수치를 그대로 사용한다")
    void of_RetryPolicy_수치_사용() {
        // given
        RetryPolicy policy = new RetryPolicy().withBackoff(50, 200, 10);

        // when
        BackoffCalculator calculator = BackoffCalculator.of(policy, new Random(7));

        // then
        assertThat(calculator.getBaseDelayMs()).isEqualTo(50);
        assertThat(calculator.getMaxDelayMs()).isEqualTo(200);
        assertThat(calculator.getMaxJitterMs()).isEqualTo(10);
    }

    @Test
    @DisplayName("잘못된 파라미터는 IllegalArgumentException")
    void 생성_검증() {
        assertThatThrownBy(() -> new BackoffCalculator(-1, 100, 0, new Random()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(200, 100, 0, new Random()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 200, -1, new Random()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 200, 0, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator().calculate(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
