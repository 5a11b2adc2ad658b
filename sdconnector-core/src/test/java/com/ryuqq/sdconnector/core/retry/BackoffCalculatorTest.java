package com.ryuqq.sdconnector.core.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void calculate_기본_정책은_2초부터_두배씩() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(RetryPolicy.defaults());

        // when
        List<Duration> delays = new ArrayList<>();
        for (int attempt = 1; attempt <= 6; attempt++) {
            delays.add(calculator.calculate(attempt));
        }

        // then
        assertThat(delays).containsExactly(
            Duration.ofSeconds(2),
            Duration.ofSeconds(4),
            Duration.ofSeconds(8),
            Duration.ofSeconds(16),
            Duration.ofSeconds(32),
            Duration.ofSeconds(64)
        );
    }

    @Test
    void calculate_maxDelay로_제한() {
        // given
        RetryPolicy policy = RetryPolicy.defaults().withMaxDelay(Duration.ofSeconds(10));
        BackoffCalculator calculator = new BackoffCalculator(policy);

        // then
        assertThat(calculator.calculate(4)).isEqualTo(Duration.ofSeconds(10));
        assertThat(calculator.calculate(1000)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void calculate_minDelay_이상() {
        // given
        RetryPolicy policy = RetryPolicy.defaults()
            .withInitialDelay(Duration.ofMillis(100))
            .withMinDelay(Duration.ofSeconds(1));
        BackoffCalculator calculator = new BackoffCalculator(policy);

        // then
        assertThat(calculator.calculate(1)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void calculate_jitter는_상한_안에서_증가만() {
        // given
        RetryPolicy policy = RetryPolicy.defaults().withJitterFactor(0.5);
        BackoffCalculator calculator = new BackoffCalculator(policy);

        // when & then
        for (int i = 0; i < 50; i++) {
            Duration delay = calculator.calculate(2);
            assertThat(delay).isBetween(Duration.ofSeconds(4), Duration.ofSeconds(6));
        }
    }

    @Test
    void calculate_0이하_시도는_예외() {
        BackoffCalculator calculator = new BackoffCalculator();

        assertThatThrownBy(() -> calculator.calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attemptCount must be positive");
    }
}
