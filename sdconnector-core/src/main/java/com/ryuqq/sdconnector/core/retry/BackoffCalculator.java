package com.ryuqq.sdconnector.core.retry;

import java.time.Duration;

/**
 * Exponential Backoff 계산기.
 *
 * <p>{@link RetryPolicy}에 따라 재시도 간격을 지수적으로 증가시킵니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = initialDelay * multiplier^(attemptCount-1)
 * jitter      = random(0, exponential * jitterFactor)
 * delay       = clamp(exponential + jitter, minDelay, maxDelay)
 * </pre>
 *
 * <p><strong>예시 (기본 정책: initialDelay=2s, multiplier=2, jitter 없음):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 2s</li>
 *   <li>attemptCount=2: 4s</li>
 *   <li>attemptCount=6: 64s</li>
 * </ul>
 *
 * <p>jitterFactor가 0이면 attemptCount에 대해 단조 증가(non-decreasing)합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class BackoffCalculator {

    private final long initialDelayMs;
    private final long minDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final double jitterFactor;

    /**
     * 기본 정책으로 생성.
     */
    public BackoffCalculator() {
        this(RetryPolicy.defaults());
    }

    /**
     * 정책으로 생성.
     *
     * @param policy 재시도 정책
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public BackoffCalculator(RetryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.initialDelayMs = policy.initialDelay().toMillis();
        this.minDelayMs = policy.minDelay().toMillis();
        this.maxDelayMs = policy.maxDelay().toMillis();
        this.multiplier = policy.multiplier();
        this.jitterFactor = policy.jitterFactor();
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 실패한 시도 횟수 (1부터 시작)
     * @return 다음 시도 전 대기 시간
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public Duration calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // 1. 지수적 백오프 (overflow 방지를 위해 maxDelay로 제한)
        double raw = initialDelayMs * Math.pow(multiplier, attemptCount - 1);
        long exponential = raw >= maxDelayMs ? maxDelayMs : (long) raw;

        // 2. Jitter 추가 (0 ~ exponential * jitterFactor)
        long jitter = jitterFactor == 0.0 ? 0L : (long) (exponential * jitterFactor * Math.random());

        // 3. [minDelay, maxDelay] 범위로 제한
        long delay = Math.min(exponential + jitter, maxDelayMs);
        return Duration.ofMillis(Math.max(delay, minDelayMs));
    }
}
