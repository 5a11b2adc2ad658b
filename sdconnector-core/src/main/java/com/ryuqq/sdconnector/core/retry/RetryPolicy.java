package com.ryuqq.sdconnector.core.retry;

import java.time.Duration;

/**
 * 원격 Operation 호출 재시도 정책 (불변 record).
 *
 * <p>모든 바인딩된 Operation에 동일하게 적용됩니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 호출을 포함한 총 시도 횟수 (기본 7)</li>
 *   <li>initialDelay: 첫 재시도 전 대기 시간 (기본 2초)</li>
 *   <li>minDelay: 대기 시간 하한 (기본 1초)</li>
 *   <li>maxDelay: 대기 시간 상한 (기본 5분)</li>
 *   <li>multiplier: 지수 증가 배수 (기본 2.0)</li>
 *   <li>jitterFactor: Jitter 비율 (기본 0.0, 0.0 ~ 1.0)</li>
 * </ul>
 *
 * <p>기본값에서 대기 시간은 2s, 4s, 8s, 16s, 32s, 64s 입니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 * @param maxAttempts 총 시도 횟수 (1 이상)
 * @param initialDelay 첫 재시도 전 대기 시간 (양수)
 * @param minDelay 대기 시간 하한 (양수)
 * @param maxDelay 대기 시간 상한 (minDelay 이상)
 * @param multiplier 지수 증가 배수 (1.0 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialDelay,
    Duration minDelay,
    Duration maxDelay,
    double multiplier,
    double jitterFactor
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 7;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MIN_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(5);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    /**
     * 기본 정책 생성.
     *
     * @return maxAttempts=7, initialDelay=2s, minDelay=1s, maxDelay=5m, multiplier=2.0, jitter 없음
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(
            DEFAULT_MAX_ATTEMPTS,
            DEFAULT_INITIAL_DELAY,
            DEFAULT_MIN_DELAY,
            DEFAULT_MAX_DELAY,
            DEFAULT_MULTIPLIER,
            0.0
        );
    }

    /**
     * 재시도 없이 한 번만 호출하는 정책.
     *
     * @return maxAttempts=1
     */
    public static RetryPolicy noRetry() {
        return defaults().withMaxAttempts(1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (initialDelay == null || minDelay == null || maxDelay == null) {
            throw new IllegalArgumentException("delays cannot be null");
        }
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException(
                "initialDelay must be positive (current: " + initialDelay + ")"
            );
        }
        if (minDelay.isNegative() || minDelay.isZero()) {
            throw new IllegalArgumentException(
                "minDelay must be positive (current: " + minDelay + ")"
            );
        }
        if (maxDelay.compareTo(minDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= minDelay (min: " + minDelay + ", max: " + maxDelay + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialDelay, minDelay, maxDelay, multiplier, jitterFactor);
    }

    /**
     * initialDelay만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withInitialDelay(Duration initialDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, minDelay, maxDelay, multiplier, jitterFactor);
    }

    /**
     * minDelay만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMinDelay(Duration minDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, minDelay, maxDelay, multiplier, jitterFactor);
    }

    /**
     * maxDelay만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, minDelay, maxDelay, multiplier, jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(maxAttempts, initialDelay, minDelay, maxDelay, multiplier, jitterFactor);
    }
}
