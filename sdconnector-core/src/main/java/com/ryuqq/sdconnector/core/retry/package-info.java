/**
 * 재시도 정책과 Backoff.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sdconnector.core.retry.RetryPolicy} - 시도 횟수와 지연 설정</li>
 *   <li>{@link com.ryuqq.sdconnector.core.retry.BackoffCalculator} - 시도별 대기 시간 계산</li>
 *   <li>{@link com.ryuqq.sdconnector.core.retry.BackoffTimer} - 대기 수행 SPI (블로킹 / 비블로킹)</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
package com.ryuqq.sdconnector.core.retry;
