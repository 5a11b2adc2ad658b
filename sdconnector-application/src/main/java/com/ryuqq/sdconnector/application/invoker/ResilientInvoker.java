package com.ryuqq.sdconnector.application.invoker;

import com.ryuqq.sdconnector.application.registry.OperationRegistry;
import com.ryuqq.sdconnector.core.exception.InvocationInterruptedException;
import com.ryuqq.sdconnector.core.exception.UnknownOperationException;
import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.model.ResponseRecord;
import com.ryuqq.sdconnector.core.retry.BackoffCalculator;
import com.ryuqq.sdconnector.core.retry.BackoffTimer;
import com.ryuqq.sdconnector.core.retry.RetryPolicy;
import com.ryuqq.sdconnector.core.spi.BoundOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 재시도를 적용하는 블로킹 Operation 호출기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. Registry에서 Operation 조회 (없으면 재시도 없이 즉시 실패)
 * 2. 호출 시도
 * 3. 실패 시:
 *    - 남은 시도가 있으면 BackoffCalculator로 대기 후 재시도
 *    - 마지막 시도였으면 마지막 예외를 그대로 다시 던짐
 * </pre>
 *
 * <p>{@link RuntimeException}만 재시도합니다. {@link Error}는 즉시 전파됩니다.
 * 대기 중 인터럽트되면 {@link InvocationInterruptedException}을 던지며
 * 직전 실패는 suppressed로 첨부됩니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class ResilientInvoker {

    private static final Logger log = LoggerFactory.getLogger(ResilientInvoker.class);

    private final OperationRegistry registry;
    private final RetryPolicy policy;
    private final BackoffCalculator backoffCalculator;
    private final BackoffTimer timer;

    public ResilientInvoker(OperationRegistry registry) {
        this(registry, RetryPolicy.defaults(), BackoffTimer.system());
    }

    /**
     * 생성자.
     *
     * @param registry Operation Registry
     * @param policy 재시도 정책
     * @param timer 대기 타이머
     */
    public ResilientInvoker(OperationRegistry registry, RetryPolicy policy, BackoffTimer timer) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (timer == null) {
            throw new IllegalArgumentException("timer cannot be null");
        }
        this.registry = registry;
        this.policy = policy;
        this.backoffCalculator = new BackoffCalculator(policy);
        this.timer = timer;
    }

    /**
     * Operation 호출 (재시도 포함).
     *
     * @param operationName Canonical Operation 이름
     * @param fields 요청 필드
     * @return 응답 레코드
     * @throws UnknownOperationException 바인딩되지 않은 이름인 경우 (재시도 없음)
     * @throws InvocationInterruptedException 재시도 대기 중 인터럽트된 경우
     * @throws RuntimeException 모든 시도가 실패한 경우 마지막 시도의 예외
     */
    public ResponseRecord call(String operationName, FieldMap fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        BoundOperation operation = registry.lookup(operationName);

        int attempt = 1;
        while (true) {
            try {
                return operation.call(fields);
            } catch (RuntimeException e) {
                if (attempt >= policy.maxAttempts()) {
                    log.error("Operation {} failed after {} attempts", operationName, attempt, e);
                    throw e;
                }

                Duration delay = backoffCalculator.calculate(attempt);
                log.warn("Operation {} failed (attempt {}/{}), retrying in {} ms: {}",
                    operationName, attempt, policy.maxAttempts(), delay.toMillis(), e.toString());
                pause(operationName, delay, e);
                attempt++;
            }
        }
    }

    public OperationRegistry registry() {
        return registry;
    }

    public RetryPolicy policy() {
        return policy;
    }

    private void pause(String operationName, Duration delay, RuntimeException lastFailure) {
        try {
            timer.pause(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InvocationInterruptedException interrupted = new InvocationInterruptedException(operationName, e);
            interrupted.addSuppressed(lastFailure);
            throw interrupted;
        }
    }
}
