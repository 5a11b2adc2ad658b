package com.ryuqq.sdconnector.application.invoker;

import com.ryuqq.sdconnector.application.registry.AsyncOperationRegistry;
import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.model.ResponseRecord;
import com.ryuqq.sdconnector.core.retry.BackoffCalculator;
import com.ryuqq.sdconnector.core.retry.BackoffTimer;
import com.ryuqq.sdconnector.core.retry.RetryPolicy;
import com.ryuqq.sdconnector.core.spi.AsyncBoundOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 재시도를 적용하는 비블로킹 Operation 호출기.
 *
 * <p>{@link ResilientInvoker}와 같은 재시도 규칙을 Future 체인으로 수행합니다.
 * 반환된 Future는 성공한 응답 또는 마지막 시도의 예외(CompletionException으로
 * 감싸지 않은 원래 예외)로 완료됩니다.</p>
 *
 * <p>바인딩되지 않은 이름은 재시도 없이 실패한 Future를 반환합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class AsyncResilientInvoker {

    private static final Logger log = LoggerFactory.getLogger(AsyncResilientInvoker.class);

    private final AsyncOperationRegistry registry;
    private final RetryPolicy policy;
    private final BackoffCalculator backoffCalculator;
    private final BackoffTimer timer;

    public AsyncResilientInvoker(AsyncOperationRegistry registry) {
        this(registry, RetryPolicy.defaults(), BackoffTimer.system());
    }

    public AsyncResilientInvoker(AsyncOperationRegistry registry, RetryPolicy policy, BackoffTimer timer) {
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
     * @return 응답 레코드 Future
     */
    public CompletableFuture<ResponseRecord> call(String operationName, FieldMap fields) {
        if (fields == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("fields cannot be null"));
        }
        AsyncBoundOperation operation;
        try {
            operation = registry.lookup(operationName);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<ResponseRecord> result = new CompletableFuture<>();
        attempt(operationName, operation, fields, 1, result);
        return result;
    }

    public AsyncOperationRegistry registry() {
        return registry;
    }

    public RetryPolicy policy() {
        return policy;
    }

    private void attempt(
        String operationName,
        AsyncBoundOperation operation,
        FieldMap fields,
        int attempt,
        CompletableFuture<ResponseRecord> result
    ) {
        CompletableFuture<ResponseRecord> call;
        try {
            call = operation.call(fields);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        call.whenComplete((response, failure) -> {
            if (failure == null) {
                result.complete(response);
                return;
            }

            Throwable cause = unwrap(failure);
            if (!(cause instanceof RuntimeException)) {
                result.completeExceptionally(cause);
                return;
            }
            if (attempt >= policy.maxAttempts()) {
                log.error("Operation {} failed after {} attempts", operationName, attempt, cause);
                result.completeExceptionally(cause);
                return;
            }

            Duration delay = backoffCalculator.calculate(attempt);
            log.warn("Operation {} failed (attempt {}/{}), retrying in {} ms: {}",
                operationName, attempt, policy.maxAttempts(), delay.toMillis(), cause.toString());
            timer.delay(delay).whenComplete((ignored, timerFailure) -> {
                if (timerFailure != null) {
                    Throwable timerCause = unwrap(timerFailure);
                    timerCause.addSuppressed(cause);
                    result.completeExceptionally(timerCause);
                } else {
                    attempt(operationName, operation, fields, attempt + 1, result);
                }
            });
        });
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
