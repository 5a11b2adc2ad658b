package com.ryuqq.sdconnector.testkit.contract;

import com.ryuqq.sdconnector.core.model.ResponseRecord;
import com.ryuqq.sdconnector.core.spi.AsyncBoundOperation;
import com.ryuqq.sdconnector.core.spi.AsyncOperationBinder;
import com.ryuqq.sdconnector.core.spi.BoundOperation;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link InMemoryOperationBinder}를 비블로킹 SPI로 노출하는 어댑터.
 *
 * <p>모든 결과는 이미 완료된 Future로 반환되며, 예외는 실패한 Future로 전달됩니다.
 * 등록과 호출 이력은 위임 대상 Binder가 그대로 관리합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public class InMemoryAsyncOperationBinder implements AsyncOperationBinder {

    private final InMemoryOperationBinder delegate;
    private final AtomicInteger closeCount = new AtomicInteger();

    public InMemoryAsyncOperationBinder(InMemoryOperationBinder delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public CompletableFuture<ServiceDescriptor> describe(String locator) {
        try {
            return CompletableFuture.completedFuture(delegate.describe(locator));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public AsyncBoundOperation bind(OperationSpec operation) {
        BoundOperation bound = delegate.bind(operation);
        return fields -> {
            try {
                return CompletableFuture.<ResponseRecord>completedFuture(bound.call(fields));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    public InMemoryOperationBinder delegate() {
        return delegate;
    }

    public boolean isClosed() {
        return closeCount.get() > 0;
    }

    public int closeCount() {
        return closeCount.get();
    }
}
