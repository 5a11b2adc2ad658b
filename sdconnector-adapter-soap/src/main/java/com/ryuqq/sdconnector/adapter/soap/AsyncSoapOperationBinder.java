package com.ryuqq.sdconnector.adapter.soap;

import com.ryuqq.sdconnector.core.spi.AsyncBoundOperation;
import com.ryuqq.sdconnector.core.spi.AsyncOperationBinder;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link AsyncSoapSession} 기반 비블로킹 Operation Binder.
 *
 * <p>{@link #close()}는 세션에 대한 참조를 반환합니다. 세션 자체는 마지막 참조가
 * 반환될 때 종료됩니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class AsyncSoapOperationBinder implements AsyncOperationBinder {

    private final AsyncSoapSession session;
    private final Runnable release;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * 생성자.
     *
     * @param session 비블로킹 세션
     * @param release 세션 참조 반환 함수
     */
    public AsyncSoapOperationBinder(AsyncSoapSession session, Runnable release) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        if (release == null) {
            throw new IllegalArgumentException("release cannot be null");
        }
        this.session = session;
        this.release = release;
    }

    @Override
    public CompletableFuture<ServiceDescriptor> describe(String locator) {
        return session.describe(locator);
    }

    @Override
    public AsyncBoundOperation bind(OperationSpec operation) {
        return fields -> session.call(operation, fields);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            release.run();
        }
    }
}
