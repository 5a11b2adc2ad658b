package com.ryuqq.sdconnector.application.registry;

import com.ryuqq.sdconnector.core.exception.RegistryConstructionException;
import com.ryuqq.sdconnector.core.exception.UnknownOperationException;
import com.ryuqq.sdconnector.core.spi.AsyncBoundOperation;
import com.ryuqq.sdconnector.core.spi.AsyncOperationBinder;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 비블로킹 Operation Registry.
 *
 * <p>{@link #create(AsyncOperationBinder, List)}가 반환한 Future는 모든 디스크립터를
 * 가져와 검증하고 바인딩한 뒤에만 완료됩니다. 바인딩 알고리즘은
 * {@link OperationRegistry}와 같습니다.</p>
 *
 * <p>Registry는 Binder의 전송 자원을 소유하므로 사용이 끝나면 {@link #close()}를
 * 호출해야 합니다. 생성이 실패하면 Binder는 즉시 해제됩니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class AsyncOperationRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncOperationRegistry.class);

    private final AsyncOperationBinder binder;
    private final Map<String, OperationDescriptor<AsyncBoundOperation>> operations;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private AsyncOperationRegistry(
        AsyncOperationBinder binder,
        Map<String, OperationDescriptor<AsyncBoundOperation>> operations
    ) {
        this.binder = binder;
        this.operations = operations;
    }

    /**
     * Registry 생성 (디스크립터 조회 + 바인딩).
     *
     * @param binder 비블로킹 Operation Binder (소유권이 Registry로 이전됨)
     * @param locators 서비스 디스크립터 위치 목록
     * @return 바인딩이 끝난 Registry로 완료되는 Future,
     *         실패 시 {@link RegistryConstructionException}으로 완료
     * @throws IllegalArgumentException binder 또는 locators가 null이거나 locators가 비어 있는 경우
     */
    public static CompletableFuture<AsyncOperationRegistry> create(
        AsyncOperationBinder binder,
        List<String> locators
    ) {
        if (binder == null) {
            throw new IllegalArgumentException("binder cannot be null");
        }
        if (locators == null || locators.isEmpty()) {
            throw new IllegalArgumentException("locators cannot be null or empty");
        }

        List<CompletableFuture<ServiceDescriptor>> pending = new ArrayList<>(locators.size());
        for (String locator : locators) {
            pending.add(describe(binder, locator));
        }

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                List<ServiceDescriptor> descriptors = new ArrayList<>(pending.size());
                for (CompletableFuture<ServiceDescriptor> future : pending) {
                    descriptors.add(future.join());
                }
                Map<String, OperationDescriptor<AsyncBoundOperation>> bound =
                    OperationDiscovery.bindAll(descriptors, binder::bind);
                log.info("Bound {} async operations from {} service descriptors", bound.size(), locators.size());
                return new AsyncOperationRegistry(binder, bound);
            })
            .whenComplete((registry, failure) -> {
                if (failure != null) {
                    releaseAfterFailure(binder, failure);
                }
            });
    }

    /**
     * 바인딩된 Operation 조회.
     *
     * @param name Canonical Operation 이름
     * @return 호출 핸들
     * @throws UnknownOperationException 바인딩되지 않은 이름인 경우
     * @throws IllegalStateException Registry가 이미 해제된 경우
     */
    public AsyncBoundOperation lookup(String name) {
        if (closed.get()) {
            throw new IllegalStateException("registry is closed");
        }
        OperationDescriptor<AsyncBoundOperation> descriptor = operations.get(name);
        if (descriptor == null) {
            throw new UnknownOperationException(name);
        }
        return descriptor.operation();
    }

    public boolean contains(String name) {
        return operations.containsKey(name);
    }

    public Set<String> names() {
        return operations.keySet();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 전송 자원 해제.
     *
     * <p>두 번째 호출부터는 아무 동작도 하지 않습니다.</p>
     *
     * @throws com.ryuqq.sdconnector.core.exception.ResourceReleaseException 해제 실패 시
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            binder.close();
            log.info("Async operation registry released");
        }
    }

    private static CompletableFuture<ServiceDescriptor> describe(AsyncOperationBinder binder, String locator) {
        CompletableFuture<ServiceDescriptor> future;
        try {
            future = binder.describe(locator);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.handle((descriptor, failure) -> {
            if (failure == null) {
                return descriptor;
            }
            Throwable cause = unwrap(failure);
            if (cause instanceof RegistryConstructionException) {
                throw (RegistryConstructionException) cause;
            }
            throw new RegistryConstructionException("Failed to load service descriptor " + locator, cause);
        });
    }

    private static void releaseAfterFailure(AsyncOperationBinder binder, Throwable failure) {
        try {
            binder.close();
        } catch (RuntimeException e) {
            unwrap(failure).addSuppressed(e);
        }
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
