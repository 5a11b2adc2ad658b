package com.ryuqq.sdconnector.testkit.contract;

import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.model.OperationNames;
import com.ryuqq.sdconnector.core.model.ResponseRecord;
import com.ryuqq.sdconnector.core.spi.BoundOperation;
import com.ryuqq.sdconnector.core.spi.OperationBinder;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory implementation of OperationBinder for testing purposes.
 *
 * <p>서비스 디스크립터를 메모리에 등록하고, 바인딩된 Operation 호출을 기록합니다.
 * 네트워크 없이 Registry, Invoker, Facade 계약을 검증할 때 사용합니다.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>locator별 디스크립터 등록 (Operation 수 자유)</li>
 *   <li>Operation별 응답 함수 등록 (기본: 빈 레코드)</li>
 *   <li>Operation별 실패 예약 (예약된 순서대로 한 번씩 던짐)</li>
 *   <li>describe 횟수와 호출 이력 기록</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public class InMemoryOperationBinder implements OperationBinder {

    private static final String ENDPOINT_PREFIX = "memory://sd/";

    private final Map<String, ServiceDescriptor> descriptors = new ConcurrentHashMap<>();
    private final List<String> locators = new CopyOnWriteArrayList<>();
    private final Map<String, Function<FieldMap, ResponseRecord>> handlers = new ConcurrentHashMap<>();
    private final Map<String, Deque<RuntimeException>> failures = new ConcurrentHashMap<>();
    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();
    private final AtomicInteger describeCount = new AtomicInteger();

    /**
     * 디스크립터 등록.
     *
     * @param locator 디스크립터 위치
     * @param advertisedNames 디스크립터에 광고될 Operation 이름 (0개 이상)
     * @return this
     */
    public InMemoryOperationBinder register(String locator, String... advertisedNames) {
        List<OperationSpec> operations = Arrays.stream(advertisedNames)
            .map(InMemoryOperationBinder::spec)
            .collect(Collectors.toList());
        if (descriptors.put(locator, new ServiceDescriptor(locator, operations)) == null) {
            locators.add(locator);
        }
        return this;
    }

    /**
     * Facade가 노출하는 모든 Operation을 "{이름}Operation" 형태로 하나씩 등록.
     *
     * @return this
     */
    public InMemoryOperationBinder registerExposed() {
        for (String name : OperationNames.EXPOSED) {
            register("memory/" + name + ".wsdl", name + OperationNames.OPERATION_SUFFIX);
        }
        return this;
    }

    /**
     * Operation 응답 함수 등록.
     *
     * @param operationName Canonical 이름
     * @param handler 요청 필드 → 응답
     * @return this
     */
    public InMemoryOperationBinder respond(String operationName, Function<FieldMap, ResponseRecord> handler) {
        handlers.put(operationName, handler);
        return this;
    }

    /**
     * 다음 호출들에서 던질 실패 예약.
     *
     * @param operationName Canonical 이름
     * @param errors 순서대로 한 번씩 던질 예외
     * @return this
     */
    public InMemoryOperationBinder failNext(String operationName, RuntimeException... errors) {
        Deque<RuntimeException> queue = failures.computeIfAbsent(operationName, key -> new ConcurrentLinkedDeque<>());
        queue.addAll(Arrays.asList(errors));
        return this;
    }

    @Override
    public ServiceDescriptor describe(String locator) {
        describeCount.incrementAndGet();
        ServiceDescriptor descriptor = descriptors.get(locator);
        if (descriptor == null) {
            throw new IllegalStateException("No descriptor registered at " + locator);
        }
        return descriptor;
    }

    @Override
    public BoundOperation bind(OperationSpec operation) {
        String name = operation.requestElement();
        return fields -> invoke(name, fields);
    }

    /**
     * 등록 순서대로의 locator 목록.
     */
    public List<String> locators() {
        return List.copyOf(locators);
    }

    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    /**
     * 특정 Operation의 호출 이력.
     *
     * @param operationName Canonical 이름
     * @return 호출 순서대로의 이력
     */
    public List<Invocation> invocations(String operationName) {
        List<Invocation> matched = new ArrayList<>();
        for (Invocation invocation : invocations) {
            if (invocation.operationName().equals(operationName)) {
                matched.add(invocation);
            }
        }
        return matched;
    }

    public int describeCount() {
        return describeCount.get();
    }

    /**
     * Clears all registrations and recorded history.
     */
    public void clear() {
        descriptors.clear();
        locators.clear();
        handlers.clear();
        failures.clear();
        invocations.clear();
        describeCount.set(0);
    }

    private ResponseRecord invoke(String operationName, FieldMap fields) {
        invocations.add(new Invocation(operationName, fields));
        Deque<RuntimeException> pending = failures.get(operationName);
        if (pending != null) {
            RuntimeException error = pending.poll();
            if (error != null) {
                throw error;
            }
        }
        Function<FieldMap, ResponseRecord> handler = handlers.get(operationName);
        return handler != null ? handler.apply(fields) : ResponseRecord.of(operationName, Map.of());
    }

    private static OperationSpec spec(String advertisedName) {
        String canonical = OperationNames.canonicalize(advertisedName);
        return new OperationSpec(advertisedName, ENDPOINT_PREFIX + canonical, canonical, "urn:test", canonical);
    }

    /**
     * 기록된 호출 한 건.
     *
     * @param operationName Canonical 이름
     * @param fields 전달된 요청 필드
     */
    public record Invocation(String operationName, FieldMap fields) {
    }
}
