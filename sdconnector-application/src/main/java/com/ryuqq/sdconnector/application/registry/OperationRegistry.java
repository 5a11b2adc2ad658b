package com.ryuqq.sdconnector.application.registry;

import com.ryuqq.sdconnector.core.exception.RegistryConstructionException;
import com.ryuqq.sdconnector.core.exception.UnknownOperationException;
import com.ryuqq.sdconnector.core.spi.BoundOperation;
import com.ryuqq.sdconnector.core.spi.OperationBinder;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 블로킹 Operation Registry.
 *
 * <p>생성자에서 모든 서비스 디스크립터를 가져와 검증하고 바인딩합니다.
 * 생성자는 네트워크 I/O를 수행하며 호출 스레드를 블로킹합니다.
 * 생성이 끝나면 모든 Operation이 사용 가능하며 바인딩은 이후 변경되지 않습니다.</p>
 *
 * <p><strong>생성 실패:</strong> {@link RegistryConstructionException}</p>
 * <ul>
 *   <li>디스크립터를 가져오지 못함</li>
 *   <li>디스크립터가 Operation을 정확히 하나 광고하지 않음</li>
 *   <li>Canonical 이름 충돌</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 생성 후 불변이므로 thread-safe합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    private final Map<String, OperationDescriptor<BoundOperation>> operations;

    /**
     * 생성자 (디스크립터 조회 + 바인딩).
     *
     * @param binder Operation Binder
     * @param locators 서비스 디스크립터 위치 목록
     * @throws IllegalArgumentException binder 또는 locators가 null이거나 locators가 비어 있는 경우
     * @throws RegistryConstructionException 디스크립터 조회 실패, 형태 위반, 이름 충돌 시
     */
    public OperationRegistry(OperationBinder binder, List<String> locators) {
        if (binder == null) {
            throw new IllegalArgumentException("binder cannot be null");
        }
        if (locators == null || locators.isEmpty()) {
            throw new IllegalArgumentException("locators cannot be null or empty");
        }

        List<ServiceDescriptor> descriptors = new ArrayList<>(locators.size());
        for (String locator : locators) {
            descriptors.add(describe(binder, locator));
        }

        this.operations = OperationDiscovery.bindAll(descriptors, binder::bind);
        log.info("Bound {} operations from {} service descriptors", operations.size(), locators.size());
    }

    /**
     * 바인딩된 Operation 조회.
     *
     * @param name Canonical Operation 이름
     * @return 호출 핸들
     * @throws UnknownOperationException 바인딩되지 않은 이름인 경우
     */
    public BoundOperation lookup(String name) {
        return descriptor(name).operation();
    }

    /**
     * 바인딩 항목 조회.
     *
     * @param name Canonical Operation 이름
     * @return OperationDescriptor
     * @throws UnknownOperationException 바인딩되지 않은 이름인 경우
     */
    public OperationDescriptor<BoundOperation> descriptor(String name) {
        OperationDescriptor<BoundOperation> descriptor = operations.get(name);
        if (descriptor == null) {
            throw new UnknownOperationException(name);
        }
        return descriptor;
    }

    public boolean contains(String name) {
        return operations.containsKey(name);
    }

    /**
     * 바인딩된 Canonical 이름 목록 (디스크립터 순서).
     *
     * @return 이름 집합
     */
    public Set<String> names() {
        return operations.keySet();
    }

    private static ServiceDescriptor describe(OperationBinder binder, String locator) {
        try {
            return binder.describe(locator);
        } catch (RegistryConstructionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RegistryConstructionException("Failed to load service descriptor " + locator, e);
        }
    }
}
