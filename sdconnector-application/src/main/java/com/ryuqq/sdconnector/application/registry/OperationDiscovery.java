package com.ryuqq.sdconnector.application.registry;

import com.ryuqq.sdconnector.core.exception.RegistryConstructionException;
import com.ryuqq.sdconnector.core.model.OperationNames;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 블로킹/비블로킹 Registry가 공유하는 바인딩 알고리즘.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 검증 단계 (바인딩 전):
 *    For each ServiceDescriptor:
 *      a. 광고된 Operation이 정확히 1개인지 확인
 *      b. 접미사 "Operation" 제거 → Canonical 이름
 *      c. 이미 등장한 이름이면 충돌
 * 2. 바인딩 단계:
 *    For each 검증된 Operation:
 *      binder(OperationSpec) → 핸들 → OperationDescriptor
 * </pre>
 *
 * <p>검증이 모두 끝난 뒤에만 바인딩하므로, 위반이 있으면 어떤 Operation도 바인딩되지 않습니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
final class OperationDiscovery {

    private OperationDiscovery() {
    }

    /**
     * 디스크립터 검증 후 모든 Operation 바인딩.
     *
     * @param descriptors 서비스 디스크립터 목록 (locator 순서)
     * @param binder OperationSpec → 호출 핸들
     * @param <H> 호출 핸들 타입
     * @return Canonical 이름 → OperationDescriptor (불변, locator 순서)
     * @throws RegistryConstructionException 디스크립터 형태 위반 또는 이름 충돌 시
     */
    static <H> Map<String, OperationDescriptor<H>> bindAll(
        List<ServiceDescriptor> descriptors,
        Function<OperationSpec, H> binder
    ) {
        Map<String, ServiceDescriptor> validated = new LinkedHashMap<>();
        for (ServiceDescriptor descriptor : descriptors) {
            List<OperationSpec> operations = descriptor.operations();
            if (operations.size() != 1) {
                throw new RegistryConstructionException(
                    "Service descriptor " + descriptor.locator() + " must expose exactly one operation (found: "
                        + operations.size() + ")"
                );
            }

            String canonical = OperationNames.canonicalize(operations.get(0).name());
            ServiceDescriptor existing = validated.putIfAbsent(canonical, descriptor);
            if (existing != null) {
                throw new RegistryConstructionException(
                    "Operation " + canonical + " is exposed by both " + existing.locator()
                        + " and " + descriptor.locator()
                );
            }
        }

        Map<String, OperationDescriptor<H>> bound = new LinkedHashMap<>();
        for (Map.Entry<String, ServiceDescriptor> entry : validated.entrySet()) {
            ServiceDescriptor descriptor = entry.getValue();
            H handle = binder.apply(descriptor.operations().get(0));
            bound.put(entry.getKey(), new OperationDescriptor<>(entry.getKey(), descriptor.locator(), handle));
        }
        return Collections.unmodifiableMap(bound);
    }
}
