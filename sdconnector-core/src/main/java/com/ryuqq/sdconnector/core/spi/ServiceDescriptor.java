package com.ryuqq.sdconnector.core.spi;

import java.util.List;

/**
 * 원격 서비스 디스크립터 (해석된 WSDL).
 *
 * <p>SD 서비스의 디스크립터는 각각 Operation을 정확히 하나 광고해야 합니다.
 * 이 타입은 그 불변식을 검증하지 않으며 검증은 Operation Registry의 책임입니다.</p>
 *
 * @param locator 디스크립터 위치 (예: GetPerson20111201 WSDL URL)
 * @param operations 광고된 Operation 목록
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record ServiceDescriptor(String locator, List<OperationSpec> operations) {

    public ServiceDescriptor {
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator cannot be null or blank");
        }
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        operations = List.copyOf(operations);
    }
}
