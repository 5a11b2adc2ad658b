package com.ryuqq.sdconnector.application.registry;

/**
 * 바인딩된 Operation 항목.
 *
 * <p>Registry 생성 시 한 번 만들어지며 이후 변경되지 않습니다. Registry가 단독으로 소유합니다.</p>
 *
 * @param name Canonical Operation 이름
 * @param locator Operation을 광고한 서비스 디스크립터 위치
 * @param operation 호출 핸들
 * @param <H> 호출 핸들 타입 (블로킹 / 비블로킹)
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record OperationDescriptor<H>(String name, String locator, H operation) {

    public OperationDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator cannot be null or blank");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
    }
}
