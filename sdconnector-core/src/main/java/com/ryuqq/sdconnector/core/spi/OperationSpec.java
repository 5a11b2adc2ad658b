package com.ryuqq.sdconnector.core.spi;

import java.util.List;

/**
 * 서비스 디스크립터가 광고하는 Operation 하나.
 *
 * <p>요청 스키마를 알 수 없으면 {@code childOrder}는 비어 있고 자식 요소는
 * 요청 네임스페이스로 한정(qualified)됩니다.</p>
 *
 * @param name 광고된 Operation 이름 (예: GetDepartment20111201Operation)
 * @param endpoint 호출 주소
 * @param action 호출 액션 (SOAPAction, 없으면 빈 문자열)
 * @param requestNamespace 요청 요소 네임스페이스 (없으면 빈 문자열)
 * @param requestElement 요청 요소 이름
 * @param childOrder 요청 스키마의 자식 요소 순서 (xs:sequence, 모르면 빈 목록)
 * @param qualifiedChildren 자식 요소를 요청 네임스페이스로 한정할지 (elementFormDefault)
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record OperationSpec(
    String name,
    String endpoint,
    String action,
    String requestNamespace,
    String requestElement,
    List<String> childOrder,
    boolean qualifiedChildren
) {

    public OperationSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (requestElement == null || requestElement.isBlank()) {
            throw new IllegalArgumentException("requestElement cannot be null or blank");
        }
        action = action == null ? "" : action;
        requestNamespace = requestNamespace == null ? "" : requestNamespace;
        childOrder = childOrder == null ? List.of() : List.copyOf(childOrder);
    }

    /**
     * 요청 스키마 정보가 없는 Operation.
     */
    public OperationSpec(String name, String endpoint, String action, String requestNamespace, String requestElement) {
        this(name, endpoint, action, requestNamespace, requestElement, List.of(), true);
    }
}
