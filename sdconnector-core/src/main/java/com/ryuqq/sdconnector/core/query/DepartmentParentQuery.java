package com.ryuqq.sdconnector.core.query;

import java.time.LocalDate;
import java.util.UUID;

/**
 * GetDepartmentParent 조회 조건.
 *
 * <p>부서는 UUID로만 지정할 수 있습니다. effectiveDate를 생략하면 오늘 기준입니다.</p>
 *
 * @param departmentUuidIdentifier 부서 UUID (필수)
 * @param effectiveDate 기준일 (선택)
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record DepartmentParentQuery(UUID departmentUuidIdentifier, LocalDate effectiveDate) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException departmentUuidIdentifier가 null인 경우
     */
    public DepartmentParentQuery {
        if (departmentUuidIdentifier == null) {
            throw new IllegalArgumentException("departmentUuidIdentifier cannot be null");
        }
    }

    public static DepartmentParentQuery of(UUID departmentUuidIdentifier) {
        return new DepartmentParentQuery(departmentUuidIdentifier, null);
    }

    public static DepartmentParentQuery of(UUID departmentUuidIdentifier, LocalDate effectiveDate) {
        return new DepartmentParentQuery(departmentUuidIdentifier, effectiveDate);
    }
}
