package com.ryuqq.sdconnector.core.query;

import com.ryuqq.sdconnector.core.model.Identifier;

import java.time.LocalDate;
import java.util.UUID;

/**
 * GetDepartment 조회 조건.
 *
 * <p>기관/부서 식별자는 코드 또는 UUID 모두 허용됩니다.
 * 기간을 생략하면 오늘 하루로 조회합니다.</p>
 *
 * <p><strong>Indicator 기본값:</strong> departmentName=true, uuid=true, 나머지 false</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record DepartmentQuery(
    Identifier institutionIdentifier,
    Identifier departmentIdentifier,
    String departmentLevelIdentifier,
    LocalDate startDate,
    LocalDate endDate,
    boolean contactInformationIndicator,
    boolean departmentNameIndicator,
    boolean employmentDepartmentIndicator,
    boolean postalAddressIndicator,
    boolean productionUnitIndicator,
    boolean uuidIndicator
) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 모든 값을 기본값으로 둔 조회 조건.
     *
     * @return DepartmentQuery 인스턴스
     */
    public static DepartmentQuery defaults() {
        return builder().build();
    }

    /**
     * DepartmentQuery Builder.
     */
    public static final class Builder {

        private Identifier institutionIdentifier;
        private Identifier departmentIdentifier;
        private String departmentLevelIdentifier;
        private LocalDate startDate;
        private LocalDate endDate;
        private boolean contactInformationIndicator = false;
        private boolean departmentNameIndicator = true;
        private boolean employmentDepartmentIndicator = false;
        private boolean postalAddressIndicator = false;
        private boolean productionUnitIndicator = false;
        private boolean uuidIndicator = true;

        private Builder() {
        }

        public Builder institutionIdentifier(String institutionIdentifier) {
            this.institutionIdentifier = Identifier.ofNullable(institutionIdentifier);
            return this;
        }

        public Builder institutionIdentifier(UUID institutionIdentifier) {
            this.institutionIdentifier = Identifier.ofNullable(institutionIdentifier);
            return this;
        }

        public Builder departmentIdentifier(String departmentIdentifier) {
            this.departmentIdentifier = Identifier.ofNullable(departmentIdentifier);
            return this;
        }

        public Builder departmentIdentifier(UUID departmentIdentifier) {
            this.departmentIdentifier = Identifier.ofNullable(departmentIdentifier);
            return this;
        }

        public Builder departmentLevelIdentifier(String departmentLevelIdentifier) {
            this.departmentLevelIdentifier = departmentLevelIdentifier;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder contactInformationIndicator(boolean contactInformationIndicator) {
            this.contactInformationIndicator = contactInformationIndicator;
            return this;
        }

        public Builder departmentNameIndicator(boolean departmentNameIndicator) {
            this.departmentNameIndicator = departmentNameIndicator;
            return this;
        }

        public Builder employmentDepartmentIndicator(boolean employmentDepartmentIndicator) {
            this.employmentDepartmentIndicator = employmentDepartmentIndicator;
            return this;
        }

        public Builder postalAddressIndicator(boolean postalAddressIndicator) {
            this.postalAddressIndicator = postalAddressIndicator;
            return this;
        }

        public Builder productionUnitIndicator(boolean productionUnitIndicator) {
            this.productionUnitIndicator = productionUnitIndicator;
            return this;
        }

        public Builder uuidIndicator(boolean uuidIndicator) {
            this.uuidIndicator = uuidIndicator;
            return this;
        }

        public DepartmentQuery build() {
            return new DepartmentQuery(
                institutionIdentifier,
                departmentIdentifier,
                departmentLevelIdentifier,
                startDate,
                endDate,
                contactInformationIndicator,
                departmentNameIndicator,
                employmentDepartmentIndicator,
                postalAddressIndicator,
                productionUnitIndicator,
                uuidIndicator
            );
        }
    }
}
