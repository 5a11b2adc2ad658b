package com.ryuqq.sdconnector.core.query;

import java.time.LocalDate;

/**
 * GetEmploymentChanged 조회 조건.
 *
 * <p>startDate/endDate를 생략하면 오늘 하루 동안의 변경을 조회합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record EmploymentChangedQuery(
    EmploymentScope scope,
    LocalDate startDate,
    LocalDate endDate,
    boolean departmentIndicator,
    boolean employmentStatusIndicator,
    boolean professionIndicator,
    boolean salaryAgreementIndicator,
    boolean salaryCodeGroupIndicator,
    boolean workingTimeIndicator,
    boolean uuidIndicator
) {

    public EmploymentChangedQuery {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
    }

    public static Builder builder(String institutionIdentifier) {
        return new Builder(institutionIdentifier);
    }

    public static EmploymentChangedQuery of(String institutionIdentifier) {
        return builder(institutionIdentifier).build();
    }

    public static final class Builder extends ScopedQueryBuilder<Builder> {

        private LocalDate startDate;
        private LocalDate endDate;
        private boolean departmentIndicator = true;
        private boolean employmentStatusIndicator = true;
        private boolean professionIndicator = true;
        private boolean salaryAgreementIndicator = false;
        private boolean salaryCodeGroupIndicator = false;
        private boolean workingTimeIndicator = false;
        private boolean uuidIndicator = true;

        private Builder(String institutionIdentifier) {
            super(institutionIdentifier);
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder departmentIndicator(boolean departmentIndicator) {
            this.departmentIndicator = departmentIndicator;
            return this;
        }

        public Builder employmentStatusIndicator(boolean employmentStatusIndicator) {
            this.employmentStatusIndicator = employmentStatusIndicator;
            return this;
        }

        public Builder professionIndicator(boolean professionIndicator) {
            this.professionIndicator = professionIndicator;
            return this;
        }

        public Builder salaryAgreementIndicator(boolean salaryAgreementIndicator) {
            this.salaryAgreementIndicator = salaryAgreementIndicator;
            return this;
        }

        public Builder salaryCodeGroupIndicator(boolean salaryCodeGroupIndicator) {
            this.salaryCodeGroupIndicator = salaryCodeGroupIndicator;
            return this;
        }

        public Builder workingTimeIndicator(boolean workingTimeIndicator) {
            this.workingTimeIndicator = workingTimeIndicator;
            return this;
        }

        public Builder uuidIndicator(boolean uuidIndicator) {
            this.uuidIndicator = uuidIndicator;
            return this;
        }

        public EmploymentChangedQuery build() {
            return new EmploymentChangedQuery(
                scope(),
                startDate,
                endDate,
                departmentIndicator,
                employmentStatusIndicator,
                professionIndicator,
                salaryAgreementIndicator,
                salaryCodeGroupIndicator,
                workingTimeIndicator,
                uuidIndicator
            );
        }

        @Override
        protected Builder self() {
            return this;
        }
    }
}
