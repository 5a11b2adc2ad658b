package com.ryuqq.sdconnector.core.query;

import java.time.LocalDate;

/**
 * GetEmployment 조회 조건.
 *
 * <p>effectiveDate를 생략하면 오늘 기준입니다.</p>
 *
 * <p><strong>Indicator 기본값:</strong></p>
 * <ul>
 *   <li>true: statusActive, department, employmentStatus, profession, uuid</li>
 *   <li>false: statusPassive, salaryAgreement, salaryCodeGroup, workingTime</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record EmploymentQuery(
    EmploymentScope scope,
    LocalDate effectiveDate,
    boolean statusActiveIndicator,
    boolean statusPassiveIndicator,
    boolean departmentIndicator,
    boolean employmentStatusIndicator,
    boolean professionIndicator,
    boolean salaryAgreementIndicator,
    boolean salaryCodeGroupIndicator,
    boolean workingTimeIndicator,
    boolean uuidIndicator
) {

    public EmploymentQuery {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
    }

    public static Builder builder(String institutionIdentifier) {
        return new Builder(institutionIdentifier);
    }

    public static EmploymentQuery of(String institutionIdentifier) {
        return builder(institutionIdentifier).build();
    }

    public static final class Builder extends ScopedQueryBuilder<Builder> {

        private LocalDate effectiveDate;
        private boolean statusActiveIndicator = true;
        private boolean statusPassiveIndicator = false;
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

        public Builder effectiveDate(LocalDate effectiveDate) {
            this.effectiveDate = effectiveDate;
            return this;
        }

        public Builder statusActiveIndicator(boolean statusActiveIndicator) {
            this.statusActiveIndicator = statusActiveIndicator;
            return this;
        }

        public Builder statusPassiveIndicator(boolean statusPassiveIndicator) {
            this.statusPassiveIndicator = statusPassiveIndicator;
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

        public EmploymentQuery build() {
            return new EmploymentQuery(
                scope(),
                effectiveDate,
                statusActiveIndicator,
                statusPassiveIndicator,
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
