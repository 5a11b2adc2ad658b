package com.ryuqq.sdconnector.core.query;

import java.time.LocalDateTime;

/**
 * GetEmploymentChangedAtDate 조회 조건.
 *
 * <p>기간을 생략하면 오늘 00:00:00 ~ 23:59:59 동안 등록된 변경을 조회합니다.
 * futureInformationIndicator는 미래 시점 변경의 포함 여부입니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record EmploymentChangedAtDateQuery(
    EmploymentScope scope,
    LocalDateTime startDateTime,
    LocalDateTime endDateTime,
    boolean departmentIndicator,
    boolean employmentStatusIndicator,
    boolean professionIndicator,
    boolean salaryAgreementIndicator,
    boolean salaryCodeGroupIndicator,
    boolean workingTimeIndicator,
    boolean uuidIndicator,
    boolean futureInformationIndicator
) {

    public EmploymentChangedAtDateQuery {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
    }

    public static Builder builder(String institutionIdentifier) {
        return new Builder(institutionIdentifier);
    }

    public static EmploymentChangedAtDateQuery of(String institutionIdentifier) {
        return builder(institutionIdentifier).build();
    }

    public static final class Builder extends ScopedQueryBuilder<Builder> {

        private LocalDateTime startDateTime;
        private LocalDateTime endDateTime;
        private boolean departmentIndicator = true;
        private boolean employmentStatusIndicator = true;
        private boolean professionIndicator = true;
        private boolean salaryAgreementIndicator = false;
        private boolean salaryCodeGroupIndicator = false;
        private boolean workingTimeIndicator = false;
        private boolean uuidIndicator = true;
        private boolean futureInformationIndicator = false;

        private Builder(String institutionIdentifier) {
            super(institutionIdentifier);
        }

        public Builder startDateTime(LocalDateTime startDateTime) {
            this.startDateTime = startDateTime;
            return this;
        }

        public Builder endDateTime(LocalDateTime endDateTime) {
            this.endDateTime = endDateTime;
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

        public Builder futureInformationIndicator(boolean futureInformationIndicator) {
            this.futureInformationIndicator = futureInformationIndicator;
            return this;
        }

        public EmploymentChangedAtDateQuery build() {
            return new EmploymentChangedAtDateQuery(
                scope(),
                startDateTime,
                endDateTime,
                departmentIndicator,
                employmentStatusIndicator,
                professionIndicator,
                salaryAgreementIndicator,
                salaryCodeGroupIndicator,
                workingTimeIndicator,
                uuidIndicator,
                futureInformationIndicator
            );
        }

        @Override
        protected Builder self() {
            return this;
        }
    }
}
