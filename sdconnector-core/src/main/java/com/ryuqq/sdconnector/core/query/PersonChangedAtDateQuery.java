package com.ryuqq.sdconnector.core.query;

import java.time.LocalDateTime;

/**
 * GetPersonChangedAtDate 조회 조건.
 *
 * <p>기간을 생략하면 오늘 00:00:00 ~ 23:59:59 입니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record PersonChangedAtDateQuery(
    EmploymentScope scope,
    LocalDateTime startDateTime,
    LocalDateTime endDateTime,
    boolean contactInformationIndicator,
    boolean postalAddressIndicator
) {

    public PersonChangedAtDateQuery {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
    }

    public static Builder builder(String institutionIdentifier) {
        return new Builder(institutionIdentifier);
    }

    public static PersonChangedAtDateQuery of(String institutionIdentifier) {
        return builder(institutionIdentifier).build();
    }

    public static final class Builder extends ScopedQueryBuilder<Builder> {

        private LocalDateTime startDateTime;
        private LocalDateTime endDateTime;
        private boolean contactInformationIndicator = false;
        private boolean postalAddressIndicator = false;

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

        public Builder contactInformationIndicator(boolean contactInformationIndicator) {
            this.contactInformationIndicator = contactInformationIndicator;
            return this;
        }

        public Builder postalAddressIndicator(boolean postalAddressIndicator) {
            this.postalAddressIndicator = postalAddressIndicator;
            return this;
        }

        public PersonChangedAtDateQuery build() {
            return new PersonChangedAtDateQuery(
                scope(),
                startDateTime,
                endDateTime,
                contactInformationIndicator,
                postalAddressIndicator
            );
        }

        @Override
        protected Builder self() {
            return this;
        }
    }
}
