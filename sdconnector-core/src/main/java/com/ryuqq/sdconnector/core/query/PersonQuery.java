package com.ryuqq.sdconnector.core.query;

import java.time.LocalDate;

/**
 * GetPerson 조회 조건.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record PersonQuery(
    EmploymentScope scope,
    LocalDate effectiveDate,
    boolean statusActiveIndicator,
    boolean statusPassiveIndicator,
    boolean contactInformationIndicator,
    boolean postalAddressIndicator
) {

    public PersonQuery {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
    }

    public static Builder builder(String institutionIdentifier) {
        return new Builder(institutionIdentifier);
    }

    public static PersonQuery of(String institutionIdentifier) {
        return builder(institutionIdentifier).build();
    }

    public static final class Builder extends ScopedQueryBuilder<Builder> {

        private LocalDate effectiveDate;
        private boolean statusActiveIndicator = true;
        private boolean statusPassiveIndicator = false;
        private boolean contactInformationIndicator = false;
        private boolean postalAddressIndicator = false;

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

        public Builder contactInformationIndicator(boolean contactInformationIndicator) {
            this.contactInformationIndicator = contactInformationIndicator;
            return this;
        }

        public Builder postalAddressIndicator(boolean postalAddressIndicator) {
            this.postalAddressIndicator = postalAddressIndicator;
            return this;
        }

        public PersonQuery build() {
            return new PersonQuery(
                scope(),
                effectiveDate,
                statusActiveIndicator,
                statusPassiveIndicator,
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
