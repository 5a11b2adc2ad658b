package com.ryuqq.sdconnector.core.query;

import com.ryuqq.sdconnector.core.model.Identifier;

import java.time.LocalDate;
import java.util.UUID;

/**
 * GetOrganization 조회 조건.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record OrganizationQuery(
    Identifier institutionIdentifier,
    LocalDate startDate,
    LocalDate endDate,
    boolean uuidIndicator
) {

    public static Builder builder() {
        return new Builder();
    }

    public static OrganizationQuery defaults() {
        return builder().build();
    }

    public static final class Builder {

        private Identifier institutionIdentifier;
        private LocalDate startDate;
        private LocalDate endDate;
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

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder uuidIndicator(boolean uuidIndicator) {
            this.uuidIndicator = uuidIndicator;
            return this;
        }

        public OrganizationQuery build() {
            return new OrganizationQuery(institutionIdentifier, startDate, endDate, uuidIndicator);
        }
    }
}
