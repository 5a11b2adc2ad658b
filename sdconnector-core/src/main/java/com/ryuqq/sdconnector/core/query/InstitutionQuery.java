package com.ryuqq.sdconnector.core.query;

import com.ryuqq.sdconnector.core.model.Identifier;

import java.util.UUID;

/**
 * GetInstitution 조회 조건.
 *
 * <p><strong>Indicator 기본값:</strong> uuid=true, 나머지 false</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record InstitutionQuery(
    Identifier regionIdentifier,
    Identifier institutionIdentifier,
    boolean administrationIndicator,
    boolean contactInformationIndicator,
    boolean postalAddressIndicator,
    boolean productionUnitIndicator,
    boolean uuidIndicator
) {

    public static Builder builder() {
        return new Builder();
    }

    public static InstitutionQuery defaults() {
        return builder().build();
    }

    /**
     * InstitutionQuery Builder.
     */
    public static final class Builder {

        private Identifier regionIdentifier;
        private Identifier institutionIdentifier;
        private boolean administrationIndicator = false;
        private boolean contactInformationIndicator = false;
        private boolean postalAddressIndicator = false;
        private boolean productionUnitIndicator = false;
        private boolean uuidIndicator = true;

        private Builder() {
        }

        public Builder regionIdentifier(String regionIdentifier) {
            this.regionIdentifier = Identifier.ofNullable(regionIdentifier);
            return this;
        }

        public Builder regionIdentifier(UUID regionIdentifier) {
            this.regionIdentifier = Identifier.ofNullable(regionIdentifier);
            return this;
        }

        public Builder institutionIdentifier(String institutionIdentifier) {
            this.institutionIdentifier = Identifier.ofNullable(institutionIdentifier);
            return this;
        }

        public Builder institutionIdentifier(UUID institutionIdentifier) {
            this.institutionIdentifier = Identifier.ofNullable(institutionIdentifier);
            return this;
        }

        public Builder administrationIndicator(boolean administrationIndicator) {
            this.administrationIndicator = administrationIndicator;
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

        public Builder productionUnitIndicator(boolean productionUnitIndicator) {
            this.productionUnitIndicator = productionUnitIndicator;
            return this;
        }

        public Builder uuidIndicator(boolean uuidIndicator) {
            this.uuidIndicator = uuidIndicator;
            return this;
        }

        public InstitutionQuery build() {
            return new InstitutionQuery(
                regionIdentifier,
                institutionIdentifier,
                administrationIndicator,
                contactInformationIndicator,
                postalAddressIndicator,
                productionUnitIndicator,
                uuidIndicator
            );
        }
    }
}
