package com.ryuqq.sdconnector.core.query;

/**
 * {@link EmploymentScope}를 가진 조회 Builder의 공통 부분.
 *
 * @param <B> 구체 Builder 타입
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public abstract class ScopedQueryBuilder<B extends ScopedQueryBuilder<B>> {

    private final String institutionIdentifier;
    private String personCivilRegistrationIdentifier;
    private String employmentIdentifier;
    private String departmentIdentifier;
    private String departmentLevelIdentifier;

    protected ScopedQueryBuilder(String institutionIdentifier) {
        if (institutionIdentifier == null) {
            throw new IllegalArgumentException("institutionIdentifier cannot be null");
        }
        this.institutionIdentifier = institutionIdentifier;
    }

    public B personCivilRegistrationIdentifier(String personCivilRegistrationIdentifier) {
        this.personCivilRegistrationIdentifier = personCivilRegistrationIdentifier;
        return self();
    }

    public B employmentIdentifier(String employmentIdentifier) {
        this.employmentIdentifier = employmentIdentifier;
        return self();
    }

    public B departmentIdentifier(String departmentIdentifier) {
        this.departmentIdentifier = departmentIdentifier;
        return self();
    }

    public B departmentLevelIdentifier(String departmentLevelIdentifier) {
        this.departmentLevelIdentifier = departmentLevelIdentifier;
        return self();
    }

    protected EmploymentScope scope() {
        return new EmploymentScope(
            institutionIdentifier,
            personCivilRegistrationIdentifier,
            employmentIdentifier,
            departmentIdentifier,
            departmentLevelIdentifier
        );
    }

    protected abstract B self();
}
