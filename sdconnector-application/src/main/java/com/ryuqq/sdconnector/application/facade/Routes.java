package com.ryuqq.sdconnector.application.facade;

import com.ryuqq.sdconnector.core.model.OperationNames;
import com.ryuqq.sdconnector.core.normalizer.ParameterNormalizer;
import com.ryuqq.sdconnector.core.query.DepartmentParentQuery;
import com.ryuqq.sdconnector.core.query.DepartmentQuery;
import com.ryuqq.sdconnector.core.query.EmploymentChangedAtDateQuery;
import com.ryuqq.sdconnector.core.query.EmploymentChangedQuery;
import com.ryuqq.sdconnector.core.query.EmploymentQuery;
import com.ryuqq.sdconnector.core.query.InstitutionQuery;
import com.ryuqq.sdconnector.core.query.OrganizationQuery;
import com.ryuqq.sdconnector.core.query.PersonChangedAtDateQuery;
import com.ryuqq.sdconnector.core.query.PersonQuery;
import com.ryuqq.sdconnector.core.query.ProfessionQuery;

import java.util.List;

/**
 * Facade 메서드 → (정규화 함수, Canonical Operation 이름) 매핑 표.
 *
 * <p>블로킹/비블로킹 Facade가 같은 표를 사용합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class Routes {

    public static final Route<DepartmentQuery> DEPARTMENT =
        new Route<>(OperationNames.GET_DEPARTMENT, ParameterNormalizer::department);

    public static final Route<DepartmentParentQuery> DEPARTMENT_PARENT =
        new Route<>(OperationNames.GET_DEPARTMENT_PARENT, ParameterNormalizer::departmentParent);

    public static final Route<InstitutionQuery> INSTITUTION =
        new Route<>(OperationNames.GET_INSTITUTION, ParameterNormalizer::institution);

    public static final Route<OrganizationQuery> ORGANIZATION =
        new Route<>(OperationNames.GET_ORGANIZATION, ParameterNormalizer::organization);

    public static final Route<EmploymentQuery> EMPLOYMENT =
        new Route<>(OperationNames.GET_EMPLOYMENT, ParameterNormalizer::employment);

    public static final Route<EmploymentChangedQuery> EMPLOYMENT_CHANGED =
        new Route<>(OperationNames.GET_EMPLOYMENT_CHANGED, ParameterNormalizer::employmentChanged);

    public static final Route<EmploymentChangedAtDateQuery> EMPLOYMENT_CHANGED_AT_DATE =
        new Route<>(OperationNames.GET_EMPLOYMENT_CHANGED_AT_DATE, ParameterNormalizer::employmentChangedAtDate);

    public static final Route<PersonQuery> PERSON =
        new Route<>(OperationNames.GET_PERSON, ParameterNormalizer::person);

    public static final Route<PersonChangedAtDateQuery> PERSON_CHANGED_AT_DATE =
        new Route<>(OperationNames.GET_PERSON_CHANGED_AT_DATE, ParameterNormalizer::personChangedAtDate);

    public static final Route<ProfessionQuery> PROFESSION =
        new Route<>(OperationNames.GET_PROFESSION, ParameterNormalizer::profession);

    /** 모든 Route (Facade 메서드 순서). */
    public static final List<Route<?>> ALL = List.of(
        DEPARTMENT,
        DEPARTMENT_PARENT,
        INSTITUTION,
        ORGANIZATION,
        EMPLOYMENT,
        EMPLOYMENT_CHANGED,
        EMPLOYMENT_CHANGED_AT_DATE,
        PERSON,
        PERSON_CHANGED_AT_DATE,
        PROFESSION
    );

    private Routes() {
    }
}
