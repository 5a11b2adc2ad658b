package com.ryuqq.sdconnector.core.normalizer;

import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.query.DepartmentParentQuery;
import com.ryuqq.sdconnector.core.query.DepartmentQuery;
import com.ryuqq.sdconnector.core.query.EmploymentChangedAtDateQuery;
import com.ryuqq.sdconnector.core.query.EmploymentChangedQuery;
import com.ryuqq.sdconnector.core.query.EmploymentQuery;
import com.ryuqq.sdconnector.core.query.EmploymentScope;
import com.ryuqq.sdconnector.core.query.InstitutionQuery;
import com.ryuqq.sdconnector.core.query.OrganizationQuery;
import com.ryuqq.sdconnector.core.query.PersonChangedAtDateQuery;
import com.ryuqq.sdconnector.core.query.PersonQuery;
import com.ryuqq.sdconnector.core.query.ProfessionQuery;

import java.time.Clock;

/**
 * 조회 조건 → 요청 FieldMap 변환기.
 *
 * <p>조회 종류마다 하나의 메서드가 있으며, 각 메서드는 원격 Operation이 기대하는
 * 필드 집합을 정확히 만들어냅니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>Indicator 필드는 항상 포함 (true/false)</li>
 *   <li>선택 식별자는 값이 있을 때만 포함</li>
 *   <li>DepartmentLevelIdentifier는 빈 문자열이 아닐 때만 포함 (존재 여부 자체가 의미를 가짐)</li>
 *   <li>생략된 기간은 {@link TemporalWindowResolver}가 오늘로 채움</li>
 * </ul>
 *
 * <p>I/O가 없는 순수 함수이며, 같은 입력과 같은 "오늘"에 대해 항상 같은 결과를 돌려줍니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class ParameterNormalizer {

    private final TemporalWindowResolver temporal;

    /**
     * 시스템 기본 시간대 Clock으로 생성.
     */
    public ParameterNormalizer() {
        this(Clock.systemDefaultZone());
    }

    /**
     * 생성자.
     *
     * @param clock "오늘" 기준 Clock
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public ParameterNormalizer(Clock clock) {
        this.temporal = new TemporalWindowResolver(clock);
    }

    // ------------------------------------------------------------
    // Organization
    // ------------------------------------------------------------

    public FieldMap department(DepartmentQuery query) {
        requireQuery(query);
        FieldMap.Builder fields = FieldMap.builder()
            .put("ContactInformationIndicator", query.contactInformationIndicator())
            .put("DepartmentNameIndicator", query.departmentNameIndicator())
            .put("EmploymentDepartmentIndicator", query.employmentDepartmentIndicator())
            .put("PostalAddressIndicator", query.postalAddressIndicator())
            .put("ProductionUnitIndicator", query.productionUnitIndicator())
            .put("UUIDIndicator", query.uuidIndicator())
            .putAll(IdentifierResolver.resolve("Institution", query.institutionIdentifier()))
            .putAll(IdentifierResolver.resolve("Department", query.departmentIdentifier()));
        putDepartmentLevel(fields, query.departmentLevelIdentifier());
        return fields
            .putAll(temporal.resolveDates(query.startDate(), query.endDate()))
            .build();
    }

    public FieldMap departmentParent(DepartmentParentQuery query) {
        requireQuery(query);
        return FieldMap.builder()
            .put("EffectiveDate", temporal.effectiveDate(query.effectiveDate()))
            .put("DepartmentUUIDIdentifier", query.departmentUuidIdentifier().toString())
            .build();
    }

    public FieldMap institution(InstitutionQuery query) {
        requireQuery(query);
        return FieldMap.builder()
            .put("AdministrationIndicator", query.administrationIndicator())
            .put("ContactInformationIndicator", query.contactInformationIndicator())
            .put("PostalAddressIndicator", query.postalAddressIndicator())
            .put("ProductionUnitIndicator", query.productionUnitIndicator())
            .put("UUIDIndicator", query.uuidIndicator())
            .putAll(IdentifierResolver.resolve("Region", query.regionIdentifier()))
            .putAll(IdentifierResolver.resolve("Institution", query.institutionIdentifier()))
            .build();
    }

    public FieldMap organization(OrganizationQuery query) {
        requireQuery(query);
        return FieldMap.builder()
            .put("UUIDIndicator", query.uuidIndicator())
            .putAll(IdentifierResolver.resolve("Institution", query.institutionIdentifier()))
            .putAll(temporal.resolveDates(query.startDate(), query.endDate()))
            .build();
    }

    // ------------------------------------------------------------
    // Person and employment
    // ------------------------------------------------------------

    public FieldMap employment(EmploymentQuery query) {
        requireQuery(query);
        FieldMap.Builder fields = scopeFields(query.scope())
            .put("EffectiveDate", temporal.effectiveDate(query.effectiveDate()))
            .put("StatusActiveIndicator", query.statusActiveIndicator())
            .put("StatusPassiveIndicator", query.statusPassiveIndicator())
            .put("DepartmentIndicator", query.departmentIndicator())
            .put("EmploymentStatusIndicator", query.employmentStatusIndicator())
            .put("ProfessionIndicator", query.professionIndicator())
            .put("SalaryAgreementIndicator", query.salaryAgreementIndicator())
            .put("SalaryCodeGroupIndicator", query.salaryCodeGroupIndicator())
            .put("WorkingTimeIndicator", query.workingTimeIndicator())
            .put("UUIDIndicator", query.uuidIndicator());
        putDepartmentLevel(fields, query.scope().departmentLevelIdentifier());
        return fields.build();
    }

    public FieldMap employmentChanged(EmploymentChangedQuery query) {
        requireQuery(query);
        FieldMap.Builder fields = scopeFields(query.scope())
            .put("DepartmentIndicator", query.departmentIndicator())
            .put("EmploymentStatusIndicator", query.employmentStatusIndicator())
            .put("ProfessionIndicator", query.professionIndicator())
            .put("SalaryAgreementIndicator", query.salaryAgreementIndicator())
            .put("SalaryCodeGroupIndicator", query.salaryCodeGroupIndicator())
            .put("WorkingTimeIndicator", query.workingTimeIndicator())
            .put("UUIDIndicator", query.uuidIndicator());
        putDepartmentLevel(fields, query.scope().departmentLevelIdentifier());
        return fields
            .putAll(temporal.resolveDates(query.startDate(), query.endDate()))
            .build();
    }

    public FieldMap employmentChangedAtDate(EmploymentChangedAtDateQuery query) {
        requireQuery(query);
        FieldMap.Builder fields = scopeFields(query.scope())
            .put("DepartmentIndicator", query.departmentIndicator())
            .put("EmploymentStatusIndicator", query.employmentStatusIndicator())
            .put("ProfessionIndicator", query.professionIndicator())
            .put("SalaryAgreementIndicator", query.salaryAgreementIndicator())
            .put("SalaryCodeGroupIndicator", query.salaryCodeGroupIndicator())
            .put("WorkingTimeIndicator", query.workingTimeIndicator())
            .put("UUIDIndicator", query.uuidIndicator())
            .put("FutureInformationIndicator", query.futureInformationIndicator());
        putDepartmentLevel(fields, query.scope().departmentLevelIdentifier());
        return fields
            .putAll(temporal.resolveDateTimes(query.startDateTime(), query.endDateTime()))
            .build();
    }

    public FieldMap person(PersonQuery query) {
        requireQuery(query);
        FieldMap.Builder fields = scopeFields(query.scope())
            .put("EffectiveDate", temporal.effectiveDate(query.effectiveDate()))
            .put("StatusActiveIndicator", query.statusActiveIndicator())
            .put("StatusPassiveIndicator", query.statusPassiveIndicator())
            .put("ContactInformationIndicator", query.contactInformationIndicator())
            .put("PostalAddressIndicator", query.postalAddressIndicator());
        putDepartmentLevel(fields, query.scope().departmentLevelIdentifier());
        return fields.build();
    }

    public FieldMap personChangedAtDate(PersonChangedAtDateQuery query) {
        requireQuery(query);
        FieldMap.Builder fields = scopeFields(query.scope())
            .put("ContactInformationIndicator", query.contactInformationIndicator())
            .put("PostalAddressIndicator", query.postalAddressIndicator());
        putDepartmentLevel(fields, query.scope().departmentLevelIdentifier());
        return fields
            .putAll(temporal.resolveDateTimes(query.startDateTime(), query.endDateTime()))
            .build();
    }

    // ------------------------------------------------------------
    // Profession
    // ------------------------------------------------------------

    public FieldMap profession(ProfessionQuery query) {
        requireQuery(query);
        return FieldMap.builder()
            .put("InstitutionIdentifier", query.institutionIdentifier())
            .put("JobPositionIdentifier", query.jobPositionIdentifier())
            .build();
    }

    /**
     * 인사/고용 조회 공통 식별자 필드.
     *
     * <p>DepartmentLevelIdentifier는 Indicator 뒤에 오도록 호출자가 따로 추가합니다.</p>
     */
    private static FieldMap.Builder scopeFields(EmploymentScope scope) {
        return FieldMap.builder()
            .put("InstitutionIdentifier", scope.institutionIdentifier())
            .put("PersonCivilRegistrationIdentifier", scope.personCivilRegistrationIdentifier())
            .put("EmploymentIdentifier", scope.employmentIdentifier())
            .put("DepartmentIdentifier", scope.departmentIdentifier());
    }

    private static void putDepartmentLevel(FieldMap.Builder fields, String departmentLevelIdentifier) {
        if (departmentLevelIdentifier != null && !departmentLevelIdentifier.isEmpty()) {
            fields.put("DepartmentLevelIdentifier", departmentLevelIdentifier);
        }
    }

    private static void requireQuery(Object query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
    }
}
