package com.ryuqq.sdconnector.core.model;

import java.util.List;

/**
 * 원격 서비스와의 계약인 Canonical Operation 이름.
 *
 * <p>이 이름들은 SD 서비스가 광고하는 Operation 이름에서 {@value #OPERATION_SUFFIX}
 * 접미사를 제거한 값이며, 원격 계약이므로 변경하면 안 됩니다.
 * 같은 Operation의 이전 버전도 바인딩되지만 여기 나열된 최신 버전만 Facade로 노출됩니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class OperationNames {

    /** 광고된 Operation 이름의 고정 접미사. */
    public static final String OPERATION_SUFFIX = "Operation";

    // Organization
    public static final String GET_DEPARTMENT = "GetDepartment20111201";
    public static final String GET_DEPARTMENT_PARENT = "GetDepartmentParent20190701";
    public static final String GET_INSTITUTION = "GetInstitution20111201";
    public static final String GET_ORGANIZATION = "GetOrganization20111201";

    // Person and employment
    public static final String GET_EMPLOYMENT = "GetEmployment20111201";
    public static final String GET_EMPLOYMENT_CHANGED = "GetEmploymentChanged20111201";
    public static final String GET_EMPLOYMENT_CHANGED_AT_DATE = "GetEmploymentChangedAtDate20111201";
    public static final String GET_PERSON = "GetPerson20111201";
    public static final String GET_PERSON_CHANGED_AT_DATE = "GetPersonChangedAtDate20111201";

    // Profession
    public static final String GET_PROFESSION = "GetProfession20080201";

    /** Facade로 노출되는 Operation 이름 전체. */
    public static final List<String> EXPOSED = List.of(
        GET_DEPARTMENT,
        GET_DEPARTMENT_PARENT,
        GET_INSTITUTION,
        GET_ORGANIZATION,
        GET_EMPLOYMENT,
        GET_EMPLOYMENT_CHANGED,
        GET_EMPLOYMENT_CHANGED_AT_DATE,
        GET_PERSON,
        GET_PERSON_CHANGED_AT_DATE,
        GET_PROFESSION
    );

    private OperationNames() {
    }

    /**
     * 광고된 Operation 이름을 Canonical 이름으로 변환.
     *
     * <p>이름 끝의 {@value #OPERATION_SUFFIX} 문자열 하나만 제거합니다.
     * 접미사가 없으면 그대로 반환합니다.</p>
     *
     * @param advertisedName 서비스 디스크립터에 광고된 이름 (예: GetPerson20111201Operation)
     * @return Canonical 이름 (예: GetPerson20111201)
     * @throws IllegalArgumentException advertisedName이 null/빈 문자열이거나 접미사만으로 이루어진 경우
     */
    public static String canonicalize(String advertisedName) {
        if (advertisedName == null || advertisedName.isBlank()) {
            throw new IllegalArgumentException("advertisedName cannot be null or blank");
        }
        if (!advertisedName.endsWith(OPERATION_SUFFIX)) {
            return advertisedName;
        }
        String canonical = advertisedName.substring(0, advertisedName.length() - OPERATION_SUFFIX.length());
        if (canonical.isEmpty()) {
            throw new IllegalArgumentException("advertisedName has no name before the suffix: " + advertisedName);
        }
        return canonical;
    }
}
