package com.ryuqq.sdconnector.core.query;

/**
 * 인사/고용 조회의 공통 대상 범위.
 *
 * <p>GetEmployment*, GetPerson* 조회가 공유하는 식별자 묶음입니다.
 * institutionIdentifier만 필수이며 나머지는 null이면 요청에서 생략됩니다.
 * departmentLevelIdentifier는 빈 문자열도 생략 대상입니다.</p>
 *
 * @param institutionIdentifier 기관 코드 (필수)
 * @param personCivilRegistrationIdentifier CPR 번호 (선택)
 * @param employmentIdentifier 고용 번호 (선택)
 * @param departmentIdentifier 부서 코드 (선택)
 * @param departmentLevelIdentifier 부서 레벨 (선택)
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record EmploymentScope(
    String institutionIdentifier,
    String personCivilRegistrationIdentifier,
    String employmentIdentifier,
    String departmentIdentifier,
    String departmentLevelIdentifier
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException institutionIdentifier가 null인 경우
     */
    public EmploymentScope {
        if (institutionIdentifier == null) {
            throw new IllegalArgumentException("institutionIdentifier cannot be null");
        }
    }

    /**
     * 기관만 지정한 범위.
     *
     * @param institutionIdentifier 기관 코드
     * @return EmploymentScope 인스턴스
     */
    public static EmploymentScope ofInstitution(String institutionIdentifier) {
        return new EmploymentScope(institutionIdentifier, null, null, null, null);
    }
}
