package com.ryuqq.sdconnector.core.query;

/**
 * GetProfession 조회 조건.
 *
 * @param institutionIdentifier 기관 코드 (필수)
 * @param jobPositionIdentifier 직위 코드 (선택)
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record ProfessionQuery(String institutionIdentifier, String jobPositionIdentifier) {

    public ProfessionQuery {
        if (institutionIdentifier == null) {
            throw new IllegalArgumentException("institutionIdentifier cannot be null");
        }
    }

    public static ProfessionQuery of(String institutionIdentifier) {
        return new ProfessionQuery(institutionIdentifier, null);
    }

    public static ProfessionQuery of(String institutionIdentifier, String jobPositionIdentifier) {
        return new ProfessionQuery(institutionIdentifier, jobPositionIdentifier);
    }
}
