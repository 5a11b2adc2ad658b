/**
 * 조회 조건 (Typed Query).
 *
 * <p>원격 Operation마다 하나의 불변 record가 있으며, 선택 값은 Builder로 지정합니다.
 * 지정하지 않은 Indicator는 원격 서비스가 권장하는 기본값을 가집니다.</p>
 *
 * <h2>조회 조건</h2>
 * <ul>
 *   <li>Organization: {@link com.ryuqq.sdconnector.core.query.DepartmentQuery},
 *       {@link com.ryuqq.sdconnector.core.query.DepartmentParentQuery},
 *       {@link com.ryuqq.sdconnector.core.query.InstitutionQuery},
 *       {@link com.ryuqq.sdconnector.core.query.OrganizationQuery}</li>
 *   <li>Person/Employment: {@link com.ryuqq.sdconnector.core.query.EmploymentQuery},
 *       {@link com.ryuqq.sdconnector.core.query.EmploymentChangedQuery},
 *       {@link com.ryuqq.sdconnector.core.query.EmploymentChangedAtDateQuery},
 *       {@link com.ryuqq.sdconnector.core.query.PersonQuery},
 *       {@link com.ryuqq.sdconnector.core.query.PersonChangedAtDateQuery}</li>
 *   <li>Profession: {@link com.ryuqq.sdconnector.core.query.ProfessionQuery}</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
package com.ryuqq.sdconnector.core.query;
