/**
 * Parameter Normalizer.
 *
 * <p>느슨하게 지정된 조회 조건을 원격 Operation이 기대하는 정확한 필드 집합
 * ({@link com.ryuqq.sdconnector.core.model.FieldMap})으로 변환합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sdconnector.core.normalizer.IdentifierResolver} - UUID / 코드 식별자 판별</li>
 *   <li>{@link com.ryuqq.sdconnector.core.normalizer.TemporalWindowResolver} - 생략된 기간의 기본값</li>
 *   <li>{@link com.ryuqq.sdconnector.core.normalizer.ParameterNormalizer} - 조회 종류별 FieldMap 생성</li>
 * </ul>
 *
 * <p>모든 구성 요소는 I/O가 없는 순수 함수이며 "오늘"은 {@link java.time.Clock}으로 주입됩니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
package com.ryuqq.sdconnector.core.normalizer;
