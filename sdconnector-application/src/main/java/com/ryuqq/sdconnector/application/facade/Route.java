package com.ryuqq.sdconnector.application.facade;

import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.normalizer.ParameterNormalizer;

import java.util.function.BiFunction;

/**
 * Facade 메서드 하나의 라우팅 정보.
 *
 * @param operationName 호출할 Canonical Operation 이름
 * @param normalizer 조회 조건 → 요청 필드 변환
 * @param <Q> 조회 조건 타입
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record Route<Q>(String operationName, BiFunction<ParameterNormalizer, Q, FieldMap> normalizer) {

    public Route {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer cannot be null");
        }
    }

    /**
     * 조회 조건을 요청 필드로 변환.
     *
     * @param parameterNormalizer 정규화기
     * @param query 조회 조건
     * @return 요청 필드
     */
    public FieldMap normalize(ParameterNormalizer parameterNormalizer, Q query) {
        return normalizer.apply(parameterNormalizer, query);
    }
}
