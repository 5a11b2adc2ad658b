package com.ryuqq.sdconnector.core.spi;

import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.model.ResponseRecord;

/**
 * 블로킹 방식으로 호출 가능한 바인딩된 Operation.
 *
 * <p>호출마다 실제 네트워크 요청이 발생합니다. 실패는 unchecked 예외로 전달됩니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BoundOperation {

    /**
     * Operation 호출.
     *
     * @param fields 요청 필드
     * @return 구조화된 응답
     * @throws RuntimeException 호출 실패 시 (네트워크, 타임아웃, 원격 오류)
     */
    ResponseRecord call(FieldMap fields);
}
