package com.ryuqq.sdconnector.core.spi;

import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.model.ResponseRecord;

import java.util.concurrent.CompletableFuture;

/**
 * 비블로킹 방식으로 호출 가능한 바인딩된 Operation.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncBoundOperation {

    /**
     * Operation 호출.
     *
     * @param fields 요청 필드
     * @return 응답 또는 실패로 완료되는 Future
     */
    CompletableFuture<ResponseRecord> call(FieldMap fields);
}
