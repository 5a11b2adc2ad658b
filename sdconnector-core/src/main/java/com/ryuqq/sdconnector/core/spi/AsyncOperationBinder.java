package com.ryuqq.sdconnector.core.spi;

import java.util.concurrent.CompletableFuture;

/**
 * 비블로킹 Operation Binder SPI.
 *
 * <p>{@link OperationBinder}와 같은 역할이지만 디스크립터 조회와 호출이 Future를 반환합니다.
 * 하부 전송 자원(HTTP 클라이언트, 스레드)을 소유하므로 더 이상 호출하지 않을 때
 * 반드시 {@link #close()}로 해제해야 합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public interface AsyncOperationBinder extends AutoCloseable {

    /**
     * 서비스 디스크립터 조회.
     *
     * @param locator 디스크립터 위치
     * @return 해석된 디스크립터로 완료되는 Future
     */
    CompletableFuture<ServiceDescriptor> describe(String locator);

    /**
     * Operation 바인딩.
     *
     * @param operation 광고된 Operation
     * @return 호출 가능한 핸들
     */
    AsyncBoundOperation bind(OperationSpec operation);

    /**
     * 전송 자원 해제.
     *
     * @throws com.ryuqq.sdconnector.core.exception.ResourceReleaseException 해제 실패 시
     */
    @Override
    void close();
}
