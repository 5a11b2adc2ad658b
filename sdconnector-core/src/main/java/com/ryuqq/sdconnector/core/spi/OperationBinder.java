package com.ryuqq.sdconnector.core.spi;

/**
 * 블로킹 Operation Binder SPI.
 *
 * <p>하나의 인증 정보(Credentials)에 묶인 연결로 서비스 디스크립터를 가져오고,
 * 광고된 Operation을 호출 가능한 핸들로 바인딩합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>{@link #describe(String)}: 네트워크 I/O 수행 (호출 스레드에서 블로킹)</li>
 *   <li>{@link #bind(OperationSpec)}: I/O 없이 핸들만 생성</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public interface OperationBinder {

    /**
     * 서비스 디스크립터 조회.
     *
     * @param locator 디스크립터 위치
     * @return 해석된 디스크립터
     * @throws RuntimeException 조회 또는 해석 실패 시
     */
    ServiceDescriptor describe(String locator);

    /**
     * Operation 바인딩.
     *
     * @param operation 광고된 Operation
     * @return 호출 가능한 핸들
     */
    BoundOperation bind(OperationSpec operation);
}
