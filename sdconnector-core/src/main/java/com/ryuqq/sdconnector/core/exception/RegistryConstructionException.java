package com.ryuqq.sdconnector.core.exception;

/**
 * Operation Registry 생성 실패.
 *
 * <p>다음 경우에 발생하며 재시도 대상이 아닙니다:</p>
 * <ul>
 *   <li>서비스 디스크립터가 Operation을 정확히 하나 광고하지 않음 (원격 계약 위반)</li>
 *   <li>Canonical 이름이 이미 바인딩된 이름과 충돌</li>
 *   <li>서비스 디스크립터를 가져오거나 해석하지 못함</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public class RegistryConstructionException extends SdConnectorException {

    public RegistryConstructionException(String message) {
        super(message);
    }

    public RegistryConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
