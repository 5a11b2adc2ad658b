package com.ryuqq.sdconnector.core.exception;

/**
 * SD Connector 예외의 최상위 타입.
 *
 * <p>모든 예외는 unchecked이며, 재시도 소진 후의 호출 실패와 생성 실패만
 * 코어 경계를 넘어 호출자에게 전달됩니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public class SdConnectorException extends RuntimeException {

    public SdConnectorException(String message) {
        super(message);
    }

    public SdConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
