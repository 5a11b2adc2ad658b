package com.ryuqq.sdconnector.core.exception;

/**
 * 공유 네트워크 세션 해제 실패.
 *
 * <p>연결 자원이 누수되었을 수 있음을 의미하므로 호출자에게 전달됩니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public class ResourceReleaseException extends SdConnectorException {

    public ResourceReleaseException(String message) {
        super(message);
    }

    public ResourceReleaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
