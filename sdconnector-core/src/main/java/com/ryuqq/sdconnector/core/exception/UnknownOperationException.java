package com.ryuqq.sdconnector.core.exception;

/**
 * 바인딩되지 않은 Operation 이름 조회.
 *
 * <p>Operation 이름은 Facade가 고정하므로 이 예외는 프로그래밍 오류를 의미합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public class UnknownOperationException extends SdConnectorException {

    private final String operationName;

    public UnknownOperationException(String operationName) {
        super("No operation bound under name: " + operationName);
        this.operationName = operationName;
    }

    public String getOperationName() {
        return operationName;
    }
}
