package com.ryuqq.sdconnector.adapter.soap;

import com.ryuqq.sdconnector.core.exception.SdConnectorException;

/**
 * SOAP 호출 실패 (일시적 오류로 간주되어 재시도됨).
 *
 * <p>HTTP 상태 코드가 2xx가 아니거나, 타임아웃/연결 오류가 발생한 경우입니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public class SoapCallException extends SdConnectorException {

    /** 응답을 받지 못한 경우의 상태 코드. */
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public SoapCallException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SoapCallException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
    }

    /**
     * HTTP 상태 코드.
     *
     * @return 상태 코드, 응답이 없었으면 {@link #NO_STATUS}
     */
    public int getStatusCode() {
        return statusCode;
    }
}
