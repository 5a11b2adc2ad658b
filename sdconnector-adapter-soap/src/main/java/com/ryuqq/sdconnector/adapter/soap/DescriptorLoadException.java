package com.ryuqq.sdconnector.adapter.soap;

import com.ryuqq.sdconnector.core.exception.SdConnectorException;

/**
 * 서비스 디스크립터(WSDL)를 가져오거나 해석하지 못한 경우.
 *
 * <p>Registry 생성 중에 발생하며 Registry가 생성 오류로 감쌉니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public class DescriptorLoadException extends SdConnectorException {

    public DescriptorLoadException(String message) {
        super(message);
    }

    public DescriptorLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
