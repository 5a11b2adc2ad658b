package com.ryuqq.sdconnector.core.exception;

/**
 * 재시도 대기 중 스레드 인터럽트.
 *
 * <p>발생 시 현재 스레드의 인터럽트 플래그는 복원되어 있습니다.
 * 마지막 호출 실패는 suppressed 예외로 첨부됩니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public class InvocationInterruptedException extends SdConnectorException {

    public InvocationInterruptedException(String operationName, InterruptedException cause) {
        super("Interrupted while waiting to retry " + operationName, cause);
    }
}
