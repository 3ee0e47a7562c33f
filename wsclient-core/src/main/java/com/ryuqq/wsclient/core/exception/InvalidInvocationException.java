package com.ryuqq.wsclient.core.exception;

/**
 * 2단계 호출의 대상이 지정되지 않은 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InvalidInvocationException extends SoapClientException {

    public InvalidInvocationException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }

    public InvalidInvocationException(String message, Throwable cause) {
        super(ErrorKind.INVALID_ARGUMENT, message, cause);
    }
}
