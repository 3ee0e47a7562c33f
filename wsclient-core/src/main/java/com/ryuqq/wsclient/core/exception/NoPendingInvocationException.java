package com.ryuqq.wsclient.core.exception;

/**
 * 준비된 호출 없이 finalize를 요청했거나, 이미 전송된 핸들을 다시 전송하려 한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoPendingInvocationException extends SoapClientException {

    public NoPendingInvocationException(String message) {
        super(ErrorKind.NO_PENDING_INVOCATION, message);
    }

    public NoPendingInvocationException(String message, Throwable cause) {
        super(ErrorKind.NO_PENDING_INVOCATION, message, cause);
    }
}
