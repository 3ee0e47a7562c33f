package com.ryuqq.wsclient.core.exception;

/**
 * The HTTP exchange failed before any response arrived (connect, timeout, I/O).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransportException extends SoapClientException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT_FAILED, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_FAILED, message, cause);
    }
}
