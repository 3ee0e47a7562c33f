package com.ryuqq.wsclient.core.exception;

/**
 * Response signature verification failed.
 *
 * <p>Raised by a {@code SignatureVerifier}; the response is not delivered to the caller.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SignatureVerificationException extends SoapClientException {

    public SignatureVerificationException(String message) {
        super(ErrorKind.VERIFICATION_FAILED, message);
    }

    public SignatureVerificationException(String message, Throwable cause) {
        super(ErrorKind.VERIFICATION_FAILED, message, cause);
    }
}
