package com.ryuqq.wsclient.core.spi;

/**
 * Response signature verification SPI.
 *
 * <p>Invoked after a two-phase invocation is finalized, only when response verification is enabled.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SignatureVerifier {

    /**
     * Verifies the signature carried by a response body.
     *
     * @param responseBody the raw response body
     * @throws com.ryuqq.wsclient.core.exception.SignatureVerificationException if the body is unsigned
     *         or any signature is invalid
     */
    void verify(String responseBody);
}
