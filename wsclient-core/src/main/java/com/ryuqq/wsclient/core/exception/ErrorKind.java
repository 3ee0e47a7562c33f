package com.ryuqq.wsclient.core.exception;

/**
 * 클라이언트 오류 분류.
 *
 * <p>모든 {@link SoapClientException}은 하나의 ErrorKind를 가지며,
 * 호출자는 메시지 문자열이 아니라 kind로 분기합니다.</p>
 *
 * <pre>
 * try {
 *     client.finalizeInvocation();
 * } catch (SoapClientException e) {
 *     switch (e.kind()) {
 *         case VERIFICATION_FAILED -&gt; alertSecurityTeam(e);
 *         case NO_PENDING_INVOCATION -&gt; prepareAgain();
 *         default -&gt; throw e;
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /** Options were passed as a bare value (e.g. a WSDL URL string) instead of a mapping. */
    LEGACY_CALL_SHAPE,

    /** Neither a contract location nor endpoint + namespace were configured. */
    INSUFFICIENT_CONFIGURATION,

    /** An option key is not recognized or its value has the wrong type. */
    UNKNOWN_OPTION,

    /** Introspection was requested but no WSDL document was resolved. */
    MISSING_CONTRACT,

    /** A two-phase invocation was attempted without identifying what to invoke. */
    INVALID_ARGUMENT,

    /** Finalize was requested but nothing is pending (or the handle was already sent). */
    NO_PENDING_INVOCATION,

    /** The response signature could not be verified. */
    VERIFICATION_FAILED,

    /** The operation is not declared by the resolved WSDL document. */
    UNKNOWN_OPERATION,

    /** The WSDL document could not be loaded or parsed. */
    CONTRACT_LOAD_FAILED,

    /** The HTTP exchange failed before a response was received. */
    TRANSPORT_FAILED,

    /** The service answered with a SOAP fault. */
    SOAP_FAULT,

    /** The service answered with a non-2xx status and no SOAP fault. */
    HTTP_ERROR
}
