package com.ryuqq.wsclient.core.exception;

/**
 * The WSDL document could not be loaded or parsed.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ContractLoadException extends SoapClientException {

    public ContractLoadException(String message) {
        super(ErrorKind.CONTRACT_LOAD_FAILED, message);
    }

    public ContractLoadException(String message, Throwable cause) {
        super(ErrorKind.CONTRACT_LOAD_FAILED, message, cause);
    }
}
