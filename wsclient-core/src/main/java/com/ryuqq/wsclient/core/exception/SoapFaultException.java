package com.ryuqq.wsclient.core.exception;

import com.ryuqq.wsclient.core.model.Response;
import com.ryuqq.wsclient.core.model.SoapFault;

/**
 * 서비스가 SOAP Fault로 응답한 경우 ({@code raise_errors} 활성 시).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SoapFaultException extends SoapClientException {

    private final transient Response response;
    private final SoapFault fault;

    public SoapFaultException(Response response, SoapFault fault) {
        super(ErrorKind.SOAP_FAULT, "(" + fault.code() + ") " + fault.reason());
        this.response = response;
        this.fault = fault;
    }

    public Response getResponse() {
        return response;
    }

    public SoapFault getFault() {
        return fault;
    }
}
