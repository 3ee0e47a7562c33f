package com.ryuqq.wsclient.core.exception;

import com.ryuqq.wsclient.core.model.Response;

/**
 * 서비스가 2xx 이외의 상태 코드로 응답했고 SOAP Fault가 아닌 경우 ({@code raise_errors} 활성 시).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HttpErrorException extends SoapClientException {

    private final transient Response response;

    public HttpErrorException(Response response) {
        super(ErrorKind.HTTP_ERROR, "HTTP error (" + response.status() + ")");
        this.response = response;
    }

    public Response getResponse() {
        return response;
    }

    public int getStatus() {
        return response.status();
    }
}
