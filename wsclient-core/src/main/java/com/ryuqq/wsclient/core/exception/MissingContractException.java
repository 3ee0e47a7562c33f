package com.ryuqq.wsclient.core.exception;

/**
 * WSDL 문서 없이 서비스 정보를 조회하려 한 경우.
 *
 * <p>해당 호출만 실패하며 클라이언트는 계속 사용할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MissingContractException extends SoapClientException {

    public MissingContractException(String message) {
        super(ErrorKind.MISSING_CONTRACT, message);
    }

    public MissingContractException(String message, Throwable cause) {
        super(ErrorKind.MISSING_CONTRACT, message, cause);
    }
}
