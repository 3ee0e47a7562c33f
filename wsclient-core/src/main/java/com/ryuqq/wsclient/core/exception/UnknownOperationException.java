package com.ryuqq.wsclient.core.exception;

import java.util.Set;

/**
 * WSDL 문서에 선언되지 않은 operation 호출.
 *
 * <p>Operation 생성 단계에서는 검증하지 않으며, 요청 빌더가 문서가 있는 계약에 대해서만 검사합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class UnknownOperationException extends SoapClientException {

    private final String operationName;
    private final Set<String> availableOperations;

    public UnknownOperationException(String operationName, Set<String> availableOperations) {
        super(ErrorKind.UNKNOWN_OPERATION,
            "Unable to find SOAP operation: " + operationName + "\n"
                + "Operations provided by your service: " + availableOperations);
        this.operationName = operationName;
        this.availableOperations = Set.copyOf(availableOperations);
    }

    public String getOperationName() {
        return operationName;
    }

    public Set<String> getAvailableOperations() {
        return availableOperations;
    }
}
