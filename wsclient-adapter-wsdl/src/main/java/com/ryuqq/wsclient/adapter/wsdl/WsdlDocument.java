package com.ryuqq.wsclient.adapter.wsdl;

import com.ryuqq.wsclient.core.model.OperationDescriptor;

import java.net.URI;
import java.util.List;

/**
 * 파싱된 WSDL 문서 요약.
 *
 * @param targetNamespace definitions@targetNamespace (nullable)
 * @param serviceName 첫 번째 service 이름 (nullable)
 * @param endpoint soap:address 위치 (nullable)
 * @param operations 바인딩에 선언된 operation 목록 (문서 순서)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WsdlDocument(
    String targetNamespace,
    String serviceName,
    URI endpoint,
    List<OperationDescriptor> operations
) {

    public WsdlDocument {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        operations = List.copyOf(operations);
    }
}
