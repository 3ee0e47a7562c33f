package com.ryuqq.wsclient.core.model;

import java.net.URI;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 해석된 서비스 계약 (WSDL 메타데이터).
 *
 * <p>클라이언트 생성 시 한 번 동기적으로 만들어지며, 클라이언트 수명 동안 다시 해석되지 않습니다.</p>
 *
 * <p><strong>두 가지 형태:</strong></p>
 * <ul>
 *   <li><strong>문서 있음:</strong> WSDL에서 operation 목록, 서비스 이름, 네임스페이스, endpoint를 읽음</li>
 *   <li><strong>문서 없음:</strong> endpoint + namespace 옵션만으로 구성, operation 목록 없음</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Contract {

    private final boolean documentPresent;
    private final Map<String, OperationDescriptor> operations;
    private final String serviceName;
    private final String targetNamespace;
    private final URI endpoint;
    private final String adapter;

    private Contract(boolean documentPresent, Map<String, OperationDescriptor> operations,
                     String serviceName, String targetNamespace, URI endpoint, String adapter) {
        this.documentPresent = documentPresent;
        this.operations = Collections.unmodifiableMap(operations);
        this.serviceName = serviceName;
        this.targetNamespace = targetNamespace;
        this.endpoint = endpoint;
        this.adapter = adapter;
    }

    /**
     * 문서 없는 계약 생성.
     *
     * @param endpoint 서비스 주소 (null 가능)
     * @param targetNamespace 대상 네임스페이스 (null 가능)
     * @param adapter 전송 어댑터 이름 (null 가능)
     * @return Contract (hasDocument = false)
     */
    public static Contract withoutDocument(URI endpoint, String targetNamespace, String adapter) {
        return new Contract(false, new LinkedHashMap<>(), null, targetNamespace, endpoint, adapter);
    }

    /**
     * WSDL 문서에서 해석된 계약 생성.
     *
     * @param operations 선언된 operation 목록 (선언 순서 유지)
     * @param serviceName 서비스 이름 (null 가능)
     * @param targetNamespace 대상 네임스페이스 (null 가능)
     * @param endpoint 서비스 주소 (null 가능)
     * @param adapter 전송 어댑터 이름 (null 가능)
     * @return Contract (hasDocument = true)
     * @throws IllegalArgumentException operations가 null인 경우
     */
    public static Contract documented(Collection<OperationDescriptor> operations, String serviceName,
                                      String targetNamespace, URI endpoint, String adapter) {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        Map<String, OperationDescriptor> byName = new LinkedHashMap<>();
        for (OperationDescriptor descriptor : operations) {
            byName.put(descriptor.name(), descriptor);
        }
        return new Contract(true, byName, serviceName, targetNamespace, endpoint, adapter);
    }

    public boolean hasDocument() {
        return documentPresent;
    }

    /**
     * 선언된 operation 이름 목록.
     *
     * @return 수정 불가능한 이름 집합 (선언 순서)
     */
    public Set<String> operationNames() {
        return operations.keySet();
    }

    public Optional<OperationDescriptor> findOperation(String name) {
        return Optional.ofNullable(operations.get(name));
    }

    public String getServiceNameOrNull() {
        return serviceName;
    }

    public String getTargetNamespaceOrNull() {
        return targetNamespace;
    }

    public URI getEndpointOrNull() {
        return endpoint;
    }

    public String getAdapterOrNull() {
        return adapter;
    }

    @Override
    public String toString() {
        return "Contract{document=" + documentPresent
            + ", service=" + serviceName
            + ", namespace=" + targetNamespace
            + ", endpoint=" + endpoint
            + ", operations=" + operations.keySet() + "}";
    }
}
