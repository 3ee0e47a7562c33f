package com.ryuqq.wsclient.core.model;

/**
 * WSDL에 선언된 operation 정보.
 *
 * @param name operation 이름 (예: Ping)
 * @param soapAction SOAPAction 값 (빈 문자열 가능)
 * @param inputElement 요청 본문 최상위 요소의 로컬 이름
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OperationDescriptor(String name, String soapAction, String inputElement) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException name이 null/blank인 경우
     */
    public OperationDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (soapAction == null) {
            soapAction = "";
        }
        if (inputElement == null || inputElement.isBlank()) {
            inputElement = name;
        }
    }

    public static OperationDescriptor of(String name) {
        return new OperationDescriptor(name, "", name);
    }
}
