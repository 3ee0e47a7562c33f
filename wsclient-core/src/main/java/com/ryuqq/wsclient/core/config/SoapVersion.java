package com.ryuqq.wsclient.core.config;

/**
 * SOAP 프로토콜 버전.
 *
 * <p>버전에 따라 Envelope 네임스페이스와 Content-Type이 달라집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SoapVersion {

    SOAP_11(1, "http://schemas.xmlsoap.org/soap/envelope/", "text/xml"),
    SOAP_12(2, "http://www.w3.org/2003/05/soap-envelope", "application/soap+xml");

    private final int number;
    private final String envelopeNamespace;
    private final String mediaType;

    SoapVersion(int number, String envelopeNamespace, String mediaType) {
        this.number = number;
        this.envelopeNamespace = envelopeNamespace;
        this.mediaType = mediaType;
    }

    /**
     * 버전 번호로 조회 (1 또는 2).
     *
     * @param number 버전 번호
     * @return SoapVersion
     * @throws IllegalArgumentException 1, 2 이외의 값인 경우
     */
    public static SoapVersion of(int number) {
        for (SoapVersion version : values()) {
            if (version.number == number) {
                return version;
            }
        }
        throw new IllegalArgumentException("Invalid SOAP version: " + number + " (expected 1 or 2)");
    }

    /**
     * Envelope 네임스페이스로 조회.
     *
     * @param namespaceUri 네임스페이스 URI
     * @return 일치하는 버전 또는 null
     */
    public static SoapVersion forEnvelopeNamespaceOrNull(String namespaceUri) {
        for (SoapVersion version : values()) {
            if (version.envelopeNamespace.equals(namespaceUri)) {
                return version;
            }
        }
        return null;
    }

    public int number() {
        return number;
    }

    public String envelopeNamespace() {
        return envelopeNamespace;
    }

    public String mediaType() {
        return mediaType;
    }
}
