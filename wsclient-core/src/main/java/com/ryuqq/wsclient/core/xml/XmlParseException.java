package com.ryuqq.wsclient.core.xml;

/**
 * XML 파싱 실패.
 *
 * <p>어댑터는 상황에 맞는 {@code SoapClientException}으로 변환합니다
 * (예: WSDL 파싱 실패 → ContractLoadException).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class XmlParseException extends RuntimeException {

    public XmlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
