package com.ryuqq.wsclient.core.model;

import com.ryuqq.wsclient.core.config.SoapVersion;
import com.ryuqq.wsclient.core.xml.XmlDocuments;
import com.ryuqq.wsclient.core.xml.XmlParseException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * SOAP Fault 정보.
 *
 * <p>SOAP 1.1 ({@code faultcode}/{@code faultstring})과
 * SOAP 1.2 ({@code Code/Value}/{@code Reason/Text}) 형식을 모두 읽습니다.</p>
 *
 * @param code fault 코드 (예: soap:Server)
 * @param reason fault 설명
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SoapFault(String code, String reason) {

    /**
     * 응답 본문에서 Fault 추출.
     *
     * @param body 응답 본문
     * @return SoapFault 또는 Fault가 아니면 null (XML이 아닌 본문 포함)
     */
    public static SoapFault parseOrNull(String body) {
        if (body == null || !body.contains("Fault")) {
            return null;
        }
        Document document;
        try {
            document = XmlDocuments.parse(body);
        } catch (XmlParseException e) {
            return null;
        }
        Element envelope = document.getDocumentElement();
        if (envelope == null || !"Envelope".equals(envelope.getLocalName())) {
            return null;
        }
        Element soapBody = XmlDocuments.firstChildOrNull(envelope, "Body");
        Element fault = soapBody == null ? null : XmlDocuments.firstChildOrNull(soapBody, "Fault");
        if (fault == null) {
            return null;
        }
        if (SoapVersion.forEnvelopeNamespaceOrNull(envelope.getNamespaceURI()) == SoapVersion.SOAP_12) {
            Element code = XmlDocuments.firstChildOrNull(fault, "Code");
            Element reason = XmlDocuments.firstChildOrNull(fault, "Reason");
            return new SoapFault(
                code == null ? "" : nullToEmpty(XmlDocuments.childTextOrNull(code, "Value")),
                reason == null ? "" : nullToEmpty(XmlDocuments.childTextOrNull(reason, "Text")));
        }
        return new SoapFault(
            nullToEmpty(XmlDocuments.childTextOrNull(fault, "faultcode")),
            nullToEmpty(XmlDocuments.childTextOrNull(fault, "faultstring")));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
