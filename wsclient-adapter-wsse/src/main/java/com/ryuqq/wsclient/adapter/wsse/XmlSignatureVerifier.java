package com.ryuqq.wsclient.adapter.wsse;

import com.ryuqq.wsclient.core.exception.SignatureVerificationException;
import com.ryuqq.wsclient.core.spi.SignatureVerifier;
import com.ryuqq.wsclient.core.xml.XmlDocuments;
import com.ryuqq.wsclient.core.xml.XmlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.crypto.MarshalException;
import javax.xml.crypto.dsig.Reference;
import javax.xml.crypto.dsig.XMLSignature;
import javax.xml.crypto.dsig.XMLSignatureException;
import javax.xml.crypto.dsig.XMLSignatureFactory;
import javax.xml.crypto.dsig.dom.DOMValidateContext;
import java.util.ArrayList;
import java.util.List;

/**
 * XML Digital Signature 기반 응답 검증기.
 *
 * <p><strong>검증 절차:</strong></p>
 * <ol>
 *   <li>응답 본문 파싱 (XML이 아니면 실패)</li>
 *   <li>{@code Id}, {@code wsu:Id} 속성을 ID로 등록 (참조 URI 해석용)</li>
 *   <li>모든 {@code ds:Signature} 요소를 검증 (하나도 없으면 실패)</li>
 * </ol>
 *
 * <p>검증 키는 {@link SecurityTokenKeySelector}가 KeyInfo에서 선택합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class XmlSignatureVerifier implements SignatureVerifier {

    public static final String WSU_NAMESPACE =
        "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-utility-1.0.xsd";

    private static final Logger log = LoggerFactory.getLogger(XmlSignatureVerifier.class);

    private final XMLSignatureFactory signatureFactory;

    public XmlSignatureVerifier() {
        this.signatureFactory = XMLSignatureFactory.getInstance("DOM");
    }

    @Override
    public void verify(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new SignatureVerificationException("Response body is empty, nothing to verify");
        }
        Document document;
        try {
            document = XmlDocuments.parse(responseBody);
        } catch (XmlParseException e) {
            throw new SignatureVerificationException("Response is not well-formed XML: " + e.getMessage(), e);
        }
        registerIds(document.getDocumentElement());

        NodeList signatures = document.getElementsByTagNameNS(XMLSignature.XMLNS, "Signature");
        if (signatures.getLength() == 0) {
            throw new SignatureVerificationException("Response does not contain an XML signature");
        }
        for (int i = 0; i < signatures.getLength(); i++) {
            validate((Element) signatures.item(i), document);
        }
        log.debug("Verified {} XML signature(s)", signatures.getLength());
    }

    private void validate(Element signatureElement, Document document) {
        DOMValidateContext context = new DOMValidateContext(new SecurityTokenKeySelector(document), signatureElement);
        context.setProperty("org.jcp.xml.dsig.secureValidation", Boolean.TRUE);
        try {
            XMLSignature signature = signatureFactory.unmarshalXMLSignature(context);
            if (!signature.validate(context)) {
                throw new SignatureVerificationException("XML signature is invalid" + failureDetails(signature, context));
            }
        } catch (MarshalException | XMLSignatureException e) {
            throw new SignatureVerificationException("Unable to validate XML signature: " + e.getMessage(), e);
        }
    }

    private static String failureDetails(XMLSignature signature, DOMValidateContext context)
            throws XMLSignatureException {
        List<String> failed = new ArrayList<>();
        if (!signature.getSignatureValue().validate(context)) {
            failed.add("SignatureValue");
        }
        for (Object item : signature.getSignedInfo().getReferences()) {
            Reference reference = (Reference) item;
            if (!reference.validate(context)) {
                failed.add("Reference(" + reference.getURI() + ")");
            }
        }
        return failed.isEmpty() ? "" : " (failed: " + String.join(", ", failed) + ")";
    }

    static void registerIds(Element element) {
        if (element.hasAttributeNS(null, "Id")) {
            element.setIdAttributeNS(null, "Id", true);
        }
        if (element.hasAttributeNS(WSU_NAMESPACE, "Id")) {
            element.setIdAttributeNS(WSU_NAMESPACE, "Id", true);
        }
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                registerIds((Element) child);
            }
        }
    }
}
