package com.ryuqq.wsclient.adapter.wsse;

import com.ryuqq.wsclient.core.xml.XmlDocuments;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import javax.xml.crypto.AlgorithmMethod;
import javax.xml.crypto.KeySelector;
import javax.xml.crypto.KeySelectorException;
import javax.xml.crypto.KeySelectorResult;
import javax.xml.crypto.XMLCryptoContext;
import javax.xml.crypto.dom.DOMStructure;
import javax.xml.crypto.dsig.keyinfo.KeyInfo;
import javax.xml.crypto.dsig.keyinfo.KeyValue;
import javax.xml.crypto.dsig.keyinfo.X509Data;
import java.io.ByteArrayInputStream;
import java.security.Key;
import java.security.KeyException;
import java.security.PublicKey;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Base64;

/**
 * KeyInfo에서 검증 키 선택.
 *
 * <p>지원 형식: {@code KeyValue}, {@code X509Data}의 인증서,
 * WS-Security {@code SecurityTokenReference} → {@code BinarySecurityToken} (X.509).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class SecurityTokenKeySelector extends KeySelector {

    private final Document document;

    SecurityTokenKeySelector(Document document) {
        this.document = document;
    }

    @Override
    public KeySelectorResult select(KeyInfo keyInfo, Purpose purpose, AlgorithmMethod method,
                                    XMLCryptoContext context) throws KeySelectorException {
        if (keyInfo == null) {
            throw new KeySelectorException("Signature has no KeyInfo");
        }
        for (Object item : keyInfo.getContent()) {
            if (item instanceof KeyValue) {
                try {
                    return result(((KeyValue) item).getPublicKey());
                } catch (KeyException e) {
                    throw new KeySelectorException("Unable to read KeyValue: " + e.getMessage(), e);
                }
            }
            if (item instanceof X509Data) {
                for (Object data : ((X509Data) item).getContent()) {
                    if (data instanceof X509Certificate) {
                        return result(((X509Certificate) data).getPublicKey());
                    }
                }
            }
            if (item instanceof DOMStructure) {
                Node node = ((DOMStructure) item).getNode();
                if (node instanceof Element && "SecurityTokenReference".equals(node.getLocalName())) {
                    return result(resolveSecurityToken((Element) node));
                }
            }
        }
        throw new KeySelectorException("No supported key found in KeyInfo");
    }

    private PublicKey resolveSecurityToken(Element reference) throws KeySelectorException {
        Element target = XmlDocuments.firstChildOrNull(reference, "Reference");
        String uri = target == null ? "" : target.getAttribute("URI");
        if (!uri.startsWith("#")) {
            throw new KeySelectorException("Unsupported SecurityTokenReference: " + uri);
        }
        Element token = document.getElementById(uri.substring(1));
        if (token == null || !"BinarySecurityToken".equals(token.getLocalName())) {
            throw new KeySelectorException("BinarySecurityToken not found: " + uri);
        }
        try {
            byte[] encoded = Base64.getMimeDecoder().decode(token.getTextContent().trim());
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            X509Certificate certificate =
                (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(encoded));
            return certificate.getPublicKey();
        } catch (CertificateException | IllegalArgumentException e) {
            throw new KeySelectorException("Invalid BinarySecurityToken: " + e.getMessage(), e);
        }
    }

    private static KeySelectorResult result(PublicKey key) {
        return new KeySelectorResult() {
            @Override
            public Key getKey() {
                return key;
            }
        };
    }
}
