package com.ryuqq.wsclient.core.xml;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM 파싱 유틸리티.
 *
 * <p>네임스페이스를 인식하며 DOCTYPE 선언을 거부합니다 (XXE 차단).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class XmlDocuments {

    private XmlDocuments() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * XML 문자열 파싱.
     *
     * @param xml XML 문자열
     * @return DOM Document
     * @throws XmlParseException 파싱 실패 시
     */
    public static Document parse(String xml) {
        if (xml == null) {
            throw new IllegalArgumentException("xml cannot be null");
        }
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new XmlParseException("Unable to parse XML: " + e.getMessage(), e);
        }
    }

    /**
     * 보안 설정이 적용된 DocumentBuilderFactory.
     *
     * @return namespace-aware factory
     */
    public static DocumentBuilderFactory newFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }

    /**
     * 네임스페이스와 무관하게 로컬 이름으로 자식 요소 조회.
     *
     * @param parent 부모 요소
     * @param localName 로컬 이름
     * @return 자식 요소 목록 (문서 순서)
     */
    public static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(node.getLocalName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /**
     * 첫 번째 자식 요소 조회.
     *
     * @param parent 부모 요소
     * @param localName 로컬 이름
     * @return 자식 요소 또는 null
     */
    public static Element firstChildOrNull(Element parent, String localName) {
        List<Element> children = children(parent, localName);
        return children.isEmpty() ? null : children.get(0);
    }

    /**
     * 자식 요소의 텍스트 (앞뒤 공백 제거).
     *
     * @param parent 부모 요소
     * @param localName 로컬 이름
     * @return 텍스트 또는 null
     */
    public static String childTextOrNull(Element parent, String localName) {
        Element child = firstChildOrNull(parent, localName);
        return child == null ? null : child.getTextContent().trim();
    }

    /**
     * QName 문자열({@code tns:Ping})의 로컬 이름.
     *
     * @param qualifiedName 접두사 포함 이름
     * @return 로컬 이름
     */
    public static String localPart(String qualifiedName) {
        if (qualifiedName == null) {
            return null;
        }
        int colon = qualifiedName.indexOf(':');
        return colon < 0 ? qualifiedName : qualifiedName.substring(colon + 1);
    }
}
