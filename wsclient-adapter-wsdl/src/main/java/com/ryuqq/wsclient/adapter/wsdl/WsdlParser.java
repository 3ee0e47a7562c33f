package com.ryuqq.wsclient.adapter.wsdl;

import com.ryuqq.wsclient.core.exception.ContractLoadException;
import com.ryuqq.wsclient.core.model.OperationDescriptor;
import com.ryuqq.wsclient.core.xml.XmlDocuments;
import com.ryuqq.wsclient.core.xml.XmlParseException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * WSDL 1.1 문서 파서 (DOM).
 *
 * <p><strong>추출 항목:</strong></p>
 * <ul>
 *   <li>targetNamespace: definitions 속성</li>
 *   <li>serviceName: 첫 번째 service 요소</li>
 *   <li>endpoint: 첫 번째 soap/soap12 address@location</li>
 *   <li>operations: binding operation + soapAction + 입력 요소 이름</li>
 * </ul>
 *
 * <p>입력 요소 이름은 portType → message → part@element 경로로 찾고,
 * 찾지 못하면 operation 이름을 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WsdlParser {

    /**
     * WSDL 파싱.
     *
     * @param xml WSDL 문서
     * @return WsdlDocument
     * @throws ContractLoadException XML이 아니거나 definitions 요소가 아닌 경우
     */
    public WsdlDocument parse(String xml) {
        Document document;
        try {
            document = XmlDocuments.parse(xml);
        } catch (XmlParseException e) {
            throw new ContractLoadException("Unable to parse WSDL document: " + e.getMessage(), e);
        }
        Element definitions = document.getDocumentElement();
        if (definitions == null || !"definitions".equals(definitions.getLocalName())) {
            throw new ContractLoadException("Not a WSDL document: expected <definitions> root element");
        }

        String targetNamespace = emptyToNull(definitions.getAttribute("targetNamespace"));
        Map<String, String> inputElements = inputElements(definitions);

        Map<String, OperationDescriptor> operations = new LinkedHashMap<>();
        for (Element binding : XmlDocuments.children(definitions, "binding")) {
            for (Element operation : XmlDocuments.children(binding, "operation")) {
                String name = operation.getAttribute("name");
                if (name.isBlank() || operations.containsKey(name)) {
                    continue;
                }
                Element soapOperation = XmlDocuments.firstChildOrNull(operation, "operation");
                String soapAction = soapOperation == null ? "" : soapOperation.getAttribute("soapAction");
                operations.put(name, new OperationDescriptor(name, soapAction,
                    inputElements.getOrDefault(name, name)));
            }
        }
        if (operations.isEmpty()) {
            for (String name : inputElements.keySet()) {
                operations.put(name, new OperationDescriptor(name, "", inputElements.get(name)));
            }
        }

        String serviceName = null;
        URI endpoint = null;
        List<Element> services = XmlDocuments.children(definitions, "service");
        if (!services.isEmpty()) {
            Element service = services.get(0);
            serviceName = emptyToNull(service.getAttribute("name"));
            endpoint = firstAddress(service);
        }
        return new WsdlDocument(targetNamespace, serviceName, endpoint, new ArrayList<>(operations.values()));
    }

    private static Map<String, String> inputElements(Element definitions) {
        Map<String, String> partElements = new LinkedHashMap<>();
        for (Element message : XmlDocuments.children(definitions, "message")) {
            Element part = XmlDocuments.firstChildOrNull(message, "part");
            if (part != null && !part.getAttribute("element").isBlank()) {
                partElements.put(message.getAttribute("name"), XmlDocuments.localPart(part.getAttribute("element")));
            }
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Element portType : XmlDocuments.children(definitions, "portType")) {
            for (Element operation : XmlDocuments.children(portType, "operation")) {
                String name = operation.getAttribute("name");
                Element input = XmlDocuments.firstChildOrNull(operation, "input");
                String messageName = input == null ? "" : XmlDocuments.localPart(input.getAttribute("message"));
                result.putIfAbsent(name, partElements.getOrDefault(messageName, name));
            }
        }
        return result;
    }

    private static URI firstAddress(Element service) {
        for (Element port : XmlDocuments.children(service, "port")) {
            Element address = XmlDocuments.firstChildOrNull(port, "address");
            if (address != null && !address.getAttribute("location").isBlank()) {
                String location = address.getAttribute("location").trim();
                try {
                    return new URI(location);
                } catch (URISyntaxException e) {
                    throw new ContractLoadException("Invalid SOAP address location: " + location, e);
                }
            }
        }
        return null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
