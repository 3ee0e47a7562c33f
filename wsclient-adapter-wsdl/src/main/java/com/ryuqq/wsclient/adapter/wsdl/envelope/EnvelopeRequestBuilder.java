package com.ryuqq.wsclient.adapter.wsdl.envelope;

import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.config.SoapVersion;
import com.ryuqq.wsclient.core.exception.UnknownOperationException;
import com.ryuqq.wsclient.core.model.Contract;
import com.ryuqq.wsclient.core.model.Locals;
import com.ryuqq.wsclient.core.model.Operation;
import com.ryuqq.wsclient.core.model.OperationDescriptor;
import com.ryuqq.wsclient.core.model.PreparedRequest;
import com.ryuqq.wsclient.core.model.TransportState;
import com.ryuqq.wsclient.core.spi.RequestBuilder;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SOAP Envelope 기반 RequestBuilder.
 *
 * <p><strong>빌드 순서:</strong></p>
 * <ol>
 *   <li>문서가 있는 계약에 선언되지 않은 operation → UnknownOperationException</li>
 *   <li>Envelope 작성 (Header: soap header + WS-Security, Body: 메시지 요소)</li>
 *   <li>요소/속성 이름과 접두사가 XML 이름이 아니면 IllegalArgumentException (전송 전)</li>
 *   <li>SOAP HTTP 헤더 작성 (Content-Type, SOAPAction)</li>
 *   <li>locals 쿠키를 요청 전송 상태에 병합 (전역 헤더와 Cookie는 전송 시점에 계산)</li>
 * </ol>
 *
 * <p>Envelope은 XMLStreamWriter로 작성하며 텍스트와 속성 값의 이스케이프는 writer가 담당합니다.</p>
 *
 * <p>{@code xml} local이 지정되면 Envelope 대신 그 문자열을 본문으로 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EnvelopeRequestBuilder implements RequestBuilder {

    static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
    static final String XSD_NAMESPACE = "http://www.w3.org/2001/XMLSchema";

    private final WsseHeaderWriter wsseWriter;

    public EnvelopeRequestBuilder() {
        this(Clock.systemUTC());
    }

    public EnvelopeRequestBuilder(Clock clock) {
        this.wsseWriter = new WsseHeaderWriter(clock);
    }

    @Override
    public PreparedRequest build(Operation operation, Locals locals, TransportState transportState) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (transportState == null) {
            throw new IllegalArgumentException("transportState cannot be null");
        }
        Locals effective = locals == null ? Locals.empty() : locals;
        Contract contract = operation.getContract();
        if (contract.hasDocument() && !operation.isDeclared()) {
            throw new UnknownOperationException(operation.getName(), contract.operationNames());
        }
        URI endpoint = contract.getEndpointOrNull();
        if (endpoint == null) {
            throw new IllegalStateException("No SOAP endpoint available for operation " + operation.getName());
        }

        ClientOptions options = transportState.options();
        OperationDescriptor descriptor = operation.getDescriptorOrNull();
        String body = effective.xml().orElseGet(() -> envelope(operation, descriptor, effective, transportState));

        Map<String, String> headers = new LinkedHashMap<>();
        String soapAction = effective.soapAction()
            .orElse(descriptor != null ? descriptor.soapAction() : operation.getName());
        SoapVersion version = options.soapVersion();
        if (version == SoapVersion.SOAP_12) {
            headers.put("Content-Type", version.mediaType() + ";charset=" + options.encoding()
                + ";action=\"" + soapAction + "\"");
        } else {
            headers.put("Content-Type", version.mediaType() + ";charset=" + options.encoding());
            headers.put("SOAPAction", "\"" + soapAction + "\"");
        }
        transportState.http().setCookies(effective.cookies());
        return new PreparedRequest(operation, endpoint, headers, body, transportState);
    }

    private String envelope(Operation operation, OperationDescriptor descriptor, Locals locals,
                            TransportState transportState) {
        StringWriter buffer = new StringWriter();
        try {
            XMLStreamWriter out = XMLOutputFactory.newFactory().createXMLStreamWriter(buffer);
            writeEnvelope(out, operation, descriptor, locals, transportState);
            out.flush();
            out.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Unable to write SOAP envelope for operation " + operation.getName(), e);
        }
        return buffer.toString();
    }

    private void writeEnvelope(XMLStreamWriter out, Operation operation, OperationDescriptor descriptor,
                               Locals locals, TransportState transportState) throws XMLStreamException {
        ClientOptions options = transportState.options();
        String env = XmlNames.requirePrefix(options.envNamespace());
        String tns = XmlNames.requirePrefix(options.namespaceIdentifier());
        String namespace = operation.getContract().getTargetNamespaceOrNull();
        XmlMessageWriter writer = new XmlMessageWriter(options.keyConverter());

        String tag = locals.messageTag()
            .orElse(descriptor != null ? descriptor.inputElement() : operation.getName());
        String qualified = XmlNames.requireQualifiedName(namespace != null ? tns + ":" + tag : tag);
        for (String attribute : locals.attributes().keySet()) {
            XmlNames.requireQualifiedName(attribute);
        }

        out.writeStartDocument(options.encoding(), "1.0");
        out.writeStartElement(env + ":Envelope");
        out.writeNamespace("xsd", XSD_NAMESPACE);
        out.writeNamespace("xsi", XSI_NAMESPACE);
        if (namespace != null) {
            out.writeNamespace(tns, namespace);
        }
        out.writeNamespace(env, options.soapVersion().envelopeNamespace());

        Map<String, Object> soapHeader = new LinkedHashMap<>(options.soapHeader());
        soapHeader.putAll(locals.soapHeader());
        if (!soapHeader.isEmpty() || wsseWriter.isRequired(transportState.wsse())) {
            out.writeStartElement(env + ":Header");
            writer.write(out, soapHeader);
            wsseWriter.write(out, transportState.wsse());
            out.writeEndElement();
        }

        out.writeStartElement(env + ":Body");
        out.writeStartElement(qualified);
        for (Map.Entry<String, String> attribute : locals.attributes().entrySet()) {
            out.writeAttribute(attribute.getKey(), attribute.getValue());
        }
        writer.write(out, locals.message());
        out.writeEndElement();
        out.writeEndElement();
        out.writeEndElement();
        out.writeEndDocument();
    }
}
