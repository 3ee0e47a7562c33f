package com.ryuqq.wsclient.adapter.wsdl.envelope;

import com.ryuqq.wsclient.core.config.KeyConverter;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.util.Collection;
import java.util.Map;

/**
 * Map 메시지를 XML 요소로 변환.
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>키는 KeyConverter로 변환, {@code !}로 끝나는 키는 그대로 사용 ({@code !} 제거)</li>
 *   <li>접두사가 있는 키({@code tns:foo})는 로컬 이름만 변환</li>
 *   <li>변환된 이름이 XML 이름이 아니면 IllegalArgumentException</li>
 *   <li>Map 값 → 중첩 요소, Collection 값 → 반복 요소</li>
 *   <li>null 값 → {@code xsi:nil="true"}</li>
 *   <li>그 외 값 → 텍스트 (이스케이프는 XMLStreamWriter가 수행)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class XmlMessageWriter {

    private final KeyConverter keyConverter;

    public XmlMessageWriter(KeyConverter keyConverter) {
        if (keyConverter == null) {
            throw new IllegalArgumentException("keyConverter cannot be null");
        }
        this.keyConverter = keyConverter;
    }

    /**
     * 메시지를 XML 조각 문자열로 작성.
     *
     * @param message 메시지 (nullable)
     * @return 루트 없는 XML 조각
     * @throws IllegalArgumentException 키가 XML 이름으로 변환되지 않는 경우
     */
    public String write(Map<?, ?> message) {
        StringWriter buffer = new StringWriter();
        try {
            XMLStreamWriter out = XMLOutputFactory.newFactory().createXMLStreamWriter(buffer);
            write(out, message);
            out.flush();
            out.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Unable to write XML message", e);
        }
        return buffer.toString();
    }

    /**
     * 열린 XMLStreamWriter에 메시지 요소 작성.
     *
     * @param out 대상 writer
     * @param message 메시지 (nullable)
     * @throws XMLStreamException 작성 실패
     * @throws IllegalArgumentException 키가 XML 이름으로 변환되지 않는 경우
     */
    public void write(XMLStreamWriter out, Map<?, ?> message) throws XMLStreamException {
        if (message == null) {
            return;
        }
        for (Map.Entry<?, ?> entry : message.entrySet()) {
            writeElement(out, elementName(String.valueOf(entry.getKey())), entry.getValue());
        }
    }

    String elementName(String key) {
        String name;
        if (key.endsWith("!")) {
            name = key.substring(0, key.length() - 1);
        } else {
            int colon = key.indexOf(':');
            name = colon >= 0
                ? key.substring(0, colon + 1) + keyConverter.convert(key.substring(colon + 1))
                : keyConverter.convert(key);
        }
        return XmlNames.requireQualifiedName(name);
    }

    private void writeElement(XMLStreamWriter out, String name, Object value) throws XMLStreamException {
        if (value == null) {
            out.writeEmptyElement(name);
            out.writeAttribute("xsi:nil", "true");
        } else if (value instanceof Map) {
            out.writeStartElement(name);
            write(out, (Map<?, ?>) value);
            out.writeEndElement();
        } else if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                writeElement(out, name, item);
            }
        } else {
            out.writeStartElement(name);
            out.writeCharacters(String.valueOf(value));
            out.writeEndElement();
        }
    }
}
