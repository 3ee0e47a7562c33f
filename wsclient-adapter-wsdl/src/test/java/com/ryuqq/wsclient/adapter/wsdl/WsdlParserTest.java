package com.ryuqq.wsclient.adapter.wsdl;

import com.ryuqq.wsclient.core.exception.ContractLoadException;
import com.ryuqq.wsclient.core.exception.ErrorKind;
import com.ryuqq.wsclient.core.model.OperationDescriptor;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WsdlParser 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WsdlParserTest {

    private final WsdlParser parser = new WsdlParser();

    @Test
    void 서비스_정보와_operation_추출() {
        // given
        String wsdl = new LocalDocumentLoader().load("classpath:wsdl/ping.wsdl", null);

        // when
        WsdlDocument document = parser.parse(wsdl);

        // then
        assertThat(document.targetNamespace()).isEqualTo("urn:example:ping");
        assertThat(document.serviceName()).isEqualTo("PingService");
        assertThat(document.endpoint()).isEqualTo(URI.create("http://localhost:8080/ping"));
        assertThat(document.operations()).containsExactly(
            new OperationDescriptor("Ping", "urn:example:ping#Ping", "PingRequest"),
            new OperationDescriptor("Status", "", "StatusRequest"));
    }

    @Test
    void part_element가_없으면_operation_이름을_입력_요소로_사용() {
        // given
        String wsdl = "<definitions xmlns=\"http://schemas.xmlsoap.org/wsdl/\""
            + " xmlns:soap12=\"http://schemas.xmlsoap.org/wsdl/soap12/\" targetNamespace=\"urn:rpc\">"
            + "<message name=\"AddInput\"><part name=\"a\" type=\"xsd:int\"/></message>"
            + "<portType name=\"Calc\"><operation name=\"Add\"><input message=\"AddInput\"/></operation></portType>"
            + "<binding name=\"CalcBinding\" type=\"Calc\"><operation name=\"Add\">"
            + "<soap12:operation soapAction=\"urn:rpc#Add\"/></operation></binding>"
            + "<service name=\"CalcService\"><port name=\"CalcPort\" binding=\"CalcBinding\">"
            + "<soap12:address location=\"https://calc.example/soap\"/></port></service>"
            + "</definitions>";

        // when
        WsdlDocument document = parser.parse(wsdl);

        // then
        assertThat(document.operations()).containsExactly(new OperationDescriptor("Add", "urn:rpc#Add", "Add"));
        assertThat(document.endpoint()).isEqualTo(URI.create("https://calc.example/soap"));
    }

    @Test
    void service가_없는_문서() {
        // given
        String wsdl = "<definitions xmlns=\"http://schemas.xmlsoap.org/wsdl/\">"
            + "<portType name=\"P\"><operation name=\"Echo\"/></portType></definitions>";

        // when
        WsdlDocument document = parser.parse(wsdl);

        // then
        assertThat(document.serviceName()).isNull();
        assertThat(document.endpoint()).isNull();
        assertThat(document.targetNamespace()).isNull();
        assertThat(document.operations()).extracting(OperationDescriptor::name).containsExactly("Echo");
    }

    @Test
    void XML이_아니면_ContractLoadException() {
        assertThatThrownBy(() -> parser.parse("not xml"))
            .isInstanceOf(ContractLoadException.class)
            .hasMessageContaining("Unable to parse WSDL document")
            .satisfies(e -> assertThat(((ContractLoadException) e).kind()).isEqualTo(ErrorKind.CONTRACT_LOAD_FAILED));
    }

    @Test
    void definitions_루트가_아니면_ContractLoadException() {
        assertThatThrownBy(() -> parser.parse("<html><body/></html>"))
            .isInstanceOf(ContractLoadException.class)
            .hasMessageContaining("Not a WSDL document");
    }
}
