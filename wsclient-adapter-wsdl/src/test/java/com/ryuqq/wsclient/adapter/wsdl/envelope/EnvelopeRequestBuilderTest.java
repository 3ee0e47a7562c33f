package com.ryuqq.wsclient.adapter.wsdl.envelope;

import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.config.Credentials;
import com.ryuqq.wsclient.core.config.KeyConverter;
import com.ryuqq.wsclient.core.config.SoapVersion;
import com.ryuqq.wsclient.core.exception.ErrorKind;
import com.ryuqq.wsclient.core.exception.UnknownOperationException;
import com.ryuqq.wsclient.core.model.Contract;
import com.ryuqq.wsclient.core.model.Cookie;
import com.ryuqq.wsclient.core.model.Locals;
import com.ryuqq.wsclient.core.model.Operation;
import com.ryuqq.wsclient.core.model.OperationDescriptor;
import com.ryuqq.wsclient.core.model.PreparedRequest;
import com.ryuqq.wsclient.core.model.TransportState;
import com.ryuqq.wsclient.core.xml.XmlDocuments;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EnvelopeRequestBuilder 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EnvelopeRequestBuilderTest {

    private static final URI ENDPOINT = URI.create("http://svc.example/ping");

    private final EnvelopeRequestBuilder builder =
        new EnvelopeRequestBuilder(Clock.fixed(Instant.parse("2026-01-15T10:20:30Z"), ZoneOffset.UTC));

    private final Contract documented = Contract.documented(
        List.of(new OperationDescriptor("Ping", "urn:example:ping#Ping", "PingRequest")),
        "PingService", "urn:example:ping", ENDPOINT, null);

    private static ClientOptions.Builder options() {
        return ClientOptions.builder().contractLocation("ping.wsdl");
    }

    @Test
    void SOAP11_envelope과_헤더() {
        // given
        ClientOptions options = options().build();
        Operation operation = Operation.create("Ping", documented, options);

        // when
        PreparedRequest request = builder.build(operation,
            Locals.message(Map.of("message", "hello")), TransportState.from(options));

        // then
        assertThat(request.getEndpoint()).isEqualTo(ENDPOINT);
        assertThat(request.getHeaders())
            .containsEntry("Content-Type", "text/xml;charset=UTF-8")
            .containsEntry("SOAPAction", "\"urn:example:ping#Ping\"")
            .doesNotContainKey("Cookie");

        Document document = XmlDocuments.parse(request.getBody());
        Element envelope = document.getDocumentElement();
        assertThat(envelope.getLocalName()).isEqualTo("Envelope");
        assertThat(envelope.getNamespaceURI()).isEqualTo(SoapVersion.SOAP_11.envelopeNamespace());
        assertThat(envelope.getPrefix()).isEqualTo("env");
        assertThat(XmlDocuments.firstChildOrNull(envelope, "Header")).isNull();
        Element body = XmlDocuments.firstChildOrNull(envelope, "Body");
        Element message = XmlDocuments.firstChildOrNull(body, "PingRequest");
        assertThat(message.getNamespaceURI()).isEqualTo("urn:example:ping");
        assertThat(XmlDocuments.childTextOrNull(message, "message")).isEqualTo("hello");
    }

    @Test
    void SOAP12는_Content_Type에_action() {
        // given
        ClientOptions options = options().soapVersion(SoapVersion.SOAP_12).build();
        Operation operation = Operation.create("Ping", documented, options);

        // when
        PreparedRequest request = builder.build(operation, Locals.empty(), TransportState.from(options));

        // then
        assertThat(request.getHeaders())
            .containsEntry("Content-Type", "application/soap+xml;charset=UTF-8;action=\"urn:example:ping#Ping\"")
            .doesNotContainKey("SOAPAction");
        assertThat(XmlDocuments.parse(request.getBody()).getDocumentElement().getNamespaceURI())
            .isEqualTo(SoapVersion.SOAP_12.envelopeNamespace());
    }

    @Test
    void 선언되지_않은_operation은_UnknownOperationException() {
        // given
        ClientOptions options = options().build();
        Operation operation = Operation.create("Missing", documented, options);

        // when & then
        assertThatThrownBy(() -> builder.build(operation, Locals.empty(), TransportState.from(options)))
            .isInstanceOf(UnknownOperationException.class)
            .satisfies(e -> {
                UnknownOperationException failure = (UnknownOperationException) e;
                assertThat(failure.kind()).isEqualTo(ErrorKind.UNKNOWN_OPERATION);
                assertThat(failure.getOperationName()).isEqualTo("Missing");
                assertThat(failure.getAvailableOperations()).containsExactly("Ping");
            });
    }

    @Test
    void 문서_없는_계약은_operation_이름을_태그와_SOAPAction으로() {
        // given
        ClientOptions options = ClientOptions.builder()
            .endpoint(ENDPOINT)
            .namespace("urn:plain")
            .namespaceIdentifier("ns1")
            .envNamespace("soapenv")
            .keyConverter(KeyConverter.CAMELCASE)
            .build();
        Contract contract = Contract.withoutDocument(ENDPOINT, "urn:plain", null);
        Operation operation = Operation.create("GetQuote", contract, options);

        // when
        PreparedRequest request = builder.build(operation,
            Locals.message(Map.of("ticker_symbol", "ACME")), TransportState.from(options));

        // then
        assertThat(request.getHeaders()).containsEntry("SOAPAction", "\"GetQuote\"");
        assertThat(request.getBody())
            .contains("<soapenv:Envelope")
            .contains("xmlns:ns1=\"urn:plain\"")
            .contains("<ns1:GetQuote><TickerSymbol>ACME</TickerSymbol></ns1:GetQuote>");
    }

    @Test
    void locals가_태그_SOAPAction_속성을_덮어씀() {
        // given
        ClientOptions options = options().build();
        Operation operation = Operation.create("Ping", documented, options);
        Locals locals = Locals.builder()
            .messageTag("CustomPing")
            .soapAction("urn:custom")
            .attribute("version", "2")
            .build();

        // when
        PreparedRequest request = builder.build(operation, locals, TransportState.from(options));

        // then
        assertThat(request.getHeaders()).containsEntry("SOAPAction", "\"urn:custom\"");
        assertThat(request.getBody()).contains("<tns:CustomPing version=\"2\"></tns:CustomPing>");
        Element body = XmlDocuments.firstChildOrNull(XmlDocuments.parse(request.getBody()).getDocumentElement(), "Body");
        assertThat(XmlDocuments.firstChildOrNull(body, "CustomPing").getAttribute("version")).isEqualTo("2");
    }

    @Test
    void 특수문자가_포함된_값과_속성은_이스케이프되어_파싱_가능() {
        // given
        ClientOptions options = options()
            .soapHeader(Map.of("Trace", "</Header><Injected/>"))
            .build();
        Operation operation = Operation.create("Ping", documented, options);
        Locals locals = Locals.builder()
            .attribute("note", "a\"b<c&d>'e")
            .message(Map.of("message", "<x/>&amp;\"q\""))
            .build();

        // when
        PreparedRequest request = builder.build(operation, locals, TransportState.from(options));

        // then
        Element envelope = XmlDocuments.parse(request.getBody()).getDocumentElement();
        Element header = XmlDocuments.firstChildOrNull(envelope, "Header");
        assertThat(XmlDocuments.childTextOrNull(header, "Trace")).isEqualTo("</Header><Injected/>");
        assertThat(XmlDocuments.firstChildOrNull(header, "Injected")).isNull();
        Element ping = XmlDocuments.firstChildOrNull(XmlDocuments.firstChildOrNull(envelope, "Body"), "PingRequest");
        assertThat(ping.getAttribute("note")).isEqualTo("a\"b<c&d>'e");
        assertThat(XmlDocuments.childTextOrNull(ping, "message")).isEqualTo("<x/>&amp;\"q\"");
        assertThat(XmlDocuments.children(ping, "x")).isEmpty();
    }

    @Test
    void XML_이름이_아닌_메시지_키는_IllegalArgumentException() {
        // given
        ClientOptions options = options().build();
        Operation operation = Operation.create("Ping", documented, options);
        Locals locals = Locals.message(Map.of("a><x/", "v"));

        // when & then
        assertThatThrownBy(() -> builder.build(operation, locals, TransportState.from(options)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Invalid XML name: a><x/");
    }

    @Test
    void XML_이름이_아닌_속성_태그_헤더_키는_IllegalArgumentException() {
        // given
        ClientOptions options = options().build();
        Operation operation = Operation.create("Ping", documented, options);

        // when & then
        assertThatThrownBy(() -> builder.build(operation,
            Locals.builder().attribute("x=\"1\" y", "2").build(), TransportState.from(options)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid XML name");
        assertThatThrownBy(() -> builder.build(operation,
            Locals.builder().messageTag("Ping><Evil").build(), TransportState.from(options)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid XML name");
        assertThatThrownBy(() -> builder.build(operation,
            Locals.builder().soapHeader(Map.of("Auth Token", "t")).build(), TransportState.from(options)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Invalid XML name: Auth Token");
    }

    @Test
    void soap_header_병합과_WS_Security() {
        // given
        ClientOptions options = options()
            .soapHeader(Map.of("AuthToken", "global", "Tenant", "t1"))
            .wsseAuth(Credentials.of("alice", "secret"), true)
            .wsseTimestamp(true)
            .build();
        Operation operation = Operation.create("Ping", documented, options);
        Locals locals = Locals.builder().soapHeader(Map.of("AuthToken", "local")).build();

        // when
        PreparedRequest request = builder.build(operation, locals, TransportState.from(options));

        // then
        Element envelope = XmlDocuments.parse(request.getBody()).getDocumentElement();
        Element header = XmlDocuments.firstChildOrNull(envelope, "Header");
        assertThat(XmlDocuments.childTextOrNull(header, "AuthToken")).isEqualTo("local");
        assertThat(XmlDocuments.childTextOrNull(header, "Tenant")).isEqualTo("t1");
        Element security = XmlDocuments.firstChildOrNull(header, "Security");
        assertThat(security.getNamespaceURI()).isEqualTo(WsseHeaderWriter.WSSE_NAMESPACE);
        Element token = XmlDocuments.firstChildOrNull(security, "UsernameToken");
        assertThat(XmlDocuments.childTextOrNull(token, "Username")).isEqualTo("alice");
        assertThat(XmlDocuments.firstChildOrNull(token, "Password").getAttribute("Type"))
            .isEqualTo(WsseHeaderWriter.PASSWORD_DIGEST_TYPE);
        assertThat(XmlDocuments.firstChildOrNull(token, "Nonce")).isNotNull();
        assertThat(XmlDocuments.childTextOrNull(token, "Created")).isEqualTo("2026-01-15T10:20:30Z");
        assertThat(XmlDocuments.firstChildOrNull(security, "Timestamp")).isNotNull();
    }

    @Test
    void 전역_헤더와_쿠키() {
        // given
        ClientOptions options = options().header("X-Tenant", "acme").build();
        TransportState state = TransportState.from(options);
        state.http().setCookies(List.of(Cookie.of("SESSION", "abc")));
        Operation operation = Operation.create("Ping", documented, options);
        Locals locals = Locals.builder().cookies(List.of(Cookie.of("LB", "node2"))).build();

        // when
        PreparedRequest request = builder.build(operation, locals, state);

        // then
        assertThat(request.getHeaders()).doesNotContainKeys("X-Tenant", "Cookie");
        assertThat(request.resolveHeaders())
            .containsEntry("X-Tenant", "acme")
            .containsEntry("Cookie", "SESSION=abc; LB=node2")
            .containsEntry("SOAPAction", "\"urn:example:ping#Ping\"");
    }

    @Test
    void 빌드_후_전송_상태_변경은_resolveHeaders에_반영() {
        // given
        ClientOptions options = options().build();
        Operation operation = Operation.create("Ping", documented, options);
        PreparedRequest request = builder.build(operation, Locals.empty(), TransportState.from(options));

        // when
        request.http().getHeaders().put("X-Auth", "token");
        request.http().setCookies(List.of(Cookie.of("AUTH", "1")));

        // then
        assertThat(request.resolveHeaders())
            .containsEntry("X-Auth", "token")
            .containsEntry("Cookie", "AUTH=1");
    }

    @Test
    void xml_local은_본문_전체를_대체() {
        // given
        ClientOptions options = options().build();
        Operation operation = Operation.create("Ping", documented, options);
        String raw = "<env:Envelope xmlns:env=\"http://schemas.xmlsoap.org/soap/envelope/\"><env:Body/></env:Envelope>";

        // when
        PreparedRequest request = builder.build(operation, Locals.builder().xml(raw).build(),
            TransportState.from(options));

        // then
        assertThat(request.getBody()).isEqualTo(raw);
        assertThat(request.getHeaders()).containsEntry("SOAPAction", "\"urn:example:ping#Ping\"");
    }

    @Test
    void endpoint가_없으면_IllegalStateException() {
        // given
        ClientOptions options = options().build();
        Contract noAddress = Contract.documented(List.of(OperationDescriptor.of("Ping")),
            "PingService", "urn:example:ping", null, null);
        Operation operation = Operation.create("Ping", noAddress, options);

        // when & then
        assertThatThrownBy(() -> builder.build(operation, Locals.empty(), TransportState.from(options)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("No SOAP endpoint available for operation Ping");
    }
}
