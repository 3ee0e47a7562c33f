package com.ryuqq.wsclient.adapter.http;

import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.config.Credentials;
import com.ryuqq.wsclient.core.config.SoapVersion;
import com.ryuqq.wsclient.core.exception.ErrorKind;
import com.ryuqq.wsclient.core.exception.TransportException;
import com.ryuqq.wsclient.core.model.Contract;
import com.ryuqq.wsclient.core.model.Cookie;
import com.ryuqq.wsclient.core.model.Operation;
import com.ryuqq.wsclient.core.model.PreparedRequest;
import com.ryuqq.wsclient.core.model.RawResponse;
import com.ryuqq.wsclient.core.model.TransportState;
import com.sun.net.httpserver.HttpServer;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ApacheHttpTransport 통합 테스트 (JDK HttpServer).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ApacheHttpTransportTest {

    private HttpServer server;
    private final ApacheHttpTransport transport = new ApacheHttpTransport();
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private final AtomicReference<String> receivedMethod = new AtomicReference<>();
    private final AtomicReference<Map<String, String>> receivedHeaders = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/ping", exchange -> {
            receivedMethod.set(exchange.getRequestMethod());
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            Map<String, String> headers = new LinkedHashMap<>();
            exchange.getRequestHeaders().forEach((name, values) -> headers.put(name.toLowerCase(), values.get(0)));
            receivedHeaders.set(headers);
            byte[] response = "<ok/>".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/xml;charset=UTF-8");
            exchange.getResponseHeaders().add("Set-Cookie", "SESSION=abc; Path=/");
            exchange.sendResponseHeaders(200, response.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(response);
            }
        });
        server.createContext("/fault", exchange -> {
            byte[] response = "<fault/>".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(500, response.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(response);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        transport.close();
        if (server != null) {
            server.stop(0);
        }
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getAddress().getPort() + path);
    }

    private static PreparedRequest request(URI endpoint, ClientOptions options, Map<String, String> headers) {
        Contract contract = Contract.withoutDocument(endpoint, "urn:example", null);
        return new PreparedRequest(Operation.create("Ping", contract, options), endpoint,
            new LinkedHashMap<>(headers), "<env:Envelope>héllo</env:Envelope>", TransportState.from(options));
    }

    @Test
    void POST_요청과_응답_변환() {
        // given
        ClientOptions options = ClientOptions.builder()
            .endpoint(uri("/ping"))
            .namespace("urn:example")
            .basicAuth(Credentials.of("user", "pass"))
            .readTimeout(Duration.ofSeconds(5))
            .build();
        PreparedRequest request = request(uri("/ping"), options, Map.of(
            "Content-Type", "text/xml;charset=UTF-8",
            "SOAPAction", "\"urn:Ping\"",
            "Cookie", Cookie.of("LB", "node2").toHeaderValue()));

        // when
        RawResponse response = transport.send(request);

        // then
        assertThat(response.status()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("<ok/>");
        assertThat(response.cookies()).containsExactly(Cookie.of("SESSION", "abc"));
        assertThat(receivedMethod.get()).isEqualTo("POST");
        assertThat(receivedBody.get()).isEqualTo("<env:Envelope>héllo</env:Envelope>");
        assertThat(receivedHeaders.get())
            .containsEntry("soapaction", "\"urn:Ping\"")
            .containsEntry("cookie", "LB=node2")
            .containsEntry("authorization", "Basic dXNlcjpwYXNz");
        assertThat(receivedHeaders.get().get("content-type")).startsWith("text/xml").containsIgnoringCase("utf-8");
    }

    @Test
    void 빌드_후_설정한_헤더와_쿠키도_전송() {
        // given
        ClientOptions options = ClientOptions.builder()
            .endpoint(uri("/ping"))
            .namespace("urn:example")
            .header("X-Tenant", "acme")
            .build();
        PreparedRequest request = request(uri("/ping"), options, Map.of("SOAPAction", "\"urn:Ping\""));

        // when
        request.http().getHeaders().put("X-Auth", "token");
        request.http().setCookies(List.of(Cookie.of("AUTH", "1")));
        transport.send(request);

        // then
        assertThat(receivedHeaders.get())
            .containsEntry("x-tenant", "acme")
            .containsEntry("x-auth", "token")
            .containsEntry("cookie", "AUTH=1")
            .containsEntry("soapaction", "\"urn:Ping\"");
    }

    @Test
    void 요청_헤더가_전역_헤더보다_우선() {
        // given
        ClientOptions options = ClientOptions.builder()
            .endpoint(uri("/ping"))
            .namespace("urn:example")
            .header("soapaction", "\"urn:Global\"")
            .build();
        PreparedRequest request = request(uri("/ping"), options, Map.of("SOAPAction", "\"urn:Ping\""));

        // when
        transport.send(request);

        // then
        assertThat(receivedHeaders.get()).containsEntry("soapaction", "\"urn:Ping\"");
    }

    @Test
    void 소유한_HttpClient는_close_후_사용_불가() {
        // given
        ClientOptions options = ClientOptions.builder().endpoint(uri("/ping")).namespace("urn:example").build();
        ApacheHttpTransport owning = ApacheHttpTransport.owning(HttpClientFactory.newPooledClient());
        owning.send(request(uri("/ping"), options, Map.of()));

        // when
        owning.close();
        owning.close();

        // then
        assertThatThrownBy(() -> owning.send(request(uri("/ping"), options, Map.of())))
            .isInstanceOfAny(IllegalStateException.class, TransportException.class);
    }

    @Test
    void 공유_HttpClient는_close해도_닫히지_않음() throws IOException {
        // given
        ClientOptions options = ClientOptions.builder().endpoint(uri("/ping")).namespace("urn:example").build();
        try (CloseableHttpClient shared = HttpClientFactory.newPooledClient()) {
            ApacheHttpTransport borrowing = new ApacheHttpTransport(shared);

            // when
            borrowing.close();

            // then
            RawResponse response = new ApacheHttpTransport(shared).send(request(uri("/ping"), options, Map.of()));
            assertThat(response.status()).isEqualTo(200);
        }
    }

    @Test
    void SOAP12_Content_Type_파라미터_유지() {
        // given
        ClientOptions options = ClientOptions.builder()
            .endpoint(uri("/ping"))
            .namespace("urn:example")
            .soapVersion(SoapVersion.SOAP_12)
            .build();
        PreparedRequest request = request(uri("/ping"), options,
            Map.of("Content-Type", "application/soap+xml;charset=UTF-8;action=\"urn:Ping\""));

        // when
        transport.send(request);

        // then
        assertThat(receivedHeaders.get().get("content-type"))
            .startsWith("application/soap+xml")
            .contains("action=");
    }

    @Test
    void 비2xx_응답도_RawResponse로_반환() {
        // given
        ClientOptions options = ClientOptions.builder().endpoint(uri("/fault")).namespace("urn:example").build();

        // when
        RawResponse response = transport.send(request(uri("/fault"), options, Map.of()));

        // then
        assertThat(response.status()).isEqualTo(500);
        assertThat(response.body()).isEqualTo("<fault/>");
        assertThat(response.isSuccessful()).isFalse();
    }

    @Test
    void 연결_실패는_TransportException() throws IOException {
        // given
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        URI endpoint = URI.create("http://localhost:" + closedPort + "/ping");
        ClientOptions options = ClientOptions.builder()
            .endpoint(endpoint)
            .namespace("urn:example")
            .openTimeout(Duration.ofSeconds(2))
            .build();

        // when & then
        assertThatThrownBy(() -> transport.send(request(endpoint, options, Map.of())))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("SOAP request to " + endpoint + " failed")
            .satisfies(e -> assertThat(((TransportException) e).kind()).isEqualTo(ErrorKind.TRANSPORT_FAILED));
    }
}
