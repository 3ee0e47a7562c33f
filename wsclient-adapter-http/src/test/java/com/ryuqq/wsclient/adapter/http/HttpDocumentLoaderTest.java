package com.ryuqq.wsclient.adapter.http;

import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.config.HttpSettings;
import com.ryuqq.wsclient.core.exception.ContractLoadException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HttpDocumentLoader 통합 테스트 (JDK HttpServer).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class HttpDocumentLoaderTest {

    private HttpServer server;
    private final AtomicReference<String> receivedTenant = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/service", exchange -> {
            receivedTenant.set(exchange.getRequestHeaders().getFirst("X-Tenant"));
            byte[] body = "<definitions/>".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/missing", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private String url(String path) {
        return "http://localhost:" + server.getAddress().getPort() + path;
    }

    @Test
    void GET으로_문서_로드() {
        // given
        HttpSettings http = HttpSettings.from(ClientOptions.builder()
            .contractLocation(url("/service?wsdl"))
            .header("X-Tenant", "acme")
            .build());

        // when
        String document = new HttpDocumentLoader(HttpClientFactory.newPooledClient()).load(url("/service?wsdl"), http);

        // then
        assertThat(document).isEqualTo("<definitions/>");
        assertThat(receivedTenant.get()).isEqualTo("acme");
    }

    @Test
    void 비2xx는_ContractLoadException() {
        HttpDocumentLoader loader = new HttpDocumentLoader(HttpClientFactory.newPooledClient());

        assertThatThrownBy(() -> loader.load(url("/missing"), null))
            .isInstanceOf(ContractLoadException.class)
            .hasMessageContaining("(HTTP 404)");
    }
}
