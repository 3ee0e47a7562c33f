package com.ryuqq.wsclient.adapter.wsdl;

import com.ryuqq.wsclient.core.spi.DocumentLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * RoutingDocumentLoader 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RoutingDocumentLoaderTest {

    @Mock
    private DocumentLoader local;

    @Mock
    private DocumentLoader remote;

    @Test
    void http_위치는_원격_로더() {
        // given
        when(remote.load("HTTPS://svc.example/ping?wsdl", null)).thenReturn("<remote/>");

        // when
        String document = new RoutingDocumentLoader(local, remote).load("HTTPS://svc.example/ping?wsdl", null);

        // then
        assertThat(document).isEqualTo("<remote/>");
        verifyNoInteractions(local);
    }

    @Test
    void 그_외_위치는_로컬_로더() {
        // given
        when(local.load("classpath:wsdl/ping.wsdl", null)).thenReturn("<local/>");

        // when
        String document = new RoutingDocumentLoader(local, remote).load("classpath:wsdl/ping.wsdl", null);

        // then
        assertThat(document).isEqualTo("<local/>");
        verifyNoInteractions(remote);
    }
}
