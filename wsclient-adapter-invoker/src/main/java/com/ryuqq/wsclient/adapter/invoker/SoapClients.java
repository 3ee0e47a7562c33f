package com.ryuqq.wsclient.adapter.invoker;

import com.ryuqq.wsclient.adapter.http.ApacheHttpTransport;
import com.ryuqq.wsclient.adapter.http.HttpClientFactory;
import com.ryuqq.wsclient.adapter.http.HttpDocumentLoader;
import com.ryuqq.wsclient.adapter.wsdl.LocalDocumentLoader;
import com.ryuqq.wsclient.adapter.wsdl.RoutingDocumentLoader;
import com.ryuqq.wsclient.adapter.wsdl.WsdlContractResolver;
import com.ryuqq.wsclient.adapter.wsdl.envelope.EnvelopeRequestBuilder;
import com.ryuqq.wsclient.adapter.wsse.XmlSignatureVerifier;
import com.ryuqq.wsclient.application.client.ClientCollaborators;
import com.ryuqq.wsclient.application.client.SoapClient;
import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.spi.Transport;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;

import java.util.Map;
import java.util.function.Consumer;

/**
 * 기본 협력자로 SoapClient 생성.
 *
 * <p><strong>기본 구성:</strong></p>
 * <ul>
 *   <li>계약: WSDL (로컬 파일 / classpath / HTTP)</li>
 *   <li>요청: SOAP Envelope + WS-Security 헤더</li>
 *   <li>전송: Apache HttpClient 5 (클라이언트마다 커넥션 풀 1개, WSDL 로드와 공유)</li>
 *   <li>검증: JDK XML Digital Signature</li>
 * </ul>
 *
 * <p>생성된 SoapClient가 커넥션 풀을 소유하므로 사용 후 {@link SoapClient#close()}로 닫아야 합니다.
 * 생성이 실패하면 풀은 즉시 닫힙니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SoapClients {

    private SoapClients() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static SoapClient create(Object globals) {
        return create(globals, null);
    }

    /**
     * 기본 협력자로 SoapClient 생성.
     *
     * @param globals 전역 옵션 (ClientOptions 또는 snake_case 키 매핑)
     * @param customizer 검증 전에 옵션을 보완하는 설정 블록 (nullable)
     * @return 커넥션 풀을 소유한 SoapClient
     * @throws com.ryuqq.wsclient.core.exception.InitializationException 옵션이 잘못되었거나 부족한 경우
     */
    public static SoapClient create(Object globals, Consumer<ClientOptions.Builder> customizer) {
        ClientOptions options = ClientOptions.from(globals);
        if (customizer != null) {
            ClientOptions.Builder builder = options.toBuilder();
            customizer.accept(builder);
            options = builder.build();
        }
        ClientCollaborators collaborators = defaultCollaborators(options);
        try {
            return new DefaultSoapClient(options, collaborators);
        } catch (RuntimeException e) {
            collaborators.transport().close();
            throw e;
        }
    }

    /**
     * 기본 협력자 구성.
     *
     * <p>연결 타임아웃은 {@code open_timeout}으로 커넥션 풀에 설정됩니다.
     * 반환된 Transport를 닫으면 WSDL 로더와 공유하는 HttpClient도 닫힙니다.</p>
     *
     * @param options 클라이언트 옵션
     * @return ClientCollaborators
     */
    public static ClientCollaborators defaultCollaborators(ClientOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        CloseableHttpClient httpClient = HttpClientFactory.newPooledClient(options.openTimeout().orElse(null));
        Transport transport = new AdapterRoutingTransport(
            Map.of(ApacheHttpTransport.ADAPTER_NAME, ApacheHttpTransport.owning(httpClient)));
        return new ClientCollaborators(
            new WsdlContractResolver(new RoutingDocumentLoader(new LocalDocumentLoader(),
                new HttpDocumentLoader(httpClient))),
            new EnvelopeRequestBuilder(),
            transport,
            new XmlSignatureVerifier());
    }
}
