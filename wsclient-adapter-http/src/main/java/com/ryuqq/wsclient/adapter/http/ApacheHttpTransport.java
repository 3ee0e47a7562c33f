package com.ryuqq.wsclient.adapter.http;

import com.ryuqq.wsclient.core.exception.TransportException;
import com.ryuqq.wsclient.core.model.PreparedRequest;
import com.ryuqq.wsclient.core.model.RawResponse;
import com.ryuqq.wsclient.core.spi.Transport;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.io.CloseMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Apache HttpClient 5 기반 Transport.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>요청 endpoint로 POST ({@link PreparedRequest#resolveHeaders()} + Envelope 본문)</li>
 *   <li>요청별 타임아웃, Basic 인증 적용</li>
 *   <li>응답 상태/헤더/본문을 RawResponse로 변환 (상태 코드 해석은 상위 계층)</li>
 * </ol>
 *
 * <p>I/O 실패는 TransportException으로 변환됩니다.</p>
 *
 * <p>기본 생성자와 {@link #owning(CloseableHttpClient)}로 만든 인스턴스는 HttpClient를 소유하며
 * {@link #close()}에서 닫습니다. 외부에서 전달받은 HttpClient는 닫지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ApacheHttpTransport implements Transport {

    public static final String ADAPTER_NAME = "httpclient5";

    private static final Logger log = LoggerFactory.getLogger(ApacheHttpTransport.class);

    private final HttpClient httpClient;
    private final CloseableHttpClient ownedClient;

    public ApacheHttpTransport() {
        this(HttpClientFactory.newPooledClient(), true);
    }

    /**
     * 외부 HttpClient 사용 (close 시 닫지 않음).
     *
     * @param httpClient 공유 HttpClient
     */
    public ApacheHttpTransport(HttpClient httpClient) {
        this(httpClient, false);
    }

    private ApacheHttpTransport(HttpClient httpClient, boolean owned) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        this.httpClient = httpClient;
        this.ownedClient = owned ? (CloseableHttpClient) httpClient : null;
    }

    /**
     * HttpClient를 소유하는 Transport 생성.
     *
     * @param httpClient close 시 함께 닫을 HttpClient
     * @return ApacheHttpTransport
     */
    public static ApacheHttpTransport owning(CloseableHttpClient httpClient) {
        return new ApacheHttpTransport(httpClient, true);
    }

    @Override
    public RawResponse send(PreparedRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        HttpPost post = new HttpPost(request.getEndpoint());
        String contentType = null;
        for (Map.Entry<String, String> header : request.resolveHeaders().entrySet()) {
            if (HttpHeaders.CONTENT_TYPE.equalsIgnoreCase(header.getKey())) {
                contentType = header.getValue();
            } else {
                post.addHeader(header.getKey(), header.getValue());
            }
        }
        post.setEntity(new StringEntity(request.getBody(), contentType(contentType, request)));
        HttpExchanges.applySettings(post, request.http());

        try {
            RawResponse response = httpClient.execute(post, HttpExchanges::toRawResponse);
            log.debug("POST {} -> {}", request.getEndpoint(), response.status());
            return response;
        } catch (IOException e) {
            throw new TransportException("SOAP request to " + request.getEndpoint() + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * 소유한 HttpClient와 커넥션 풀 종료.
     */
    @Override
    public void close() {
        if (ownedClient != null) {
            ownedClient.close(CloseMode.GRACEFUL);
            log.debug("Closed owned HttpClient");
        }
    }

    private static ContentType contentType(String header, PreparedRequest request) {
        Charset charset = charset(request.options().encoding());
        if (header == null || header.isBlank()) {
            return ContentType.create(request.options().soapVersion().mediaType(), charset);
        }
        ContentType parsed = ContentType.parse(header);
        return parsed.getCharset() == null ? parsed.withCharset(charset) : parsed;
    }

    private static Charset charset(String encoding) {
        try {
            return Charset.forName(encoding);
        } catch (IllegalArgumentException e) {
            log.warn("Unsupported encoding {}, falling back to UTF-8", encoding);
            return StandardCharsets.UTF_8;
        }
    }
}
