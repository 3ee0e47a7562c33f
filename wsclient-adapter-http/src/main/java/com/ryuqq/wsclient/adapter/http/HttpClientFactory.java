package com.ryuqq.wsclient.adapter.http;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;

import java.time.Duration;

/**
 * 기본 HttpClient 생성.
 *
 * <p>커넥션 풀 기반 클라이언트를 생성합니다. 쿠키는 클라이언트가 직접 관리하므로
 * HttpClient의 쿠키 처리는 비활성화합니다.</p>
 *
 * <p>연결 타임아웃은 커넥션 풀 설정(ConnectionConfig)으로 고정되며, 요청별로는
 * 커넥션 대기/응답 타임아웃만 적용됩니다. 반환된 클라이언트는 호출자가 닫아야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HttpClientFactory {

    static final int MAX_TOTAL_CONNECTIONS = 50;
    static final int MAX_CONNECTIONS_PER_ROUTE = 10;

    private HttpClientFactory() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static CloseableHttpClient newPooledClient() {
        return newPooledClient(null);
    }

    /**
     * 커넥션 풀 클라이언트 생성.
     *
     * @param connectTimeout 연결 타임아웃 (null이면 HttpClient 기본값)
     * @return 새 CloseableHttpClient
     */
    public static CloseableHttpClient newPooledClient(Duration connectTimeout) {
        ConnectionConfig.Builder connection = ConnectionConfig.custom();
        if (connectTimeout != null) {
            connection.setConnectTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()));
        }
        PoolingHttpClientConnectionManager manager = PoolingHttpClientConnectionManagerBuilder.create()
            .setMaxConnTotal(MAX_TOTAL_CONNECTIONS)
            .setMaxConnPerRoute(MAX_CONNECTIONS_PER_ROUTE)
            .setDefaultConnectionConfig(connection.build())
            .build();
        return HttpClients.custom()
            .setConnectionManager(manager)
            .disableCookieManagement()
            .build();
    }
}
