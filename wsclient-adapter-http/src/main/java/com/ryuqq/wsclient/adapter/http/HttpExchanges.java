package com.ryuqq.wsclient.adapter.http;

import com.ryuqq.wsclient.core.config.Credentials;
import com.ryuqq.wsclient.core.config.HttpSettings;
import com.ryuqq.wsclient.core.model.RawResponse;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HttpClient 요청/응답 공통 처리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class HttpExchanges {

    private HttpExchanges() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 요청별 타임아웃과 Basic 인증 적용.
     *
     * <p>open timeout은 커넥션 대기 타임아웃으로, read timeout은 응답 타임아웃으로 적용됩니다.
     * 연결 타임아웃은 {@link HttpClientFactory}에서 설정합니다.</p>
     *
     * @param request HttpClient 요청
     * @param http HTTP 설정 (nullable)
     */
    static void applySettings(HttpUriRequestBase request, HttpSettings http) {
        if (http == null) {
            return;
        }
        RequestConfig.Builder config = RequestConfig.custom();
        Duration openTimeout = http.getOpenTimeout();
        if (openTimeout != null) {
            config.setConnectionRequestTimeout(Timeout.ofMilliseconds(openTimeout.toMillis()));
        }
        Duration readTimeout = http.getReadTimeout();
        if (readTimeout != null) {
            config.setResponseTimeout(Timeout.ofMilliseconds(readTimeout.toMillis()));
        }
        request.setConfig(config.build());

        Credentials basicAuth = http.getBasicAuth();
        if (basicAuth != null) {
            String token = basicAuth.username() + ":" + basicAuth.password();
            request.setHeader(HttpHeaders.AUTHORIZATION,
                "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8)));
        }
    }

    static RawResponse toRawResponse(ClassicHttpResponse response) throws IOException, ParseException {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (Header header : response.getHeaders()) {
            headers.computeIfAbsent(header.getName(), k -> new ArrayList<>()).add(header.getValue());
        }
        String body = response.getEntity() == null
            ? ""
            : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
        return new RawResponse(response.getCode(), headers, body);
    }
}
