package com.ryuqq.wsclient.adapter.http;

import com.ryuqq.wsclient.core.config.HttpSettings;
import com.ryuqq.wsclient.core.exception.ContractLoadException;
import com.ryuqq.wsclient.core.model.RawResponse;
import com.ryuqq.wsclient.core.spi.DocumentLoader;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * HTTP(S) WSDL 로더.
 *
 * <p>전역 HTTP 헤더, 타임아웃, Basic 인증을 적용하여 GET으로 문서를 가져옵니다.
 * 2xx가 아닌 응답과 I/O 실패는 ContractLoadException으로 변환됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HttpDocumentLoader implements DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(HttpDocumentLoader.class);

    private final HttpClient httpClient;

    public HttpDocumentLoader(HttpClient httpClient) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        this.httpClient = httpClient;
    }

    @Override
    public String load(String location, HttpSettings http) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location cannot be null or blank");
        }
        HttpGet get;
        try {
            get = new HttpGet(location);
        } catch (IllegalArgumentException e) {
            throw new ContractLoadException("Invalid WSDL location: " + location, e);
        }
        if (http != null) {
            http.getHeaders().forEach(get::addHeader);
        }
        HttpExchanges.applySettings(get, http);

        RawResponse response;
        try {
            response = httpClient.execute(get, HttpExchanges::toRawResponse);
        } catch (IOException e) {
            throw new ContractLoadException("Unable to load WSDL document from " + location + ": " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            throw new ContractLoadException(
                "Unable to load WSDL document from " + location + " (HTTP " + response.status() + ")");
        }
        log.debug("Loaded WSDL document from {} ({} chars)", location, response.body().length());
        return response.body();
    }
}
