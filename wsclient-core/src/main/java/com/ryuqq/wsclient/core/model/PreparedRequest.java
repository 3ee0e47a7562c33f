package com.ryuqq.wsclient.core.model;

import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.config.HttpSettings;
import com.ryuqq.wsclient.core.config.WsseSettings;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 전송 준비가 끝난 요청 (전송 전까지 가변).
 *
 * <p>호출자는 전송 전에 헤더를 추가하거나 본문을 교체할 수 있습니다 (예: 비표준 인증 방식).
 * 요청이 가진 {@link TransportState}는 클라이언트 상태의 사본이므로, 여기서의 수정은
 * 클라이언트나 다른 요청에 영향을 주지 않습니다.</p>
 *
 * <p><strong>전송 헤더 구성 ({@link #resolveHeaders()}):</strong></p>
 * <ul>
 *   <li>{@code http()} 헤더 (전송 시점 값)</li>
 *   <li>요청 헤더 (같은 이름이면 우선, 대소문자 무시)</li>
 *   <li>{@code http()} 쿠키 → Cookie 헤더 (요청 헤더에 Cookie가 없을 때)</li>
 * </ul>
 *
 * <p>본문을 교체하면 WS-Security 헤더도 함께 갱신해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PreparedRequest {

    static final String COOKIE_HEADER = "Cookie";

    private final Operation operation;
    private final TransportState transportState;
    private final Map<String, String> headers;
    private URI endpoint;
    private String body;

    public PreparedRequest(Operation operation, URI endpoint, Map<String, String> headers,
                           String body, TransportState transportState) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (transportState == null) {
            throw new IllegalArgumentException("transportState cannot be null");
        }
        this.operation = operation;
        this.endpoint = endpoint;
        this.headers = new LinkedHashMap<>(headers == null ? Map.of() : headers);
        this.body = body;
        this.transportState = transportState;
    }

    public Operation getOperation() {
        return operation;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(URI endpoint) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        this.endpoint = endpoint;
    }

    /**
     * 요청 헤더 (수정 가능).
     *
     * @return 가변 헤더 맵
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public void setHeader(String name, String value) {
        headers.put(name, value);
    }

    /**
     * 전송할 HTTP 헤더 계산.
     *
     * <p>Transport는 전송 직전에 이 값을 사용해야 합니다. 준비 이후 {@code http()}에서
     * 변경한 헤더와 쿠키도 반영됩니다.</p>
     *
     * @return 새 헤더 맵 (삽입 순서 유지)
     */
    public Map<String, String> resolveHeaders() {
        HttpSettings http = transportState.http();
        Map<String, String> resolved = new LinkedHashMap<>(http.getHeaders());
        for (Map.Entry<String, String> header : headers.entrySet()) {
            resolved.keySet().removeIf(name -> name.equalsIgnoreCase(header.getKey()));
            resolved.put(header.getKey(), header.getValue());
        }
        String cookieHeader = http.cookieHeaderOrNull();
        boolean explicitCookie = resolved.keySet().stream().anyMatch(COOKIE_HEADER::equalsIgnoreCase);
        if (cookieHeader != null && !explicitCookie) {
            resolved.put(COOKIE_HEADER, cookieHeader);
        }
        return resolved;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        this.body = body;
    }

    public TransportState getTransportState() {
        return transportState;
    }

    public HttpSettings http() {
        return transportState.http();
    }

    public WsseSettings wsse() {
        return transportState.wsse();
    }

    public ClientOptions options() {
        return transportState.options();
    }

    @Override
    public String toString() {
        return "PreparedRequest{operation=" + operation.getName() + ", endpoint=" + endpoint + "}";
    }
}
