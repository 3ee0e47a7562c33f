package com.ryuqq.wsclient.core.config;

import com.ryuqq.wsclient.core.model.Cookie;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * HTTP 수준 전송 설정 (가변).
 *
 * <p>클라이언트가 하나를 소유하고(세션 쿠키 포함), 요청을 준비할 때마다
 * {@link #copy()}로 구조적으로 독립된 사본을 만들어 요청에 넘깁니다.
 * 사본을 수정해도 원본에는 영향이 없으며, 그 반대도 마찬가지입니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 동기화하지 않습니다. 공유 인스턴스는 소유자가 보호해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HttpSettings {

    private final Map<String, String> headers;
    private final Map<String, Cookie> cookies;
    private Duration openTimeout;
    private Duration readTimeout;
    private Credentials basicAuth;

    public HttpSettings() {
        this(new LinkedHashMap<>(), new LinkedHashMap<>(), null, null, null);
    }

    private HttpSettings(Map<String, String> headers, Map<String, Cookie> cookies,
                         Duration openTimeout, Duration readTimeout, Credentials basicAuth) {
        this.headers = headers;
        this.cookies = cookies;
        this.openTimeout = openTimeout;
        this.readTimeout = readTimeout;
        this.basicAuth = basicAuth;
    }

    /**
     * 전역 옵션에서 초기 설정 생성.
     *
     * @param options 클라이언트 옵션
     * @return 새 HttpSettings
     * @throws IllegalArgumentException options가 null인 경우
     */
    public static HttpSettings from(ClientOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        HttpSettings settings = new HttpSettings();
        settings.headers.putAll(options.headers());
        settings.openTimeout = options.openTimeout().orElse(null);
        settings.readTimeout = options.readTimeout().orElse(null);
        settings.basicAuth = options.basicAuth().orElse(null);
        return settings;
    }

    /**
     * 구조적으로 독립된 사본 생성.
     *
     * @return 새 HttpSettings
     */
    public HttpSettings copy() {
        return new HttpSettings(new LinkedHashMap<>(headers), new LinkedHashMap<>(cookies),
            openTimeout, readTimeout, basicAuth);
    }

    /**
     * 응답에서 받은 쿠키 병합 (같은 이름은 교체).
     *
     * @param received 수신 쿠키
     */
    public void setCookies(Collection<Cookie> received) {
        if (received == null) {
            return;
        }
        for (Cookie cookie : received) {
            cookies.put(cookie.name(), cookie);
        }
    }

    /**
     * Cookie 요청 헤더 값.
     *
     * @return {@code name=value; name2=value2} 또는 쿠키가 없으면 null
     */
    public String cookieHeaderOrNull() {
        if (cookies.isEmpty()) {
            return null;
        }
        return cookies.values().stream()
            .map(Cookie::toHeaderValue)
            .collect(Collectors.joining("; "));
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Map<String, Cookie> getCookies() {
        return Collections.unmodifiableMap(cookies);
    }

    public void clearCookies() {
        cookies.clear();
    }

    public Duration getOpenTimeout() {
        return openTimeout;
    }

    public void setOpenTimeout(Duration openTimeout) {
        this.openTimeout = openTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public Credentials getBasicAuth() {
        return basicAuth;
    }

    public void setBasicAuth(Credentials basicAuth) {
        this.basicAuth = basicAuth;
    }

    @Override
    public String toString() {
        return "HttpSettings{headers=" + headers.keySet() + ", cookies=" + cookies.keySet() + "}";
    }
}
