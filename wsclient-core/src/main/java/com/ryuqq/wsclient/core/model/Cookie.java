package com.ryuqq.wsclient.core.model;

/**
 * HTTP 쿠키 (이름/값).
 *
 * <p>Path, Expires 등 속성은 보관하지 않습니다. 같은 이름의 쿠키는 교체됩니다.</p>
 *
 * @param name 쿠키 이름
 * @param value 쿠키 값
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Cookie(String name, String value) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException name이 null/blank이거나 value가 null인 경우
     */
    public Cookie {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("cookie name cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("cookie value cannot be null");
        }
    }

    public static Cookie of(String name, String value) {
        return new Cookie(name, value);
    }

    /**
     * Set-Cookie 헤더 값 파싱.
     *
     * <p>{@code SESSION=abc; Path=/; HttpOnly} → Cookie(SESSION, abc)</p>
     *
     * @param setCookieHeader Set-Cookie 헤더 값
     * @return Cookie 또는 이름=값 쌍이 없으면 null
     */
    public static Cookie parseOrNull(String setCookieHeader) {
        if (setCookieHeader == null) {
            return null;
        }
        String pair = setCookieHeader;
        int semicolon = pair.indexOf(';');
        if (semicolon >= 0) {
            pair = pair.substring(0, semicolon);
        }
        int equals = pair.indexOf('=');
        if (equals <= 0) {
            return null;
        }
        String name = pair.substring(0, equals).trim();
        if (name.isEmpty()) {
            return null;
        }
        return new Cookie(name, pair.substring(equals + 1).trim());
    }

    /**
     * Cookie 요청 헤더 형식.
     *
     * @return {@code name=value}
     */
    public String toHeaderValue() {
        return name + "=" + value;
    }
}
