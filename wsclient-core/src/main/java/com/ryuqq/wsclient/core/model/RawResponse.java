package com.ryuqq.wsclient.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 전송 계층이 받은 원시 HTTP 응답.
 *
 * <p>헤더 이름은 소문자로 정규화되어 대소문자 구분 없이 조회됩니다.</p>
 *
 * @param status HTTP 상태 코드
 * @param headers 응답 헤더 (소문자 이름 → 값 목록)
 * @param body 응답 본문 (빈 문자열 가능)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RawResponse(int status, Map<String, List<String>> headers, String body) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException status가 음수인 경우
     */
    public RawResponse {
        if (status < 0) {
            throw new IllegalArgumentException("status must be non-negative (current: " + status + ")");
        }
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> normalized
                .computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                .addAll(values == null ? List.of() : values));
        }
        normalized.replaceAll((name, values) -> List.copyOf(values));
        headers = Collections.unmodifiableMap(normalized);
        if (body == null) {
            body = "";
        }
    }

    public static RawResponse of(int status, String body) {
        return new RawResponse(status, Map.of(), body);
    }

    /**
     * 헤더 첫 번째 값 조회.
     *
     * @param name 헤더 이름 (대소문자 무관)
     * @return 값 또는 null
     */
    public String headerOrNull(String name) {
        List<String> values = headerValues(name);
        return values.isEmpty() ? null : values.get(0);
    }

    public List<String> headerValues(String name) {
        return headers.getOrDefault(name.toLowerCase(Locale.ROOT), List.of());
    }

    /**
     * Set-Cookie 헤더에서 쿠키 추출.
     *
     * @return 쿠키 목록 (헤더 순서)
     */
    public List<Cookie> cookies() {
        List<Cookie> cookies = new ArrayList<>();
        for (String header : headerValues("set-cookie")) {
            Cookie cookie = Cookie.parseOrNull(header);
            if (cookie != null) {
                cookies.add(cookie);
            }
        }
        return cookies;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
