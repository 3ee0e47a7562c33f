package com.ryuqq.wsclient.application.logging;

import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.model.PreparedRequest;
import com.ryuqq.wsclient.core.model.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SOAP 요청/응답 DEBUG 로거.
 *
 * <p>{@code log} 옵션이 켜진 경우에만 기록하며, {@code filters}에 지정된
 * 요소의 내용은 {@value #FILTERED}로 가립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MessageLogger {

    public static final String FILTERED = "***FILTERED***";

    private static final Logger log = LoggerFactory.getLogger(MessageLogger.class);

    private final boolean enabled;
    private final Set<String> filters;

    public MessageLogger(ClientOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        this.enabled = options.log();
        this.filters = options.filters();
    }

    public void logRequest(PreparedRequest request) {
        if (!enabled || !log.isDebugEnabled()) {
            return;
        }
        log.debug("SOAP request: {} {}", request.getEndpoint(), request.resolveHeaders());
        log.debug("{}", mask(request.getBody()));
    }

    public void logResponse(RawResponse response) {
        if (!enabled || !log.isDebugEnabled()) {
            return;
        }
        log.debug("SOAP response (status {}): {}", response.status(), response.headers());
        log.debug("{}", mask(response.body()));
    }

    /**
     * 필터 대상 요소의 내용을 가림.
     *
     * @param xml 원본 XML
     * @return 가려진 XML
     */
    public String mask(String xml) {
        if (xml == null || filters.isEmpty()) {
            return xml;
        }
        String masked = xml;
        for (String name : filters) {
            Pattern pattern = Pattern.compile(
                "(<(?:[\\w.-]+:)?" + Pattern.quote(name) + "(?:\\s[^>]*)?>)(.*?)(</(?:[\\w.-]+:)?"
                    + Pattern.quote(name) + "\\s*>)",
                Pattern.DOTALL);
            Matcher matcher = pattern.matcher(masked);
            masked = matcher.replaceAll("$1" + Matcher.quoteReplacement(FILTERED) + "$3");
        }
        return masked;
    }
}
