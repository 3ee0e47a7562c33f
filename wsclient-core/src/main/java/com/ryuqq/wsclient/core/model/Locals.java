package com.ryuqq.wsclient.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 호출 단위 옵션 (불변).
 *
 * <p>전역 옵션과 달리 한 번의 호출에만 적용됩니다.</p>
 *
 * <ul>
 *   <li>message: 요청 본문 메시지 (키 → 값, 중첩 Map/Collection 허용)</li>
 *   <li>soapAction: SOAPAction 재정의</li>
 *   <li>soapHeader: 전역 SOAP 헤더 위에 병합</li>
 *   <li>messageTag: 본문 최상위 요소 이름 재정의</li>
 *   <li>attributes: 본문 최상위 요소 속성</li>
 *   <li>xml: 본문 전체를 대체하는 원시 XML</li>
 *   <li>cookies: 이 호출에만 추가로 보낼 쿠키</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Locals {

    private static final Locals EMPTY = new Builder().build();

    private final Map<String, Object> message;
    private final String soapAction;
    private final Map<String, Object> soapHeader;
    private final String messageTag;
    private final Map<String, String> attributes;
    private final String xml;
    private final List<Cookie> cookies;

    private Locals(Builder builder) {
        this.message = Collections.unmodifiableMap(new LinkedHashMap<>(builder.message));
        this.soapAction = builder.soapAction;
        this.soapHeader = Collections.unmodifiableMap(new LinkedHashMap<>(builder.soapHeader));
        this.messageTag = builder.messageTag;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.xml = builder.xml;
        this.cookies = Collections.unmodifiableList(new ArrayList<>(builder.cookies));
    }

    public static Locals empty() {
        return EMPTY;
    }

    /**
     * 메시지만 지정한 Locals.
     *
     * @param message 요청 메시지
     * @return Locals
     */
    public static Locals message(Map<String, ?> message) {
        return builder().message(message).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> message() {
        return message;
    }

    public Optional<String> soapAction() {
        return Optional.ofNullable(soapAction);
    }

    public Map<String, Object> soapHeader() {
        return soapHeader;
    }

    public Optional<String> messageTag() {
        return Optional.ofNullable(messageTag);
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public Optional<String> xml() {
        return Optional.ofNullable(xml);
    }

    public List<Cookie> cookies() {
        return cookies;
    }

    @Override
    public String toString() {
        return "Locals{message=" + message.keySet() + ", soapAction=" + soapAction
            + ", messageTag=" + messageTag + ", xml=" + (xml != null) + "}";
    }

    public static final class Builder {

        private final Map<String, Object> message = new LinkedHashMap<>();
        private String soapAction;
        private final Map<String, Object> soapHeader = new LinkedHashMap<>();
        private String messageTag;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private String xml;
        private final List<Cookie> cookies = new ArrayList<>();

        private Builder() {
        }

        public Builder message(Map<String, ?> message) {
            this.message.clear();
            if (message != null) {
                this.message.putAll(message);
            }
            return this;
        }

        public Builder soapAction(String soapAction) {
            this.soapAction = soapAction;
            return this;
        }

        public Builder soapHeader(Map<String, ?> soapHeader) {
            this.soapHeader.clear();
            if (soapHeader != null) {
                this.soapHeader.putAll(soapHeader);
            }
            return this;
        }

        public Builder messageTag(String messageTag) {
            this.messageTag = messageTag;
            return this;
        }

        public Builder attribute(String name, String value) {
            this.attributes.put(name, value);
            return this;
        }

        public Builder xml(String xml) {
            this.xml = xml;
            return this;
        }

        public Builder cookies(Collection<Cookie> cookies) {
            this.cookies.clear();
            if (cookies != null) {
                this.cookies.addAll(cookies);
            }
            return this;
        }

        public Locals build() {
            return new Locals(this);
        }
    }
}
