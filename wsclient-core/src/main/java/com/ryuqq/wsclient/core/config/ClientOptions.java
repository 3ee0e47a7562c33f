package com.ryuqq.wsclient.core.config;

import com.ryuqq.wsclient.core.exception.InitializationException;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 클라이언트 전역 옵션 (불변).
 *
 * <p>인식되는 모든 옵션은 명시적인 필드로 표현되며, 선택 옵션은 {@link Optional}로 조회합니다.
 * 클라이언트 생성 시 한 번 검증된 후 변경되지 않습니다.</p>
 *
 * <p><strong>생성 방법:</strong></p>
 * <pre>
 * // 빌더
 * ClientOptions options = ClientOptions.builder()
 *     .contractLocation("service.wsdl")
 *     .soapVersion(SoapVersion.SOAP_12)
 *     .build();
 *
 * // snake_case 키 매핑
 * ClientOptions options = ClientOptions.fromMap(Map.of(
 *     "endpoint", "http://svc.example/",
 *     "namespace", "urn:example"));
 * </pre>
 *
 * <p><strong>지원 키:</strong> wsdl(contract_location), endpoint, namespace, adapter, soap_version,
 * env_namespace, namespace_identifier, encoding, headers, open_timeout, read_timeout, basic_auth,
 * soap_header, raise_errors, log, filters, convert_request_keys_to, wsse_auth, wsse_timestamp,
 * verify_response</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ClientOptions {

    public static final String DEFAULT_ENV_NAMESPACE = "env";
    public static final String DEFAULT_NAMESPACE_IDENTIFIER = "tns";
    public static final String DEFAULT_ENCODING = "UTF-8";

    private final String contractLocation;
    private final URI endpoint;
    private final String namespace;
    private final String adapter;
    private final SoapVersion soapVersion;
    private final String envNamespace;
    private final String namespaceIdentifier;
    private final String encoding;
    private final Map<String, String> headers;
    private final Duration openTimeout;
    private final Duration readTimeout;
    private final Credentials basicAuth;
    private final Map<String, Object> soapHeader;
    private final boolean raiseErrors;
    private final boolean log;
    private final Set<String> filters;
    private final KeyConverter keyConverter;
    private final Credentials wsseAuth;
    private final boolean wsseDigest;
    private final boolean wsseTimestamp;
    private final boolean verifyResponse;

    private ClientOptions(Builder builder) {
        this.contractLocation = builder.contractLocation;
        this.endpoint = builder.endpoint;
        this.namespace = builder.namespace;
        this.adapter = builder.adapter;
        this.soapVersion = builder.soapVersion;
        this.envNamespace = builder.envNamespace;
        this.namespaceIdentifier = builder.namespaceIdentifier;
        this.encoding = builder.encoding;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.openTimeout = builder.openTimeout;
        this.readTimeout = builder.readTimeout;
        this.basicAuth = builder.basicAuth;
        this.soapHeader = Collections.unmodifiableMap(new LinkedHashMap<>(builder.soapHeader));
        this.raiseErrors = builder.raiseErrors;
        this.log = builder.log;
        this.filters = Collections.unmodifiableSet(new LinkedHashSet<>(builder.filters));
        this.keyConverter = builder.keyConverter;
        this.wsseAuth = builder.wsseAuth;
        this.wsseDigest = builder.wsseDigest;
        this.wsseTimestamp = builder.wsseTimestamp;
        this.verifyResponse = builder.verifyResponse;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 현재 값을 복사한 빌더 생성.
     *
     * @return 새 Builder
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * 임의의 값을 옵션으로 해석.
     *
     * <p>ClientOptions는 그대로, Map은 {@link #fromMap(Map)}으로 변환합니다.
     * 그 외의 값(예: WSDL URL 문자열 하나)은 이전 호출 규약으로 간주하여 거부합니다.</p>
     *
     * @param globals 옵션 값
     * @return ClientOptions
     * @throws InitializationException LEGACY_CALL_SHAPE (매핑이 아닌 값), UNKNOWN_OPTION (잘못된 키/값)
     */
    public static ClientOptions from(Object globals) {
        if (globals instanceof ClientOptions) {
            return (ClientOptions) globals;
        }
        if (globals instanceof Map) {
            Map<?, ?> raw = (Map<?, ?>) globals;
            Map<String, Object> options = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : raw.entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw InitializationException.invalidOption(String.valueOf(entry.getKey()), "a string key", entry.getKey());
                }
                options.put((String) entry.getKey(), entry.getValue());
            }
            return fromMap(options);
        }
        throw InitializationException.legacyCallShape(globals);
    }

    /**
     * snake_case 키 매핑에서 옵션 생성.
     *
     * @param options 옵션 매핑
     * @return ClientOptions
     * @throws IllegalArgumentException options가 null인 경우
     * @throws InitializationException UNKNOWN_OPTION (알 수 없는 키 또는 잘못된 값 타입)
     */
    public static ClientOptions fromMap(Map<String, ?> options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        Builder builder = new Builder();
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            apply(builder, entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    private static void apply(Builder builder, String key, Object value) {
        switch (key) {
            case "wsdl":
            case "contract_location":
                builder.contractLocation(string(key, value));
                break;
            case "endpoint":
                builder.endpoint(uri(key, value));
                break;
            case "namespace":
                builder.namespace(string(key, value));
                break;
            case "adapter":
                builder.adapter(string(key, value));
                break;
            case "soap_version":
                builder.soapVersion(soapVersion(key, value));
                break;
            case "env_namespace":
                builder.envNamespace(string(key, value));
                break;
            case "namespace_identifier":
                builder.namespaceIdentifier(string(key, value));
                break;
            case "encoding":
                builder.encoding(string(key, value));
                break;
            case "headers":
                map(key, value).forEach((name, header) -> builder.header(name, String.valueOf(header)));
                break;
            case "open_timeout":
                builder.openTimeout(seconds(key, value));
                break;
            case "read_timeout":
                builder.readTimeout(seconds(key, value));
                break;
            case "basic_auth":
                builder.basicAuth(credentials(key, value));
                break;
            case "soap_header":
                builder.soapHeader(map(key, value));
                break;
            case "raise_errors":
                builder.raiseErrors(bool(key, value));
                break;
            case "log":
                builder.log(bool(key, value));
                break;
            case "filters":
                builder.filters(strings(key, value));
                break;
            case "convert_request_keys_to":
                builder.keyConverter(keyConverter(key, value));
                break;
            case "wsse_auth":
                applyWsseAuth(builder, key, value);
                break;
            case "wsse_timestamp":
                builder.wsseTimestamp(bool(key, value));
                break;
            case "verify_response":
                builder.verifyResponse(bool(key, value));
                break;
            default:
                throw InitializationException.unknownOption(key);
        }
    }

    private static String string(String key, Object value) {
        if (value instanceof CharSequence) {
            return value.toString();
        }
        throw InitializationException.invalidOption(key, "a string", value);
    }

    private static URI uri(String key, Object value) {
        if (value instanceof URI) {
            return (URI) value;
        }
        try {
            return URI.create(string(key, value));
        } catch (IllegalArgumentException e) {
            throw InitializationException.invalidOption(key, "a valid URI", value);
        }
    }

    private static boolean bool(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw InitializationException.invalidOption(key, "a boolean", value);
    }

    private static Duration seconds(String key, Object value) {
        if (value instanceof Duration) {
            return (Duration) value;
        }
        if (value instanceof Number) {
            return Duration.ofMillis(Math.round(((Number) value).doubleValue() * 1000));
        }
        throw InitializationException.invalidOption(key, "a number of seconds", value);
    }

    private static SoapVersion soapVersion(String key, Object value) {
        if (value instanceof SoapVersion) {
            return (SoapVersion) value;
        }
        if (value instanceof Number) {
            try {
                return SoapVersion.of(((Number) value).intValue());
            } catch (IllegalArgumentException e) {
                throw InitializationException.invalidOption(key, "1 or 2", value);
            }
        }
        throw InitializationException.invalidOption(key, "1 or 2", value);
    }

    private static KeyConverter keyConverter(String key, Object value) {
        if (value instanceof KeyConverter) {
            return (KeyConverter) value;
        }
        try {
            return KeyConverter.of(string(key, value));
        } catch (IllegalArgumentException e) {
            throw InitializationException.invalidOption(key, "lower_camelcase, camelcase, upcase or none", value);
        }
    }

    private static Map<String, Object> map(String key, Object value) {
        if (!(value instanceof Map)) {
            throw InitializationException.invalidOption(key, "a map", value);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static Set<String> strings(String key, Object value) {
        if (!(value instanceof Collection)) {
            throw InitializationException.invalidOption(key, "a list of strings", value);
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object element : (Collection<?>) value) {
            result.add(string(key, element));
        }
        return result;
    }

    private static Credentials credentials(String key, Object value) {
        if (value instanceof Credentials) {
            return (Credentials) value;
        }
        List<?> pair = credentialList(key, value);
        return Credentials.of(string(key, pair.get(0)), string(key, pair.get(1)));
    }

    private static void applyWsseAuth(Builder builder, String key, Object value) {
        if (value instanceof Credentials) {
            builder.wsseAuth((Credentials) value, false);
            return;
        }
        List<?> parts = credentialList(key, value);
        boolean digest = parts.size() > 2 && "digest".equals(parts.get(2));
        builder.wsseAuth(Credentials.of(string(key, parts.get(0)), string(key, parts.get(1))), digest);
    }

    private static List<?> credentialList(String key, Object value) {
        if (value instanceof List && ((List<?>) value).size() >= 2) {
            return (List<?>) value;
        }
        throw InitializationException.invalidOption(key, "[username, password]", value);
    }

    public boolean hasContractLocation() {
        return contractLocation != null;
    }

    public boolean hasEndpointAndNamespace() {
        return endpoint != null && namespace != null;
    }

    public Optional<String> contractLocation() {
        return Optional.ofNullable(contractLocation);
    }

    public Optional<URI> endpoint() {
        return Optional.ofNullable(endpoint);
    }

    public Optional<String> namespace() {
        return Optional.ofNullable(namespace);
    }

    public Optional<String> adapter() {
        return Optional.ofNullable(adapter);
    }

    public SoapVersion soapVersion() {
        return soapVersion;
    }

    public String envNamespace() {
        return envNamespace;
    }

    public String namespaceIdentifier() {
        return namespaceIdentifier;
    }

    public String encoding() {
        return encoding;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public Optional<Duration> openTimeout() {
        return Optional.ofNullable(openTimeout);
    }

    public Optional<Duration> readTimeout() {
        return Optional.ofNullable(readTimeout);
    }

    public Optional<Credentials> basicAuth() {
        return Optional.ofNullable(basicAuth);
    }

    public Map<String, Object> soapHeader() {
        return soapHeader;
    }

    public boolean raiseErrors() {
        return raiseErrors;
    }

    public boolean log() {
        return log;
    }

    public Set<String> filters() {
        return filters;
    }

    public KeyConverter keyConverter() {
        return keyConverter;
    }

    public Optional<Credentials> wsseAuth() {
        return Optional.ofNullable(wsseAuth);
    }

    public boolean wsseDigest() {
        return wsseDigest;
    }

    public boolean wsseTimestamp() {
        return wsseTimestamp;
    }

    public boolean verifyResponse() {
        return verifyResponse;
    }

    @Override
    public String toString() {
        return "ClientOptions{contractLocation=" + contractLocation
            + ", endpoint=" + endpoint
            + ", namespace=" + namespace
            + ", adapter=" + adapter
            + ", soapVersion=" + soapVersion + "}";
    }

    /**
     * ClientOptions 빌더.
     *
     * <p>클라이언트 생성 시 사용자 정의 블록({@code Consumer<ClientOptions.Builder>})이
     * 검증 전에 이 빌더를 수정할 수 있습니다.</p>
     */
    public static final class Builder {

        private String contractLocation;
        private URI endpoint;
        private String namespace;
        private String adapter;
        private SoapVersion soapVersion = SoapVersion.SOAP_11;
        private String envNamespace = DEFAULT_ENV_NAMESPACE;
        private String namespaceIdentifier = DEFAULT_NAMESPACE_IDENTIFIER;
        private String encoding = DEFAULT_ENCODING;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Duration openTimeout;
        private Duration readTimeout;
        private Credentials basicAuth;
        private final Map<String, Object> soapHeader = new LinkedHashMap<>();
        private boolean raiseErrors = true;
        private boolean log;
        private final Set<String> filters = new LinkedHashSet<>();
        private KeyConverter keyConverter = KeyConverter.LOWER_CAMELCASE;
        private Credentials wsseAuth;
        private boolean wsseDigest;
        private boolean wsseTimestamp;
        private boolean verifyResponse;

        private Builder() {
        }

        private Builder(ClientOptions source) {
            this.contractLocation = source.contractLocation;
            this.endpoint = source.endpoint;
            this.namespace = source.namespace;
            this.adapter = source.adapter;
            this.soapVersion = source.soapVersion;
            this.envNamespace = source.envNamespace;
            this.namespaceIdentifier = source.namespaceIdentifier;
            this.encoding = source.encoding;
            this.headers.putAll(source.headers);
            this.openTimeout = source.openTimeout;
            this.readTimeout = source.readTimeout;
            this.basicAuth = source.basicAuth;
            this.soapHeader.putAll(source.soapHeader);
            this.raiseErrors = source.raiseErrors;
            this.log = source.log;
            this.filters.addAll(source.filters);
            this.keyConverter = source.keyConverter;
            this.wsseAuth = source.wsseAuth;
            this.wsseDigest = source.wsseDigest;
            this.wsseTimestamp = source.wsseTimestamp;
            this.verifyResponse = source.verifyResponse;
        }

        public Builder contractLocation(String contractLocation) {
            this.contractLocation = contractLocation;
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder endpoint(String endpoint) {
            return endpoint(endpoint == null ? null : URI.create(endpoint));
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder adapter(String adapter) {
            this.adapter = adapter;
            return this;
        }

        public Builder soapVersion(SoapVersion soapVersion) {
            this.soapVersion = requireValue(soapVersion, "soapVersion");
            return this;
        }

        public Builder envNamespace(String envNamespace) {
            this.envNamespace = requireValue(envNamespace, "envNamespace");
            return this;
        }

        public Builder namespaceIdentifier(String namespaceIdentifier) {
            this.namespaceIdentifier = requireValue(namespaceIdentifier, "namespaceIdentifier");
            return this;
        }

        public Builder encoding(String encoding) {
            this.encoding = requireValue(encoding, "encoding");
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(requireValue(name, "header name"), requireValue(value, "header value"));
            return this;
        }

        public Builder openTimeout(Duration openTimeout) {
            this.openTimeout = openTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder basicAuth(Credentials basicAuth) {
            this.basicAuth = basicAuth;
            return this;
        }

        public Builder soapHeader(Map<String, ?> soapHeader) {
            this.soapHeader.clear();
            if (soapHeader != null) {
                this.soapHeader.putAll(soapHeader);
            }
            return this;
        }

        public Builder raiseErrors(boolean raiseErrors) {
            this.raiseErrors = raiseErrors;
            return this;
        }

        public Builder log(boolean log) {
            this.log = log;
            return this;
        }

        public Builder filters(Collection<String> filters) {
            this.filters.clear();
            if (filters != null) {
                this.filters.addAll(filters);
            }
            return this;
        }

        public Builder keyConverter(KeyConverter keyConverter) {
            this.keyConverter = requireValue(keyConverter, "keyConverter");
            return this;
        }

        public Builder wsseAuth(Credentials wsseAuth, boolean digest) {
            this.wsseAuth = wsseAuth;
            this.wsseDigest = wsseAuth != null && digest;
            return this;
        }

        public Builder wsseTimestamp(boolean wsseTimestamp) {
            this.wsseTimestamp = wsseTimestamp;
            return this;
        }

        public Builder verifyResponse(boolean verifyResponse) {
            this.verifyResponse = verifyResponse;
            return this;
        }

        public ClientOptions build() {
            return new ClientOptions(this);
        }

        private static <T> T requireValue(T value, String name) {
            if (value == null) {
                throw new IllegalArgumentException(name + " cannot be null");
            }
            return value;
        }
    }
}
