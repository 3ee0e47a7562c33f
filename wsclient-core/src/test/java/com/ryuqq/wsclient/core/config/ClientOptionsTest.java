package com.ryuqq.wsclient.core.config;

import com.ryuqq.wsclient.core.exception.ErrorKind;
import com.ryuqq.wsclient.core.exception.InitializationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ClientOptions 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ClientOptionsTest {

    @Test
    void fromMap_endpoint와_namespace만_지정() {
        // when
        ClientOptions options = ClientOptions.fromMap(Map.of(
            "endpoint", "http://svc.example/",
            "namespace", "urn:example"));

        // then
        assertThat(options.hasContractLocation()).isFalse();
        assertThat(options.hasEndpointAndNamespace()).isTrue();
        assertThat(options.endpoint()).contains(URI.create("http://svc.example/"));
        assertThat(options.namespace()).contains("urn:example");
        assertThat(options.adapter()).isEmpty();
    }

    @Test
    void fromMap_기본값_적용() {
        // when
        ClientOptions options = ClientOptions.fromMap(Map.of("wsdl", "service.wsdl"));

        // then
        assertThat(options.contractLocation()).contains("service.wsdl");
        assertThat(options.soapVersion()).isEqualTo(SoapVersion.SOAP_11);
        assertThat(options.envNamespace()).isEqualTo("env");
        assertThat(options.namespaceIdentifier()).isEqualTo("tns");
        assertThat(options.encoding()).isEqualTo("UTF-8");
        assertThat(options.raiseErrors()).isTrue();
        assertThat(options.log()).isFalse();
        assertThat(options.keyConverter()).isEqualTo(KeyConverter.LOWER_CAMELCASE);
        assertThat(options.wsseAuth()).isEmpty();
        assertThat(options.verifyResponse()).isFalse();
    }

    @Test
    void fromMap_전체_옵션_해석() {
        // given
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("contract_location", "classpath:service.wsdl");
        raw.put("adapter", "httpclient5");
        raw.put("soap_version", 2);
        raw.put("headers", Map.of("X-Token", "abc"));
        raw.put("open_timeout", 5);
        raw.put("read_timeout", 1.5);
        raw.put("basic_auth", List.of("user", "secret"));
        raw.put("filters", List.of("password"));
        raw.put("convert_request_keys_to", "none");
        raw.put("wsse_auth", List.of("wsuser", "wspass", "digest"));
        raw.put("wsse_timestamp", true);
        raw.put("verify_response", true);
        raw.put("raise_errors", false);

        // when
        ClientOptions options = ClientOptions.fromMap(raw);

        // then
        assertThat(options.contractLocation()).contains("classpath:service.wsdl");
        assertThat(options.adapter()).contains("httpclient5");
        assertThat(options.soapVersion()).isEqualTo(SoapVersion.SOAP_12);
        assertThat(options.headers()).containsEntry("X-Token", "abc");
        assertThat(options.openTimeout()).contains(Duration.ofSeconds(5));
        assertThat(options.readTimeout()).contains(Duration.ofMillis(1500));
        assertThat(options.basicAuth()).contains(Credentials.of("user", "secret"));
        assertThat(options.filters()).containsExactly("password");
        assertThat(options.keyConverter()).isEqualTo(KeyConverter.NONE);
        assertThat(options.wsseAuth()).contains(Credentials.of("wsuser", "wspass"));
        assertThat(options.wsseDigest()).isTrue();
        assertThat(options.wsseTimestamp()).isTrue();
        assertThat(options.verifyResponse()).isTrue();
        assertThat(options.raiseErrors()).isFalse();
    }

    @Test
    void fromMap_알_수_없는_키는_UNKNOWN_OPTION() {
        assertThatThrownBy(() -> ClientOptions.fromMap(Map.of("wsdl_url", "x")))
            .isInstanceOf(InitializationException.class)
            .hasMessageContaining("wsdl_url")
            .extracting(e -> ((InitializationException) e).kind())
            .isEqualTo(ErrorKind.UNKNOWN_OPTION);
    }

    @Test
    void fromMap_잘못된_값_타입은_UNKNOWN_OPTION() {
        assertThatThrownBy(() -> ClientOptions.fromMap(Map.of("raise_errors", "yes")))
            .isInstanceOf(InitializationException.class)
            .hasMessageContaining("raise_errors")
            .extracting(e -> ((InitializationException) e).kind())
            .isEqualTo(ErrorKind.UNKNOWN_OPTION);
    }

    @Test
    void fromMap_잘못된_soap_version() {
        assertThatThrownBy(() -> ClientOptions.fromMap(Map.of("soap_version", 3)))
            .isInstanceOf(InitializationException.class)
            .hasMessageContaining("1 or 2");
    }

    static Stream<Object> nonMappingValues() {
        return Stream.of("http://example.com?wsdl", 42, List.of("wsdl", "x"), new Object());
    }

    @ParameterizedTest
    @MethodSource("nonMappingValues")
    void from_매핑이_아닌_값은_LEGACY_CALL_SHAPE(Object globals) {
        assertThatThrownBy(() -> ClientOptions.from(globals))
            .isInstanceOf(InitializationException.class)
            .hasMessageContaining("expects a map of options")
            .extracting(e -> ((InitializationException) e).kind())
            .isEqualTo(ErrorKind.LEGACY_CALL_SHAPE);
    }

    @Test
    void from_null도_LEGACY_CALL_SHAPE() {
        assertThatThrownBy(() -> ClientOptions.from(null))
            .isInstanceOf(InitializationException.class)
            .extracting(e -> ((InitializationException) e).kind())
            .isEqualTo(ErrorKind.LEGACY_CALL_SHAPE);
    }

    @Test
    void from_ClientOptions는_그대로_반환() {
        // given
        ClientOptions options = ClientOptions.builder().contractLocation("a.wsdl").build();

        // when & then
        assertThat(ClientOptions.from(options)).isSameAs(options);
    }

    @Test
    void toBuilder_원본은_변경되지_않음() {
        // given
        ClientOptions original = ClientOptions.builder()
            .endpoint("http://svc.example/")
            .header("X-A", "1")
            .build();

        // when
        ClientOptions changed = original.toBuilder()
            .namespace("urn:example")
            .header("X-B", "2")
            .build();

        // then
        assertThat(original.namespace()).isEmpty();
        assertThat(original.headers()).containsOnlyKeys("X-A");
        assertThat(changed.namespace()).contains("urn:example");
        assertThat(changed.headers()).containsOnlyKeys("X-A", "X-B");
    }

    @Test
    void headers_수정_불가() {
        ClientOptions options = ClientOptions.builder().header("X-A", "1").build();

        assertThatThrownBy(() -> options.headers().put("X-B", "2"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
