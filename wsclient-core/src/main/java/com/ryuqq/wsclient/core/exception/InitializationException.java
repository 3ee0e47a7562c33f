package com.ryuqq.wsclient.core.exception;

/**
 * 클라이언트 생성 실패.
 *
 * <p>생성 단계의 오류는 치명적이며, 부분적으로 초기화된 클라이언트는 반환되지 않습니다.</p>
 *
 * <ul>
 *   <li>{@link ErrorKind#LEGACY_CALL_SHAPE}: 옵션 매핑이 아닌 값으로 생성 시도</li>
 *   <li>{@link ErrorKind#INSUFFICIENT_CONFIGURATION}: WSDL 위치 또는 endpoint + namespace 누락</li>
 *   <li>{@link ErrorKind#UNKNOWN_OPTION}: 알 수 없는 옵션 키 또는 잘못된 값 타입</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InitializationException extends SoapClientException {

    private InitializationException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    /**
     * 옵션 매핑 대신 단일 값이 전달된 경우.
     *
     * @param globals 전달된 값 (null 가능)
     * @return InitializationException (LEGACY_CALL_SHAPE)
     */
    public static InitializationException legacyCallShape(Object globals) {
        String type = globals == null ? "null" : globals.getClass().getName();
        return new InitializationException(ErrorKind.LEGACY_CALL_SHAPE,
            "Some code tries to create a client with " + describe(globals) + " (" + type + ").\n"
                + "The client expects a map of options or a ClientOptions instance, "
                + "e.g. Map.of(\"wsdl\", \"http://example.com?wsdl\") instead of the bare WSDL location.",
            null);
    }

    /**
     * WSDL 위치도, endpoint + namespace 쌍도 없는 경우.
     *
     * @return InitializationException (INSUFFICIENT_CONFIGURATION)
     */
    public static InitializationException insufficientConfiguration() {
        return new InitializationException(ErrorKind.INSUFFICIENT_CONFIGURATION,
            "Expected either a WSDL document or the SOAP endpoint and target namespace options.\n\n"
                + "Map.of(\"wsdl\", \"/Users/me/project/service.wsdl\")                                    // local WSDL document\n"
                + "Map.of(\"wsdl\", \"http://example.com?wsdl\")                                           // remote WSDL document\n"
                + "Map.of(\"endpoint\", \"http://example.com\", \"namespace\", \"http://v1.example.com\")  // no WSDL document",
            null);
    }

    /**
     * 알 수 없는 옵션 키.
     *
     * @param key 옵션 키
     * @return InitializationException (UNKNOWN_OPTION)
     */
    public static InitializationException unknownOption(String key) {
        return new InitializationException(ErrorKind.UNKNOWN_OPTION,
            "Unknown global option: " + key, null);
    }

    /**
     * 옵션 값 타입 불일치.
     *
     * @param key 옵션 키
     * @param expected 기대 타입 설명
     * @param actual 실제 값
     * @return InitializationException (UNKNOWN_OPTION)
     */
    public static InitializationException invalidOption(String key, String expected, Object actual) {
        return new InitializationException(ErrorKind.UNKNOWN_OPTION,
            "Option " + key + " expects " + expected + " but got " + describe(actual), null);
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return "\"" + value + "\"";
        }
        return String.valueOf(value);
    }
}
