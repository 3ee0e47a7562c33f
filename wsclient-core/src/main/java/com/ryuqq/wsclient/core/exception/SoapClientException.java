package com.ryuqq.wsclient.core.exception;

/**
 * 클라이언트 오류의 공통 상위 타입.
 *
 * <p>비검사 예외이며, {@link #kind()}로 오류 종류를 식별합니다.
 * 컨트롤러는 협력자(Resolver, Builder, Transport, Verifier)가 던진 예외를
 * 감싸지 않고 그대로 전파합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class SoapClientException extends RuntimeException {

    private final ErrorKind kind;

    protected SoapClientException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    protected SoapClientException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    /**
     * 오류 종류 조회.
     *
     * @return 오류 종류 (non-null)
     */
    public ErrorKind kind() {
        return kind;
    }
}
