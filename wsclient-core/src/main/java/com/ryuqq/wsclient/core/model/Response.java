package com.ryuqq.wsclient.core.model;

import java.util.List;

/**
 * 호출 결과.
 *
 * <p>수신 본문, 전송 메타데이터(쿠키, 헤더), 서명 검증 결과를 담습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Response {

    private final RawResponse raw;
    private final VerificationOutcome verification;
    private final SoapFault fault;

    private Response(RawResponse raw, VerificationOutcome verification) {
        if (raw == null) {
            throw new IllegalArgumentException("raw cannot be null");
        }
        if (verification == null) {
            throw new IllegalArgumentException("verification cannot be null");
        }
        this.raw = raw;
        this.verification = verification;
        this.fault = SoapFault.parseOrNull(raw.body());
    }

    /**
     * Response 생성.
     *
     * @param raw 원시 응답
     * @param verification 서명 검증 결과
     * @return Response
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static Response of(RawResponse raw, VerificationOutcome verification) {
        return new Response(raw, verification);
    }

    public RawResponse getRaw() {
        return raw;
    }

    public int status() {
        return raw.status();
    }

    public String body() {
        return raw.body();
    }

    public List<Cookie> cookies() {
        return raw.cookies();
    }

    public VerificationOutcome getVerification() {
        return verification;
    }

    /**
     * 성공 여부.
     *
     * @return 2xx 상태이고 SOAP Fault가 아닌 경우 true
     */
    public boolean isSuccess() {
        return raw.isSuccessful() && fault == null;
    }

    public boolean isSoapFault() {
        return fault != null;
    }

    /**
     * HTTP 오류 여부 (Fault 본문이 없는 비-2xx 응답).
     *
     * @return HTTP 오류인 경우 true
     */
    public boolean isHttpError() {
        return !raw.isSuccessful() && fault == null;
    }

    public SoapFault getFaultOrNull() {
        return fault;
    }

    @Override
    public String toString() {
        return "Response{status=" + raw.status() + ", fault=" + (fault != null)
            + ", verification=" + verification + "}";
    }
}
