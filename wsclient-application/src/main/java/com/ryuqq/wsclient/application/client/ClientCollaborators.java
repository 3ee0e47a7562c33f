package com.ryuqq.wsclient.application.client;

import com.ryuqq.wsclient.core.spi.ContractResolver;
import com.ryuqq.wsclient.core.spi.RequestBuilder;
import com.ryuqq.wsclient.core.spi.SignatureVerifier;
import com.ryuqq.wsclient.core.spi.Transport;

/**
 * 클라이언트가 위임하는 외부 협력자 묶음.
 *
 * @param contractResolver 계약 해석기
 * @param requestBuilder 요청 빌더
 * @param transport 전송 계층
 * @param signatureVerifier 응답 서명 검증기
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ClientCollaborators(
    ContractResolver contractResolver,
    RequestBuilder requestBuilder,
    Transport transport,
    SignatureVerifier signatureVerifier
) {

    public ClientCollaborators {
        if (contractResolver == null) {
            throw new IllegalArgumentException("contractResolver cannot be null");
        }
        if (requestBuilder == null) {
            throw new IllegalArgumentException("requestBuilder cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (signatureVerifier == null) {
            throw new IllegalArgumentException("signatureVerifier cannot be null");
        }
    }
}
