package com.ryuqq.wsclient.core.model;

import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.config.HttpSettings;
import com.ryuqq.wsclient.core.config.WsseSettings;

/**
 * 요청 하나가 사용하는 전송 상태 스냅샷.
 *
 * <p>{@link #copy()}는 가변 구성요소(HTTP, WS-Security 설정)를 깊은 복사합니다.
 * ClientOptions는 불변이므로 공유합니다.</p>
 *
 * @param http HTTP 설정
 * @param wsse WS-Security 설정
 * @param options 전역 옵션
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TransportState(HttpSettings http, WsseSettings wsse, ClientOptions options) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException 구성요소가 null인 경우
     */
    public TransportState {
        if (http == null) {
            throw new IllegalArgumentException("http cannot be null");
        }
        if (wsse == null) {
            throw new IllegalArgumentException("wsse cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
    }

    /**
     * 전역 옵션에서 초기 상태 생성.
     *
     * @param options 전역 옵션
     * @return 새 TransportState
     */
    public static TransportState from(ClientOptions options) {
        return new TransportState(HttpSettings.from(options), WsseSettings.from(options), options);
    }

    /**
     * 구조적으로 독립된 사본.
     *
     * @return 새 TransportState
     */
    public TransportState copy() {
        return new TransportState(http.copy(), wsse.copy(), options);
    }
}
