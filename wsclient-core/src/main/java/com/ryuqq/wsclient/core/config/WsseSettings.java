package com.ryuqq.wsclient.core.config;

/**
 * WS-Security 설정 (가변).
 *
 * <p>{@link HttpSettings}와 마찬가지로 요청 준비 시 {@link #copy()}된 사본이 요청에 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WsseSettings {

    private Credentials credentials;
    private boolean digest;
    private boolean timestamp;
    private boolean verifyResponse;

    public WsseSettings() {
    }

    private WsseSettings(WsseSettings source) {
        this.credentials = source.credentials;
        this.digest = source.digest;
        this.timestamp = source.timestamp;
        this.verifyResponse = source.verifyResponse;
    }

    /**
     * 전역 옵션에서 초기 설정 생성.
     *
     * @param options 클라이언트 옵션
     * @return 새 WsseSettings
     * @throws IllegalArgumentException options가 null인 경우
     */
    public static WsseSettings from(ClientOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        WsseSettings settings = new WsseSettings();
        settings.credentials = options.wsseAuth().orElse(null);
        settings.digest = options.wsseDigest();
        settings.timestamp = options.wsseTimestamp();
        settings.verifyResponse = options.verifyResponse();
        return settings;
    }

    public WsseSettings copy() {
        return new WsseSettings(this);
    }

    public boolean hasCredentials() {
        return credentials != null;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public void setCredentials(Credentials credentials, boolean digest) {
        this.credentials = credentials;
        this.digest = credentials != null && digest;
    }

    public boolean isDigest() {
        return digest;
    }

    public boolean isTimestamp() {
        return timestamp;
    }

    public void setTimestamp(boolean timestamp) {
        this.timestamp = timestamp;
    }

    public boolean isVerifyResponse() {
        return verifyResponse;
    }

    public void setVerifyResponse(boolean verifyResponse) {
        this.verifyResponse = verifyResponse;
    }

    @Override
    public String toString() {
        return "WsseSettings{credentials=" + credentials + ", digest=" + digest
            + ", timestamp=" + timestamp + ", verifyResponse=" + verifyResponse + "}";
    }
}
