package com.ryuqq.wsclient.core.config;

/**
 * 사용자 이름/비밀번호 쌍.
 *
 * <p>{@link #toString()}은 비밀번호를 노출하지 않습니다.</p>
 *
 * @param username 사용자 이름
 * @param password 비밀번호
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Credentials(String username, String password) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException username 또는 password가 null인 경우
     */
    public Credentials {
        if (username == null) {
            throw new IllegalArgumentException("username cannot be null");
        }
        if (password == null) {
            throw new IllegalArgumentException("password cannot be null");
        }
    }

    public static Credentials of(String username, String password) {
        return new Credentials(username, password);
    }

    @Override
    public String toString() {
        return "Credentials{username=" + username + ", password=***}";
    }
}
