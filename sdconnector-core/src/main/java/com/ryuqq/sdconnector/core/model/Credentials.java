package com.ryuqq.sdconnector.core.model;

/**
 * SD 서비스 인증 정보 (HTTP Basic).
 *
 * <p>username/password 쌍이 같으면 같은 Credentials로 취급되어
 * 세션 캐시의 키로 사용됩니다. {@link #toString()}은 비밀번호를 노출하지 않습니다.</p>
 *
 * @param username SD 사용자 이름
 * @param password SD 비밀번호
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public record Credentials(String username, String password) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException username이 null/빈 문자열이거나 password가 null인 경우
     */
    public Credentials {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username cannot be null or blank");
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
