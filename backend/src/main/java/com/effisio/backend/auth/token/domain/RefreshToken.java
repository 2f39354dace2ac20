package com.effisio.backend.auth.token.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * refresh_tokens 테이블 매핑 엔티티 (서버가 관리하는 로그인 세션)
 *
 * - Access Token(JWT)은 서버에 저장하지 않음(Stateless)
 * - Refresh Token은 서명된 JWT 안에 token_id(jti)를 싣고, 서버는 token_id로 상태를 관리한다.
 *
 * 불변 조건:
 * 1) token_id는 전역 유일 (unique index)
 * 2) revoked가 한 번 true가 되면 다시 false가 되지 않는다.
 *    상태 전이는 RefreshTokenStore의 조건부 UPDATE(... where revoked = false)로만 일어난다.
 * 3) ROTATED 폐기는 replaced_by_token_id에 후속 토큰을 남긴다. (포렌식용)
 */
@Getter
@Entity
@Table(
    name = "refresh_tokens",
    indexes = {
        @Index(name = "uq_refresh_token_id", columnList = "token_id", unique = true),
        @Index(name = "idx_refresh_user_id", columnList = "user_id"),
        @Index(name = "idx_refresh_expires_at", columnList = "expires_at")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA가 리플렉션으로 객체 생성
public class RefreshToken {

    public static final int TOKEN_ID_MAX = 64;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "token_id", nullable = false, length = TOKEN_ID_MAX)
    private String tokenId;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(nullable = false)
    private boolean revoked;

    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "revoke_reason", length = 30)
    private RefreshRevokeReason revokeReason;

    @Column(name = "replaced_by_token_id", length = TOKEN_ID_MAX)
    private String replacedByTokenId;

    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    // ========= factory =========

    public static RefreshToken issue(Long userId, String tokenId, LocalDateTime now, LocalDateTime expiresAt) {
        require(userId != null, "userId must not be null");
        require(tokenId != null && !tokenId.isBlank(), "tokenId must not be blank");
        require(tokenId.length() <= TOKEN_ID_MAX, "tokenId too long");
        require(now != null, "now must not be null");
        require(expiresAt != null, "expiresAt must not be null");

        RefreshToken rt = new RefreshToken();
        rt.userId = userId;
        rt.tokenId = tokenId;
        rt.createdAt = now;
        rt.expiresAt = expiresAt;
        rt.revoked = false;
        return rt;
    }

    // ========= domain =========

    public boolean isExpired(LocalDateTime now) {
        Objects.requireNonNull(now, "now must not be null");
        return !expiresAt.isAfter(now);
    }

    public boolean isRotated() {
        return revoked && revokeReason == RefreshRevokeReason.ROTATED;
    }

    /** ROTATED 폐기 후 grace 구간 안인지. (revokedAt + grace > now) */
    public boolean isWithinReuseGrace(LocalDateTime now, long graceSeconds) {
        Objects.requireNonNull(now, "now must not be null");
        if (!isRotated() || revokedAt == null || graceSeconds <= 0) return false;
        return now.isBefore(revokedAt.plusSeconds(graceSeconds));
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
