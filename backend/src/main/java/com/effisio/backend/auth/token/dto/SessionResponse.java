package com.effisio.backend.auth.token.dto;

import java.time.LocalDateTime;

import com.effisio.backend.auth.token.domain.RefreshToken;

/**
 * 활성 세션(폐기/만료되지 않은 refresh 레코드) 조회 응답.
 * token_id는 refresh JWT 안에 실리는 값이라 절대 내보내지 않는다.
 */
public record SessionResponse(
        Long sessionId,
        LocalDateTime createdAt,
        LocalDateTime lastUsedAt,
        LocalDateTime expiresAt
) {
    public static SessionResponse from(RefreshToken token) {
        return new SessionResponse(token.getId(), token.getCreatedAt(), token.getLastUsedAt(), token.getExpiresAt());
    }
}
