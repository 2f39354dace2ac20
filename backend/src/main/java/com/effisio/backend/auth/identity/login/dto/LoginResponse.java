package com.effisio.backend.auth.identity.login.dto;

import com.effisio.backend.auth.identity.me.dto.MeResponse;

/**
 * 로그인 응답 DTO
 *
 * - accessToken: 응답 바디(JSON)로 반환
 * - refreshToken: 응답 바디에 넣지 않고 HttpOnly 쿠키(Set-Cookie)로 반환
 *   : Set-Cookie: EF_REFRESH={refreshToken}; HttpOnly; SameSite=Lax; Path=/api/v1/auth; Max-Age=...
 */
public record LoginResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        MeResponse user
) {
    public static LoginResponse bearer(String accessToken, long expiresIn, MeResponse user) {
        return new LoginResponse(accessToken, "Bearer", expiresIn, user);
    }
}
