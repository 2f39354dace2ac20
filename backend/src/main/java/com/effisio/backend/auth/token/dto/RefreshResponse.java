package com.effisio.backend.auth.token.dto;

/**
 * /api/v1/auth/refresh 응답 바디
 * - access token: 응답 JSON 바디
 * - refresh token: HttpOnly 쿠키로만 내려간다
 */
public record RefreshResponse(String accessToken, String tokenType, long expiresIn) {

    public static RefreshResponse bearer(String accessToken, long expiresIn) {
        return new RefreshResponse(accessToken, "Bearer", expiresIn);
    }
}
