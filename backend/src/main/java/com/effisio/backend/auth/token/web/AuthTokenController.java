package com.effisio.backend.auth.token.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.effisio.backend.auth.config.AuthProperties;
import com.effisio.backend.auth.token.dto.RefreshResponse;
import com.effisio.backend.auth.token.service.RefreshTokenService;
import com.effisio.backend.auth.token.service.RefreshTokenService.RotateResult;
import com.effisio.backend.auth.token.support.AuthCookieUtils;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * POST: /api/v1/auth/refresh
 *
 * HttpOnly 쿠키의 refresh token으로 재발급한다.
 * - 성공: 새 refresh 쿠키 + 새 access token(바디)
 * - 실패: 사유와 무관하게 401 REFRESH_INVALID (계정 비활성만 403 ACCOUNT_DISABLED)
 * 클라이언트가 이 요청을 자동 재시도하면 안 된다. (경합 패배 경로로 빠진다)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/auth")
public class AuthTokenController {

    private final RefreshTokenService refreshTokenService;
    private final AuthCookieUtils cookieUtils;
    private final AuthProperties props;

    @PostMapping("/refresh")
    public RefreshResponse refresh(HttpServletRequest request, HttpServletResponse response) {
        String refreshToken = cookieUtils.readRefreshCookie(request);

        RotateResult result = refreshTokenService.rotate(refreshToken);

        cookieUtils.setRefreshCookie(response, result.refreshToken(), result.refreshExpiresAt());
        return RefreshResponse.bearer(result.accessToken(), props.jwt().accessTtlSeconds());
    }
}
