package com.effisio.backend.auth.token.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.effisio.backend.auth.token.service.RefreshTokenService;
import com.effisio.backend.auth.token.support.AuthCookieUtils;
import com.effisio.backend.security.AuthPrincipal;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * POST: /api/v1/auth/logout      (optional 인증: principal이 있으면 감사 로그에 남긴다)
 * POST: /api/v1/auth/logout-all  (인증 필요: 내 모든 refresh 폐기)
 *
 * 둘 다 멱등이고 항상 204 + refresh 쿠키 삭제.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/auth")
public class AuthLogoutController {

    private final RefreshTokenService refreshTokenService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(
            @AuthenticationPrincipal AuthPrincipal principal,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        String refreshToken = cookieUtils.readRefreshCookie(request);
        refreshTokenService.logout(refreshToken, principal == null ? null : principal.userId());
        cookieUtils.clearRefreshCookie(response);
    }

    @PostMapping("/logout-all")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logoutAll(@AuthenticationPrincipal AuthPrincipal principal, HttpServletResponse response) {
        refreshTokenService.logoutAll(principal.userId(), "self");
        cookieUtils.clearRefreshCookie(response);
    }
}
