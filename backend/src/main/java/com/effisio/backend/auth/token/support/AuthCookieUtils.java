package com.effisio.backend.auth.token.support;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import com.effisio.backend.auth.config.AuthProperties;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Refresh Token 쿠키 유틸
 *
 * - refresh token은 HttpOnly 쿠키로만 내려 JS 접근을 막는다(XSS 완화).
 * - cookie 옵션(path/samesite/secure/maxAge)을 한 곳에서 통일한다.
 * - Max-Age는 서버 레코드의 expires_at까지 남은 시간이다.
 */
@Component
@RequiredArgsConstructor
public class AuthCookieUtils {

    private final AuthProperties props;
    private final Clock clock;

    /** Refresh 쿠키 읽기 (없으면 null) */
    public String readRefreshCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null || cookies.length == 0) return null;

        String cookieName = props.refresh().cookieName();

        return Arrays.stream(cookies)
                .filter(c -> cookieName.equals(c.getName()))
                .map(Cookie::getValue)
                .map(v -> v == null ? null : v.trim())
                .filter(v -> v != null && !v.isBlank())
                .findFirst()
                .orElse(null);
    }

    public void setRefreshCookie(HttpServletResponse response, String refreshToken, LocalDateTime expiresAt) {
        if (refreshToken == null || refreshToken.isBlank()) return;

        long seconds = Math.max(0L, Duration.between(LocalDateTime.now(clock), expiresAt).getSeconds());
        ResponseCookie cookie = baseRefreshCookie(refreshToken)
                .maxAge(Duration.ofSeconds(seconds))
                .build();

        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    /** Refresh 쿠키 삭제 (속성(path/sameSite/secure)이 같아야 브라우저가 제대로 삭제함) */
    public void clearRefreshCookie(HttpServletResponse response) {
        ResponseCookie cookie = baseRefreshCookie("")
                .maxAge(Duration.ZERO)
                .build();

        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    private ResponseCookie.ResponseCookieBuilder baseRefreshCookie(String value) {
        AuthProperties.Refresh r = props.refresh();
        return ResponseCookie.from(r.cookieName(), value)
                .httpOnly(true)
                .secure(r.cookieSecure())
                .path(r.cookiePath())
                .sameSite(r.cookieSameSite().name());
    }
}
