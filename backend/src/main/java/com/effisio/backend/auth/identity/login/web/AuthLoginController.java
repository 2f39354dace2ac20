package com.effisio.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.effisio.backend.auth.config.AuthProperties;
import com.effisio.backend.auth.identity.login.dto.LoginRequest;
import com.effisio.backend.auth.identity.login.dto.LoginResponse;
import com.effisio.backend.auth.identity.login.service.LoginService;
import com.effisio.backend.auth.identity.login.service.LoginService.LoginResult;
import com.effisio.backend.auth.token.support.AuthCookieUtils;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 로그인 API
 *
 * - 요청(JSON) 검증: @Valid DTO
 * - 핵심 로직: 서비스로 위임(인증/정책/토큰 발급)
 * - 응답 변환:
 *   - accessToken: 바디
 *   - refreshToken: HttpOnly 쿠키
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/auth")
public class AuthLoginController {

    private final LoginService loginService;
    private final AuthCookieUtils cookieUtils;
    private final AuthProperties props;

    @PostMapping("/login")
    public LoginResponse login(@Valid @RequestBody LoginRequest req, HttpServletResponse response) {
        LoginResult result = loginService.login(req.username(), req.password());

        cookieUtils.setRefreshCookie(response, result.refreshToken(), result.refreshExpiresAt());
        return LoginResponse.bearer(result.accessToken(), props.jwt().accessTtlSeconds(), result.user());
    }
}
