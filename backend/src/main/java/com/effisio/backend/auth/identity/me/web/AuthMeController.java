package com.effisio.backend.auth.identity.me.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.effisio.backend.auth.identity.me.dto.MeResponse;
import com.effisio.backend.auth.identity.me.service.MeService;
import com.effisio.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * [내 정보 조회 API 컨트롤러]
 *
 * - JwtAuthenticationFilter가 Access Token을 검증하면 principal(AuthPrincipal)이 주입된다.
 * - 이 경로는 REQUIRED 체인이라 인증 없이는 여기까지 오지 않는다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/auth")
public class AuthMeController {

    private final MeService meService;

    @GetMapping("/me")
    public MeResponse me(@AuthenticationPrincipal AuthPrincipal principal) {
        return meService.me(principal);
    }
}
