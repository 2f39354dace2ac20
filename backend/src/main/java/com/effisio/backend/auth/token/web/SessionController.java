package com.effisio.backend.auth.token.web;

import java.util.List;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.effisio.backend.auth.token.dto.SessionResponse;
import com.effisio.backend.auth.token.service.RefreshTokenService;
import com.effisio.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/** GET: /api/v1/auth/sessions  내 활성 세션 목록 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/auth")
public class SessionController {

    private final RefreshTokenService refreshTokenService;

    @GetMapping("/sessions")
    public List<SessionResponse> mySessions(@AuthenticationPrincipal AuthPrincipal principal) {
        return refreshTokenService.activeSessions(principal.userId());
    }
}
