package com.effisio.backend.auth.admin.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.effisio.backend.auth.admin.dto.RevokeSessionsResponse;
import com.effisio.backend.auth.admin.dto.UserSessionsResponse;
import com.effisio.backend.auth.domain.User;
import com.effisio.backend.auth.repo.UserRepository;
import com.effisio.backend.auth.token.service.RefreshTokenService;
import com.effisio.backend.global.ApiException;
import com.effisio.backend.global.ErrorCode;
import com.effisio.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * 관리자용 세션 조회/강제 로그아웃
 *
 * 권한 검사는 SecurityConfig(CapabilityGate)에서 끝난 상태로 들어온다.
 * 여기서는 대상 사용자 존재 여부만 본다.
 */
@Service
@RequiredArgsConstructor
public class AdminSessionService {

    private final UserRepository userRepository;
    private final RefreshTokenService refreshTokenService;

    @Transactional(readOnly = true)
    public UserSessionsResponse sessionsOf(Long userId) {
        User user = loadUserOrThrow(userId);
        return new UserSessionsResponse(user.getId(), user.getUsername(), refreshTokenService.activeSessions(user.getId()));
    }

    @Transactional
    public RevokeSessionsResponse revokeAll(Long userId, AuthPrincipal operator) {
        User user = loadUserOrThrow(userId);
        int revoked = refreshTokenService.logoutAll(user.getId(), "admin:" + operator.userId());
        return new RevokeSessionsResponse(user.getId(), revoked);
    }

    private User loadUserOrThrow(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));
    }
}
