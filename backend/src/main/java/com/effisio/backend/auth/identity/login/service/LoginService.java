package com.effisio.backend.auth.identity.login.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.effisio.backend.auth.audit.AuditSink;
import com.effisio.backend.auth.audit.domain.AuditAction;
import com.effisio.backend.auth.audit.event.AuthAuditEvent;
import com.effisio.backend.auth.domain.User;
import com.effisio.backend.auth.identity.me.dto.MeResponse;
import com.effisio.backend.auth.rbac.CapabilitySet;
import com.effisio.backend.auth.repo.UserRepository;
import com.effisio.backend.auth.token.service.RefreshTokenService;
import com.effisio.backend.auth.token.service.RefreshTokenService.Issued;
import com.effisio.backend.global.ApiException;
import com.effisio.backend.global.ErrorCode;
import com.effisio.backend.security.JwtService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 유스케이스
 *
 * 계약:
 * - "사용자 없음"과 "비밀번호 불일치"는 동일 에러(INVALID_CREDENTIALS)로 처리한다.
 *   계정 유무를 추측하기 어렵게 하기 위함.
 * - ACTIVE 계정만 로그인 허용(그 외는 ACCOUNT_DISABLED).
 * - 성공 시 access token(바디) + refresh token(쿠키용)을 발급하고 last_login_at을 갱신한다.
 * - 성공/실패 모두 감사 이벤트를 남긴다. (실패는 트랜잭션이 롤백되어도 남는다)
 *
 * 토큰 발급:
 * 1) JwtService: Access Token. role에서 펼친 권한 스냅샷을 클레임에 싣는다.
 * 2) RefreshTokenService: Refresh Token 레코드 저장 + 서명
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    private final JwtService jwtService;
    private final RefreshTokenService refreshTokenService;
    private final AuditSink auditSink;

    private final Clock clock;

    @Transactional
    public LoginResult login(String rawUsername, String rawPassword) {
        // 컨트롤러 @Valid가 있어도 서비스는 한 번 더 체크한다.
        if (isBlank(rawUsername) || isBlank(rawPassword)) {
            throw failure(null, rawUsername, "blank credentials", ErrorCode.INVALID_CREDENTIALS);
        }

        String username = rawUsername.strip();

        /*
         * 1) 사용자 조회 + 비밀번호 매칭
         * 2) 계정 상태 검사
         * 3) User는 영속 상태이므로 recordLogin()은 더티체킹으로 커밋 시점에 반영된다.
         */
        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> failure(null, username, "unknown username", ErrorCode.INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            throw failure(user.getId(), username, "bad password", ErrorCode.INVALID_CREDENTIALS);
        }

        if (!user.isActive()) {
            throw failure(user.getId(), username, "status=" + user.getStatus(), ErrorCode.ACCOUNT_DISABLED);
        }

        String role = user.getRole().code();
        CapabilitySet caps = jwtService.capabilitiesForRole(role);

        String accessToken = jwtService.issueAccessToken(user.getId(), user.getUsername(), role, caps);
        Issued refresh = refreshTokenService.issue(user.getId());

        user.recordLogin(LocalDateTime.now(clock));
        auditSink.record(AuthAuditEvent.of(AuditAction.LOGIN_SUCCESS, user.getId(), user.getUsername(), null));
        log.info("login 성공: userId={}, role={}", user.getId(), role);

        return new LoginResult(accessToken, refresh.token(), refresh.expiresAt(), MeResponse.from(user, caps));
    }

    private ApiException failure(Long userId, String username, String reason, ErrorCode errorCode) {
        log.info("login 실패: username={}, reason={}", username, reason);
        auditSink.record(AuthAuditEvent.of(AuditAction.LOGIN_FAILURE, userId, username, reason));
        return new ApiException(errorCode);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // 컨트롤러가 HTTP 응답으로 변환하기 위한 서비스 내부 결과.
    public record LoginResult(
            String accessToken,
            String refreshToken,
            LocalDateTime refreshExpiresAt,
            MeResponse user
    ) {}
}
