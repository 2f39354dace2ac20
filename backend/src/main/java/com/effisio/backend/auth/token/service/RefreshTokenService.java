package com.effisio.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.effisio.backend.auth.audit.AuditSink;
import com.effisio.backend.auth.audit.domain.AuditAction;
import com.effisio.backend.auth.audit.event.AuthAuditEvent;
import com.effisio.backend.auth.config.AuthProperties;
import com.effisio.backend.auth.domain.User;
import com.effisio.backend.auth.rbac.CapabilitySet;
import com.effisio.backend.auth.repo.UserRepository;
import com.effisio.backend.auth.token.domain.RefreshRevokeReason;
import com.effisio.backend.auth.token.domain.RefreshToken;
import com.effisio.backend.auth.token.dto.SessionResponse;
import com.effisio.backend.auth.token.store.RefreshTokenStore;
import com.effisio.backend.auth.token.support.TokenGenerator;
import com.effisio.backend.global.ApiException;
import com.effisio.backend.global.ErrorCode;
import com.effisio.backend.security.JwtService;
import com.effisio.backend.security.JwtService.InvalidJwtException;
import com.effisio.backend.security.JwtService.RefreshClaims;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 발급 / 로테이션 / 로그아웃 서비스
 *
 * - refresh token = 서명된 JWT(jti = token_id) + 서버 레코드(refresh_tokens)
 * - rotate 시 이전 레코드를 조건부로 ROTATED 폐기하고 후속 레코드를 발급한다.
 * - 폐기된 토큰이 다시 제출되면:
 *     ROTATED 직후 grace 구간 안 -> 중복 요청으로 보고 거절만 한다 (패밀리 유지)
 *     그 밖 -> 탈취 신호: 사용자의 모든 refresh를 REUSE_DETECTED로 폐기 + 감사 이벤트 + 거절
 * - 외부로 나가는 실패는 전부 REFRESH_INVALID 하나. 내부 사유는 로그로만 남긴다.
 *
 * 동시성:
 * - 같은 토큰으로 동시에 두 rotate가 들어와도 조건부 revoke(where revoked = false)가
 *   한쪽만 성공시킨다. 진 쪽은 REFRESH_INVALID.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    private final RefreshTokenStore store;
    private final UserRepository userRepository;

    private final JwtService jwtService;
    private final TokenGenerator tokenGenerator;
    private final AuditSink auditSink;

    private final AuthProperties props;
    private final Clock clock;

    /** 로그인 시 새 refresh 발급 (레코드 저장 + JWT 서명) */
    @Transactional
    public Issued issue(Long userId) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        return persistAndSign(userId, tokenGenerator.generateTokenId(), LocalDateTime.now(clock));
    }

    /**
     * 리프레시 토큰 재발급.
     * 패밀리 폐기(REUSE_DETECTED)는 요청이 실패해도 커밋되어야 하므로 ApiException으로는 롤백하지 않는다.
     */
    @Transactional(noRollbackFor = ApiException.class)
    public RotateResult rotate(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw reject("refresh token missing", null);
        }

        RefreshClaims claims;
        try {
            claims = jwtService.verifyRefreshToken(refreshToken);
        } catch (InvalidJwtException e) {
            throw reject("refresh jwt rejected: " + e.getReason(), null);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Long claimedUserId = claims.userId();
        RefreshToken current = store.findByTokenId(claims.tokenId())
                .orElseThrow(() -> reject("token id not found", claimedUserId));

        if (!current.getUserId().equals(claimedUserId)) {
            throw reject("subject mismatch: record id=" + current.getId(), claimedUserId);
        }

        if (current.isRevoked()) {
            throw onRevokedPresentation(current, now);
        }
        if (current.isExpired(now)) {
            throw reject("record expired: id=" + current.getId(), current.getUserId());
        }

        User user = userRepository.findById(current.getUserId())
                .orElseThrow(() -> reject("owner not found: id=" + current.getId(), current.getUserId()));
        if (!user.isActive()) {
            log.warn("refresh 거부: 비활성 계정. userId={}, status={}", user.getId(), user.getStatus());
            throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
        }

        CapabilitySet caps = jwtService.capabilitiesForRole(user.getRole().code());
        String accessToken = jwtService.issueAccessToken(user.getId(), user.getUsername(), user.getRole().code(), caps);

        if (!props.refresh().rotationEnabled()) {
            // 로테이션 비활성: 같은 refresh를 계속 쓴다. (설정으로 명시적으로 끈 경우만)
            store.touch(current.getTokenId(), now);
            return new RotateResult(accessToken, refreshToken, current.getExpiresAt(), false);
        }

        String successorId = tokenGenerator.generateTokenId();
        if (!store.revoke(current.getTokenId(), RefreshRevokeReason.ROTATED, successorId, now)) {
            // 다른 요청이 방금 같은 토큰을 로테이션했다. 후속 토큰을 두 개 만들지 않는다.
            throw reject("concurrent rotation lost: id=" + current.getId(), current.getUserId());
        }

        Issued next = persistAndSign(user.getId(), successorId, now);
        log.info("refresh 로테이션: userId={}, fromId={}", user.getId(), current.getId());
        return new RotateResult(accessToken, next.token(), next.expiresAt(), true);
    }

    /**
     * 로그아웃 (멱등, best-effort)
     * - 토큰 없음 / 서명 무효 / 미발급 / 이미 폐기 -> 조용히 성공
     */
    @Transactional
    public void logout(String refreshToken, Long callerUserId) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return;
        }

        RefreshClaims claims;
        try {
            claims = jwtService.verifyRefreshToken(refreshToken);
        } catch (InvalidJwtException e) {
            log.debug("logout: 무효 refresh 무시. reason={}", e.getReason());
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        store.findByTokenId(claims.tokenId()).ifPresent(token -> {
            if (store.revoke(token.getTokenId(), RefreshRevokeReason.LOGOUT, null, now)) {
                Long userId = (callerUserId != null) ? callerUserId : token.getUserId();
                auditSink.record(AuthAuditEvent.of(AuditAction.LOGOUT, userId, null, "sessionId=" + token.getId()));
                log.info("logout: userId={}, sessionId={}", token.getUserId(), token.getId());
            }
        });
    }

    /** 모든 기기에서 로그아웃. 바뀐 세션 수를 돌려준다. */
    @Transactional
    public int logoutAll(Long userId, String initiatedBy) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");

        int revoked = store.revokeAllForUser(userId, RefreshRevokeReason.LOGOUT_ALL, LocalDateTime.now(clock));
        auditSink.record(AuthAuditEvent.of(AuditAction.LOGOUT_ALL, userId, null,
                "revokedSessions=" + revoked + ", by=" + initiatedBy));
        log.info("logout-all: userId={}, revokedSessions={}, by={}", userId, revoked, initiatedBy);
        return revoked;
    }

    @Transactional(readOnly = true)
    public List<SessionResponse> activeSessions(Long userId) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        return store.findActiveByUser(userId, LocalDateTime.now(clock)).stream()
                .map(SessionResponse::from)
                .toList();
    }

    private RuntimeException onRevokedPresentation(RefreshToken current, LocalDateTime now) {
        AuthProperties.Refresh policy = props.refresh();

        if (policy.rotationEnabled() && current.isWithinReuseGrace(now, policy.reuseGraceSeconds())) {
            // 동시 요청/클라이언트 재시도로 보이는 구간: 거절만 하고 패밀리는 유지
            return reject("rotated token resubmitted within grace: id=" + current.getId(), current.getUserId());
        }

        int revoked = store.revokeAllForUser(current.getUserId(), RefreshRevokeReason.REUSE_DETECTED, now);
        log.warn("refresh 재사용 탐지: userId={}, sessionId={}, previousReason={}, revokedSessions={}",
                current.getUserId(), current.getId(), current.getRevokeReason(), revoked);
        auditSink.record(AuthAuditEvent.of(
                AuditAction.REFRESH_REUSE_DETECTED,
                current.getUserId(),
                null,
                "sessionId=" + current.getId() + ", previousReason=" + current.getRevokeReason()
                        + ", revokedSessions=" + revoked
        ));
        return new ApiException(ErrorCode.REFRESH_INVALID);
    }

    private Issued persistAndSign(Long userId, String tokenId, LocalDateTime now) {
        LocalDateTime expiresAt = now.plusSeconds(props.jwt().refreshTtlSeconds());
        store.create(RefreshToken.issue(userId, tokenId, now, expiresAt));
        return new Issued(jwtService.issueRefreshToken(userId, tokenId), expiresAt);
    }

    private static ApiException reject(String internalReason, Long userId) {
        log.warn("refresh 거부: reason={}, userId={}", internalReason, userId);
        return new ApiException(ErrorCode.REFRESH_INVALID);
    }

    public record Issued(String token, LocalDateTime expiresAt) {}

    /** rotated=false 이면 token은 요청에 쓰인 refresh 그대로다. (로테이션 비활성) */
    public record RotateResult(String accessToken, String refreshToken, LocalDateTime refreshExpiresAt, boolean rotated) {}
}
