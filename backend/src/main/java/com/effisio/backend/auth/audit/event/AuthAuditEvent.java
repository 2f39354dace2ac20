package com.effisio.backend.auth.audit.event;

import com.effisio.backend.auth.audit.domain.AuditAction;

/**
 * 인증 감사 이벤트. 서비스는 HTTP를 모르므로 ip/userAgent는 AuditSink 구현체가 채운다.
 */
public record AuthAuditEvent(
        AuditAction action,
        Long userId,
        String username,
        String detail,
        String ipAddress,
        String userAgent
) {
    public static AuthAuditEvent of(AuditAction action, Long userId, String username, String detail) {
        return new AuthAuditEvent(action, userId, username, detail, null, null);
    }

    public AuthAuditEvent withClient(String ipAddress, String userAgent) {
        return new AuthAuditEvent(action, userId, username, detail, ipAddress, userAgent);
    }
}
