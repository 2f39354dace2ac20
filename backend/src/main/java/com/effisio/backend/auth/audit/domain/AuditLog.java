package com.effisio.backend.auth.audit.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * audit_logs 테이블. 인증 이벤트의 append-only 기록.
 * user_id는 FK를 걸지 않는다. (사용자가 삭제돼도 기록은 남아야 한다)
 */
@Getter
@Entity
@Table(
    name = "audit_logs",
    indexes = {
        @Index(name = "idx_audit_user_id", columnList = "user_id"),
        @Index(name = "idx_audit_created_at", columnList = "created_at")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditLog {

    public static final int DETAIL_MAX = 500;
    public static final int USER_AGENT_MAX = 255;
    public static final int IP_ADDRESS_MAX = 45;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id")
    private Long userId;

    @Column(length = 50)
    private String username;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private AuditAction action;

    @Column(length = DETAIL_MAX)
    private String detail;

    @Column(name = "ip_address", length = IP_ADDRESS_MAX)
    private String ipAddress;

    @Column(name = "user_agent", length = USER_AGENT_MAX)
    private String userAgent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static AuditLog of(
            AuditAction action,
            Long userId,
            String username,
            String detail,
            String ipAddress,
            String userAgent,
            LocalDateTime createdAt
    ) {
        if (action == null) throw new IllegalArgumentException("action must not be null");
        if (createdAt == null) throw new IllegalArgumentException("createdAt must not be null");

        AuditLog a = new AuditLog();
        a.action = action;
        a.userId = userId;
        a.username = trimToNullAndMax(username, 50);
        a.detail = trimToNullAndMax(detail, DETAIL_MAX);
        a.ipAddress = trimToNullAndMax(ipAddress, IP_ADDRESS_MAX);
        a.userAgent = trimToNullAndMax(userAgent, USER_AGENT_MAX);
        a.createdAt = createdAt;
        return a;
    }

    private static String trimToNullAndMax(String v, int max) {
        if (v == null) return null;
        String t = v.trim();
        if (t.isEmpty()) return null;
        return t.length() <= max ? t : t.substring(0, max);
    }
}
