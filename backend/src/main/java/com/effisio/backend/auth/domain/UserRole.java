package com.effisio.backend.auth.domain;

import java.util.Locale;

/**
 * 사용자 역할.
 * - DB에는 enum name(ADMIN ...)으로 저장한다.
 * - 토큰/RBAC 설정에는 소문자 code(admin ...)를 쓴다.
 */
public enum UserRole {
    ADMIN, MANAGER, USER, VIEWER;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
