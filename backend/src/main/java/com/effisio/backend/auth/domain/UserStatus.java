package com.effisio.backend.auth.domain;

/** ACTIVE만 로그인/토큰 재발급 허용 */
public enum UserStatus {
    ACTIVE, INACTIVE, SUSPENDED
}
