package com.effisio.backend.auth.audit.domain;

public enum AuditAction {
    LOGIN_SUCCESS,
    LOGIN_FAILURE,
    LOGOUT,
    LOGOUT_ALL,
    REFRESH_REUSE_DETECTED
}
