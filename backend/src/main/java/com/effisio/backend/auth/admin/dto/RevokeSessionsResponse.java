package com.effisio.backend.auth.admin.dto;

public record RevokeSessionsResponse(Long userId, int revokedSessions) {}
