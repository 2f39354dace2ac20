package com.effisio.backend.auth.admin.dto;

import java.util.List;

import com.effisio.backend.auth.token.dto.SessionResponse;

public record UserSessionsResponse(Long userId, String username, List<SessionResponse> sessions) {}
