package com.effisio.backend.auth.admin.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.effisio.backend.auth.admin.dto.RevokeSessionsResponse;
import com.effisio.backend.auth.admin.dto.UserSessionsResponse;
import com.effisio.backend.auth.admin.service.AdminSessionService;
import com.effisio.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * GET:    /api/v1/admin/users/{userId}/sessions  (users:read)
 * DELETE: /api/v1/admin/users/{userId}/sessions  (admin 역할 + users:write)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/admin/users")
public class AdminSessionController {

    private final AdminSessionService adminSessionService;

    @GetMapping("/{userId}/sessions")
    public UserSessionsResponse sessions(@PathVariable Long userId) {
        return adminSessionService.sessionsOf(userId);
    }

    @DeleteMapping("/{userId}/sessions")
    public RevokeSessionsResponse revokeAll(
            @PathVariable Long userId,
            @AuthenticationPrincipal AuthPrincipal operator
    ) {
        return adminSessionService.revokeAll(userId, operator);
    }
}
