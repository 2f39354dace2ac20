package com.effisio.backend.auth.identity.me.dto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

import com.effisio.backend.auth.domain.User;
import com.effisio.backend.auth.rbac.CapabilitySet;

public record MeResponse(
        Long userId,
        String username,
        String email,
        String fullName,
        String department,
        String role,
        String status,
        List<String> permissions,
        LocalDateTime lastLoginAt
) {

    /**
     * User 엔티티 + 권한 스냅샷 -> 응답 DTO 변환 팩토리
     * - role은 소문자 코드("manager"), permissions는 이름순 정렬.
     */
    public static MeResponse from(User user, CapabilitySet capabilities) {
        Objects.requireNonNull(user, "user must not be null");
        CapabilitySet caps = capabilities == null ? CapabilitySet.EMPTY : capabilities;

        return new MeResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getFullName(),
                user.getDepartment(),
                user.getRole().code(),
                user.getStatus().name(),
                caps.names(),
                user.getLastLoginAt()
        );
    }
}
