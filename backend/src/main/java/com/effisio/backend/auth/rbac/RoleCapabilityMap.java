package com.effisio.backend.auth.rbac;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.effisio.backend.auth.domain.UserRole;

import lombok.extern.slf4j.Slf4j;

/**
 * 역할(role code) -> 권한 집합 매핑. 부팅 시 한 번 만들고 이후 읽기 전용.
 *
 * - 모르는 역할은 빈 집합을 돌려준다. (예외 없음)
 * - 키는 소문자 role code ("admin", "manager", ...)
 */
@Slf4j
@Component
public class RoleCapabilityMap {

    private final Map<String, CapabilitySet> byRole;

    @Autowired
    public RoleCapabilityMap(RbacProperties props) {
        this(props.roles());
    }

    public RoleCapabilityMap(Map<String, List<String>> roles) {
        Map<String, CapabilitySet> m = new HashMap<>();
        if (roles != null) {
            roles.forEach((role, perms) -> m.put(normalize(role), CapabilitySet.ofNames(perms)));
        }
        this.byRole = Collections.unmodifiableMap(m);

        for (UserRole r : UserRole.values()) {
            CapabilitySet caps = byRole.get(r.code());
            if (caps == null) {
                log.warn("RBAC 설정에 역할이 없습니다. 빈 권한으로 취급합니다. role={}", r.code());
            } else if (caps.isEmpty()) {
                log.info("권한이 없는 역할: role={} (인증만 필요한 경로만 접근 가능)", r.code());
            }
        }
        log.info("RBAC 매핑 로드 완료: roles={}", byRole.keySet());
    }

    public CapabilitySet forRole(String role) {
        if (role == null || role.isBlank()) return CapabilitySet.EMPTY;
        return byRole.getOrDefault(normalize(role), CapabilitySet.EMPTY);
    }

    private static String normalize(String role) {
        return role.strip().toLowerCase(Locale.ROOT);
    }
}
