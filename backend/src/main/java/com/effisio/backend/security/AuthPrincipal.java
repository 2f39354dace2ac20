package com.effisio.backend.security;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import com.effisio.backend.auth.rbac.CapabilitySet;

/**
 * SecurityContext에 저장되는 "인증된 사용자"(Principal).
 *
 * - JwtAuthenticationFilter가 access token 검증 성공 시 만든다.
 * - 컨트롤러는 @AuthenticationPrincipal 로, CapabilityGate는 Authentication#getPrincipal 로 꺼내 쓴다.
 * - capabilities는 토큰 발급 시점의 스냅샷이다. (요청마다 DB를 보지 않는다)
 */
public record AuthPrincipal(Long userId, String username, String role, CapabilitySet capabilities) {

    public AuthPrincipal {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (role == null || role.isBlank()) throw new IllegalArgumentException("role must not be blank");
        if (capabilities == null) capabilities = CapabilitySet.EMPTY;
    }

    public static AuthPrincipal from(JwtService.AccessClaims claims) {
        return new AuthPrincipal(claims.userId(), claims.username(), claims.role(), claims.capabilities());
    }

    public boolean hasPermission(String permission) {
        return capabilities.contains(permission);
    }

    public boolean hasRole(String roleName) {
        return roleName != null && role.equalsIgnoreCase(roleName.strip());
    }

    /** Spring Security 권한 목록: ROLE_<ROLE> + 권한 문자열 그대로 */
    public List<GrantedAuthority> authorities() {
        List<GrantedAuthority> list = new ArrayList<>(capabilities.size() + 1);
        list.add(new SimpleGrantedAuthority("ROLE_" + role.toUpperCase(Locale.ROOT)));
        capabilities.names().forEach(p -> list.add(new SimpleGrantedAuthority(p)));
        return list;
    }
}
