package com.effisio.backend.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.authorization.AuthorizationManagers;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

import com.effisio.backend.auth.rbac.CapabilitySet;

@DisplayName("[Security] CapabilityGate 인가 규칙")
class CapabilityGateTest {

    private final CapabilityGate gate = new CapabilityGate();
    private final RequestAuthorizationContext ctx = new RequestAuthorizationContext(new MockHttpServletRequest());

    private final AuthPrincipal manager = new AuthPrincipal(1L, "anna", "manager",
            CapabilitySet.of("tasks:read", "tasks:write"));

    @Test
    @DisplayName("requirePermission: 가진 권한이면 허용, 없으면 거부 결정")
    void require_permission() {
        assertThat(decide(gate.requirePermission("tasks:read"), auth(manager))).isTrue();
        assertThat(decide(gate.requirePermission("users:read"), auth(manager))).isFalse();
    }

    @Test
    @DisplayName("requireAnyPermission: 하나라도 있으면 허용")
    void require_any_permission() {
        assertThat(decide(gate.requireAnyPermission("users:read", "tasks:write"), auth(manager))).isTrue();
        assertThat(decide(gate.requireAnyPermission("users:read", "users:write"), auth(manager))).isFalse();
    }

    @Test
    @DisplayName("requireRole / requireAnyRole: 단일 role 문자열과 비교 (대소문자 무시)")
    void require_role() {
        assertThat(decide(gate.requireRole("manager"), auth(manager))).isTrue();
        assertThat(decide(gate.requireRole("MANAGER"), auth(manager))).isTrue();
        assertThat(decide(gate.requireRole("admin"), auth(manager))).isFalse();
        assertThat(decide(gate.requireAnyRole("admin", "manager"), auth(manager))).isTrue();
    }

    @Test
    @DisplayName("principal 없음(익명/null) → 거부 결정이 아니라 인증 예외 (401로 이어진다)")
    void no_identity_is_unauthorized_not_forbidden() {
        Authentication anonymous = new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS"));

        assertThatThrownBy(() -> gate.requirePermission("tasks:read").check(() -> anonymous, ctx))
                .isInstanceOf(AuthenticationCredentialsNotFoundException.class);
        assertThatThrownBy(() -> gate.requireRole("admin").check(() -> null, ctx))
                .isInstanceOf(AuthenticationCredentialsNotFoundException.class);
    }

    @Test
    @DisplayName("allOf 조합: admin 역할 + users:write 둘 다 있어야 허용")
    void composed_rules() {
        AuthorizationManager<RequestAuthorizationContext> rule = AuthorizationManagers.allOf(
                gate.requireAnyRole("admin"), gate.requirePermission("users:write"));

        AuthPrincipal admin = new AuthPrincipal(2L, "boss", "admin", CapabilitySet.of("users:read", "users:write"));
        AuthPrincipal adminWithoutWrite = new AuthPrincipal(3L, "boss2", "admin", CapabilitySet.of("users:read"));

        assertThat(decide(rule, auth(admin))).isTrue();
        assertThat(decide(rule, auth(adminWithoutWrite))).isFalse();
        assertThat(decide(rule, auth(manager))).isFalse();
    }

    @Test
    @DisplayName("규칙 이름이 비어 있으면 조립 시점에 실패")
    void blank_names_fail_fast() {
        assertThatThrownBy(() -> gate.requirePermission(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gate.requireAnyRole()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("공백이 섞인 권한 이름은 라우트 조립 시점에 실패 (요청 때 조용히 거부되지 않는다)")
    void malformed_permission_names_fail_fast() {
        assertThatThrownBy(() -> gate.requirePermission("tasks read"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tasks read");
        assertThatThrownBy(() -> gate.requireAnyPermission("tasks:read", "users write"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("users write");
    }

    private boolean decide(AuthorizationManager<RequestAuthorizationContext> rule, Authentication authentication) {
        AuthorizationDecision decision = rule.check(() -> authentication, ctx);
        return decision != null && decision.isGranted();
    }

    private static Authentication auth(AuthPrincipal principal) {
        return new UsernamePasswordAuthenticationToken(principal, null, principal.authorities());
    }
}
