package com.effisio.backend.security;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;
import org.springframework.stereotype.Component;

import com.effisio.backend.auth.rbac.Permission;

import lombok.extern.slf4j.Slf4j;

/**
 * 라우트 단위 인가 규칙(AuthorizationManager) 팩토리.
 *
 * SecurityConfig에서 .requestMatchers(...).access(gate.requirePermission("users:read")) 처럼 조립한다.
 * JwtAuthenticationFilter 다음(AuthorizationFilter)에서 평가된다.
 *
 * 판정:
 * - principal(AuthPrincipal) 없음 -> AuthenticationCredentialsNotFoundException -> EntryPoint 401 AUTH_REQUIRED
 * - principal 있음 + 권한/역할 부족 -> 거부 결정 -> AccessDeniedHandler 403 ACCESS_DENIED
 * - 거부되면 컨트롤러는 실행되지 않는다.
 */
@Slf4j
@Component
public class CapabilityGate {

    public AuthorizationManager<RequestAuthorizationContext> requirePermission(String name) {
        requirePermissionNames(name);
        return rule("permission " + name, p -> p.hasPermission(name));
    }

    public AuthorizationManager<RequestAuthorizationContext> requireAnyPermission(String... names) {
        List<String> candidates = requirePermissionNames(names);
        return rule("any permission of " + candidates, p -> p.capabilities().containsAny(candidates));
    }

    public AuthorizationManager<RequestAuthorizationContext> requireRole(String name) {
        requireNames(name);
        return rule("role " + name, p -> p.hasRole(name));
    }

    public AuthorizationManager<RequestAuthorizationContext> requireAnyRole(String... names) {
        List<String> candidates = requireNames(names);
        return rule("any role of " + candidates, p -> candidates.stream().anyMatch(p::hasRole));
    }

    /**
     * Authentication에서 AuthPrincipal을 꺼낸다.
     * 익명(AnonymousAuthenticationToken)이거나 다른 타입이면 "인증 없음"으로 본다.
     */
    static AuthPrincipal principalOf(Authentication authentication) {
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthPrincipal)) {
            throw new AuthenticationCredentialsNotFoundException("no authenticated principal");
        }
        return (AuthPrincipal) authentication.getPrincipal();
    }

    private AuthorizationManager<RequestAuthorizationContext> rule(String description, Predicate<AuthPrincipal> check) {
        return (authentication, context) -> {
            AuthPrincipal principal = principalOf(authentication.get());
            boolean granted = check.test(principal);
            if (!granted) {
                log.debug("권한 부족: userId={}, role={}, required={}", principal.userId(), principal.role(), description);
            }
            return new AuthorizationDecision(granted);
        };
    }

    /** 권한 이름 형식(Permission)까지 라우트 조립 시점에 검증한다. 잘못된 규칙은 부팅 실패. */
    private static List<String> requirePermissionNames(String... names) {
        List<String> checked = requireNames(names);
        checked.forEach(Permission::of);
        return checked;
    }

    private static List<String> requireNames(String... names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("at least one name is required");
        }
        for (String n : names) {
            if (n == null || n.isBlank()) throw new IllegalArgumentException("name must not be blank");
        }
        return List.copyOf(Arrays.asList(names));
    }
}
