package com.effisio.backend.security;

import static org.springframework.security.authorization.AuthorizationManagers.allOf;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 보안 설정
 *
 * 체인 두 개로 나눈다. (요청 하나는 먼저 매칭된 체인 하나만 탄다)
 *
 *  1) publicChain (@Order(1)) : login / refresh / logout / health / error
 *     - JwtAuthenticationFilter(OPTIONAL): 절대 거부하지 않는다.
 *       logout은 토큰이 유효하면 감사 로그에 userId를 남기기 위해 principal이 있으면 쓴다.
 *
 *  2) apiChain (@Order(2)) : 그 외 전부
 *     - JwtAuthenticationFilter(REQUIRED): 헤더가 있는데 무효면 401 ACCESS_INVALID
 *     - 라우트별 CapabilityGate 규칙 / 나머지는 authenticated()
 *     - 인증 없음 -> RestAuthEntryPoint 401 AUTH_REQUIRED
 *     - 권한 부족 -> RestAccessDeniedHandler 403 ACCESS_DENIED
 *
 * 필터는 @Bean으로 등록하지 않는다. (@Bean Filter는 서블릿 필터로도 자동 등록되어 체인 밖에서 한 번 더 돈다)
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    static final String[] PUBLIC_ENDPOINTS = {
            "/api/v1/auth/login",
            "/api/v1/auth/refresh",
            "/api/v1/auth/logout",
            "/actuator/health",
            "/actuator/health/**",
            "/error"
    };

    private final JwtService jwtService;
    private final SecurityErrorWriter securityErrorWriter;
    private final CapabilityGate gate;

    @Bean
    @Order(1)
    SecurityFilterChain publicChain(HttpSecurity http) throws Exception {
        return baseline(http)
                .securityMatcher(PUBLIC_ENDPOINTS)
                .addFilterBefore(
                        new JwtAuthenticationFilter(jwtService, securityErrorWriter, JwtAuthenticationFilter.Mode.OPTIONAL),
                        UsernamePasswordAuthenticationFilter.class
                )
                .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
                .build();
    }

    @Bean
    @Order(2)
    SecurityFilterChain apiChain(HttpSecurity http) throws Exception {
        return baseline(http)
                .addFilterBefore(
                        new JwtAuthenticationFilter(jwtService, securityErrorWriter, JwtAuthenticationFilter.Mode.REQUIRED),
                        UsernamePasswordAuthenticationFilter.class
                )
                .authorizeHttpRequests(auth -> auth
                        // 관리자: 특정 사용자의 활성 세션 조회 / 강제 로그아웃
                        .requestMatchers(HttpMethod.GET, "/api/v1/admin/users/*/sessions")
                                .access(gate.requirePermission("users:read"))
                        .requestMatchers(HttpMethod.DELETE, "/api/v1/admin/users/*/sessions")
                                .access(allOf(gate.requireAnyRole("admin"), gate.requirePermission("users:write")))

                        // 그 외는 인증만 필요 (/api/v1/auth/me, /api/v1/auth/logout-all, /api/v1/auth/sessions ...)
                        .anyRequest().authenticated()
                )
                .build();
    }

    private HttpSecurity baseline(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable())   // REST API + Bearer 토큰. 세션 쿠키 인증이 아니다.
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable())       // /api/v1/auth/logout은 컨트롤러가 처리
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(eh -> eh
                        .authenticationEntryPoint(new RestAuthEntryPoint(securityErrorWriter))
                        .accessDeniedHandler(new RestAccessDeniedHandler(securityErrorWriter))
                );
    }
}
