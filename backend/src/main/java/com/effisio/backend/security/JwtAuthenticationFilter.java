package com.effisio.backend.security;

import java.io.IOException;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import com.effisio.backend.global.ErrorCode;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * "Security Filter Chain"에서 "JWT 기반 인증"을 수행하는 인증 필터
 *
 * 역할:
 * - Authorization: Bearer <access token> 을 검증해서 AuthPrincipal을 SecurityContext에 세팅한다.
 * - 저장소(DB)는 보지 않는다. access token은 자기완결적이다.
 *
 * 모드:
 * - REQUIRED
 *   - 헤더가 "없으면" 통과한다. 차단은 인가 규칙(CapabilityGate/authenticated) + EntryPoint(401 AUTH_REQUIRED)가 한다.
 *   - 헤더가 "있는데" 형식이 틀리거나 토큰이 무효/만료면 여기서 401 ACCESS_INVALID로 끝낸다.
 * - OPTIONAL
 *   - 절대 거부하지 않는다. 검증에 성공한 경우에만 principal을 세팅하고, 나머지는 익명으로 통과.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public enum Mode { REQUIRED, OPTIONAL }

    private final JwtService jwtService;
    private final SecurityErrorWriter errorWriter;
    private final Mode mode;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        // 이미 인증이 만들어진 요청이면 중복 처리하지 않는다.
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null) {
            filterChain.doFilter(request, response);
            return;
        }

        try {
            String token = JwtService.extractBearer(header);
            AuthPrincipal principal = AuthPrincipal.from(jwtService.verifyAccessToken(token));

            var authentication = new UsernamePasswordAuthenticationToken(
                    principal,
                    null,
                    principal.authorities()
            );
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        } catch (JwtService.InvalidJwtException ex) {
            SecurityContextHolder.clearContext();

            if (mode == Mode.REQUIRED) {
                log.warn("access token 거부: reason={}, uri={}", ex.getReason(), request.getRequestURI());
                errorWriter.write(response, ErrorCode.ACCESS_INVALID);
                return;
            }
            log.debug("optional 인증: 무효 토큰은 익명으로 처리. reason={}, uri={}", ex.getReason(), request.getRequestURI());
        }

        filterChain.doFilter(request, response);
    }
}
