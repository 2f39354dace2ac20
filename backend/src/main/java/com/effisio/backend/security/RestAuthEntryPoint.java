package com.effisio.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.effisio.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 보호 리소스에 "인증 없이" 접근했을 때 호출되는 EntryPoint. -> 401 AUTH_REQUIRED
 *
 * - 토큰이 아예 없거나, CapabilityGate가 principal을 찾지 못한 경우.
 * - Authorization 헤더는 있는데 JWT가 invalid인 경우는 JwtAuthenticationFilter가 먼저 401(ACCESS_INVALID)을 내린다.
 */
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {

        errorWriter.write(response, ErrorCode.AUTH_REQUIRED);
    }
}
