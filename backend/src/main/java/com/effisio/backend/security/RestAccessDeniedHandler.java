package com.effisio.backend.security;

import java.io.IOException;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;

import com.effisio.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 인증은 됐지만 권한/역할이 부족할 때 -> 403 ACCESS_DENIED
 * (401 AUTH_REQUIRED와 구분해야 클라이언트가 "재로그인"과 "권한 없음"을 나눠 처리할 수 있다)
 */
@Slf4j
@RequiredArgsConstructor
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void handle(
            HttpServletRequest request,
            HttpServletResponse response,
            AccessDeniedException accessDeniedException) throws IOException {

        log.info("인가 거부: method={}, uri={}", request.getMethod(), request.getRequestURI());
        errorWriter.write(response, ErrorCode.ACCESS_DENIED);
    }
}
