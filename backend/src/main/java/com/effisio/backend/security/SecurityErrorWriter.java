package com.effisio.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import com.effisio.backend.global.ApiError;
import com.effisio.backend.global.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Security 레이어(필터/EntryPoint/AccessDeniedHandler)에서 ApiError JSON을 내려주는 유틸
 *
 * - Security Filter Chain에서 차단되는 요청은 @Controller까지 오지 않아서 GlobalExceptionHandler가 못 잡는다.
 * - 그래서 여기서도 같은 ApiError 포맷을 직접 쓴다.
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorWriter {

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, ErrorCode errorCode) throws IOException {
        write(response, errorCode.status().value(), ApiError.of(errorCode));
    }

    void write(HttpServletResponse response, int status, ApiError body) throws IOException {
        // 이미 다른 필터가 응답을 만들어버린 경우라면 건드리지 않음
        if (response.isCommitted())
            return;

        // 인증/인가 실패 응답은 캐시 금지
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.setHeader(HttpHeaders.PRAGMA, "no-cache");

        response.setStatus(status);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);

        objectMapper.writeValue(response.getWriter(), body);
    }
}
