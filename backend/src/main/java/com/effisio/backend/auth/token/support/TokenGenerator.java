package com.effisio.backend.auth.token.support;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Refresh token 식별자(token_id, JWT의 jti) 생성기
 *
 * - SecureRandom 32바이트 -> Base64 URL-safe(padding 제거) = 43자
 * - 저장소 조회 키이자 서명된 refresh JWT 안에 실리는 값이라 추측 불가능해야 한다.
 */
@Component
@RequiredArgsConstructor
public class TokenGenerator {

    private static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;

    public String generateTokenId() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
