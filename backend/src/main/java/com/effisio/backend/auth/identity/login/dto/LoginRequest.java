package com.effisio.backend.auth.identity.login.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.effisio.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * [로그인 요청 DTO]
 * - username은 앞뒤 공백을 제거한다. password는 그대로 둔다(공백도 비밀번호의 일부).
 */
public record LoginRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Size(max = 50)
        String username,

        @NotBlank
        String password
) {}
