package com.effisio.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 에러 응답 DTO
 *
 * 모든 레이어(ControllerAdvice / EntryPoint / AccessDeniedHandler / Filter)가 같은 JSON 스키마를 쓴다.
 * - code: 클라이언트 분기용 안정 식별자 (ErrorCode.name())
 * - message: 사용자 메시지
 * - retryAfterSeconds: 재시도 가능 시간 (주로 503)
 * - details: 추가 정보(필요 시만)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,    // ex: "REFRESH_INVALID"
        String message, // ex: "인증 정보가 유효하지 않거나 만료되었습니다."
        Integer retryAfterSeconds,
        Object details
) {
    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), null, null);
    }

    public static ApiError of(ErrorCode errorCode, String messageOverride) {
        return new ApiError(errorCode.name(), messageOverride, null, null);
    }

    public static ApiError of(ErrorCode errorCode, Integer retryAfterSeconds) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), retryAfterSeconds, null);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage(), e.getRetryAfterSeconds(), e.getDetails());
    }
}
