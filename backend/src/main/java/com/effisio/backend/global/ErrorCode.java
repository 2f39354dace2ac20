package com.effisio.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드(클라이언트 분기용) + HTTP 상태 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - code = enum name() (변경 시 API 계약 깨짐)
 * - 자격 증명 관련 실패는 원인과 무관하게 하나의 코드/메시지로 뭉갠다. (상세 사유는 로그로만)
 * - 401(로그인 필요)과 403(권한 부족)은 반드시 구분한다.
 */
public enum ErrorCode {

    // Login
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED,
            "아이디 또는 비밀번호가 올바르지 않습니다."),
    ACCOUNT_DISABLED(HttpStatus.FORBIDDEN,
            "사용할 수 없는 계정 상태입니다."),

    // Auth / Security
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED,
            "인증이 필요합니다."),
    ACCESS_INVALID(HttpStatus.UNAUTHORIZED,
            "인증 정보가 유효하지 않거나 만료되었습니다."),
    ACCESS_DENIED(HttpStatus.FORBIDDEN,
            "요청한 작업을 수행할 권한이 없습니다."),

    // Refresh token: 서명 오류/미발급/폐기/만료/재사용 모두 동일 코드 (오라클 방지)
    REFRESH_INVALID(HttpStatus.UNAUTHORIZED,
            "인증 정보가 유효하지 않거나 만료되었습니다."),

    // User / Data consistency
    USER_NOT_FOUND(HttpStatus.NOT_FOUND,
            "사용자를 찾을 수 없습니다."),

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "요청 값이 올바르지 않습니다."),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE,
            "일시적으로 요청을 처리할 수 없습니다. 잠시 후 다시 시도해주세요."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "서버 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
