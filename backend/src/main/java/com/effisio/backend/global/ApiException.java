package com.effisio.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 서비스/도메인 정책 위반을 ErrorCode로 표현하는 런타임 예외.
 *
 * - throw new ApiException(ErrorCode.REFRESH_INVALID);
 * - GlobalExceptionHandler / SecurityErrorWriter가 ApiError로 직렬화해 응답 포맷을 고정한다.
 * - errorCode 자체도 들고 있어서 테스트/로그에서 enum으로 비교할 수 있다.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final HttpStatus status;
    private final String code;
    private final Integer retryAfterSeconds;
    private final Object details;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, errorCode.defaultMessage(), null, null);
    }

    public ApiException(ErrorCode errorCode, Integer retryAfterSeconds) {
        this(errorCode, errorCode.defaultMessage(), retryAfterSeconds, null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride, Integer retryAfterSeconds, Object details) {
        // super(...)는 첫 줄이어야 해서 errorCode null 검사보다 앞에 둘 수밖에 없음.
        super(resolveMessage(errorCode, messageOverride));

        if (errorCode == null)
            throw new IllegalArgumentException("ErrorCode must not be null");

        this.errorCode = errorCode;
        this.status = errorCode.status();
        this.code = errorCode.name();
        this.retryAfterSeconds = retryAfterSeconds;
        this.details = details;
    }

    private static String resolveMessage(ErrorCode errorCode, String messageOverride) {
        if (messageOverride != null && !messageOverride.isBlank()) {
            return messageOverride;
        }
        return (errorCode == null) ? null : errorCode.defaultMessage();
    }
}
