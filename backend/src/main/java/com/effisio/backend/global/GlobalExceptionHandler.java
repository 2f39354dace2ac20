package com.effisio.backend.global;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * - 컨트롤러/서비스에서 발생한 예외를 가로채어 공통 응답(ApiError)으로 변환한다.
 * - HTTP 상태코드도 ErrorCode/ApiException에서만 결정되게 한다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final int INFRA_RETRY_AFTER_SECONDS = 3;

    /**
     * ApiException 전용 핸들러
     * - retryAfterSeconds가 있으면 Retry-After 헤더도 같이 내려준다.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handleApiException(ApiException e) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(e.getStatus());

        if (e.getRetryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }

        return builder.body(ApiError.from(e));
    }

    /**
     * @RequestBody + @Valid 검증 실패
     * - 응답은 VALIDATION_ERROR로 통일한다. (상세는 로그로만)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {

        e.getBindingResult().getFieldErrors()
                .forEach(fe -> log.warn("요청 검증 실패: field={}, message={}", fe.getField(), fe.getDefaultMessage()));

        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    /**
     * @RequestParam / @PathVariable / @Validated 검증 실패(제약 위반)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException e) {

        e.getConstraintViolations()
                .forEach(v -> log.warn("요청 검증 실패: path={}, message={}", v.getPropertyPath(), v.getMessage()));

        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    // JSON 파싱 불가 (본문 누락/깨진 JSON)
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("요청 본문 파싱 실패: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    /**
     * 저장소 장애/타임아웃
     * - 절대 "자격 증명 무효(401)"로 내려가면 안 된다. 클라이언트가 재로그인 루프에 빠진다.
     * - 503 + Retry-After 로 "재시도 가능한 서버 오류"임을 알린다.
     */
    @ExceptionHandler({
            TransientDataAccessException.class,
            DataAccessResourceFailureException.class,
            TransactionTimedOutException.class,
            CannotCreateTransactionException.class
    })
    public ResponseEntity<ApiError> handleInfrastructure(Exception e) {
        log.error("저장소 장애 또는 타임아웃: {}", e.getClass().getSimpleName(), e);
        return ResponseEntity
                .status(ErrorCode.SERVICE_UNAVAILABLE.status())
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(INFRA_RETRY_AFTER_SECONDS))
                .body(ApiError.of(ErrorCode.SERVICE_UNAVAILABLE, INFRA_RETRY_AFTER_SECONDS));
    }

    /**
     * 처리되지 않은 예외(버그/장애)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnhandled(Exception e) {
        log.error("처리되지 않은 예외", e);
        return ResponseEntity
                .status(ErrorCode.INTERNAL_ERROR.status())
                .body(ApiError.of(ErrorCode.INTERNAL_ERROR));
    }
}
