package com.effisio.backend.global;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.effisio.backend.auth.identity.login.dto.LoginRequest;

import jakarta.validation.Valid;

@DisplayName("[Global] 예외 → ApiError 매핑")
class GlobalExceptionHandlerTest {

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new ThrowingController())
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("ApiException → ErrorCode의 상태/코드 그대로")
    void api_exception() throws Exception {
        mvc.perform(get("/t/refresh-invalid"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code", is("REFRESH_INVALID")))
                .andExpect(jsonPath("$.retryAfterSeconds").doesNotExist())
                .andExpect(header().doesNotExist(HttpHeaders.RETRY_AFTER));
    }

    @Test
    @DisplayName("저장소 타임아웃 → 503 + Retry-After (401로 뭉개지 않는다)")
    void infrastructure_failure_is_503() throws Exception {
        mvc.perform(get("/t/db-timeout"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "3"))
                .andExpect(jsonPath("$.code", is("SERVICE_UNAVAILABLE")))
                .andExpect(jsonPath("$.retryAfterSeconds", is(3)));

        mvc.perform(get("/t/no-tx"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("@Valid 실패 / 깨진 JSON → 400 VALIDATION_ERROR")
    void validation_errors() throws Exception {
        mvc.perform(post("/t/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"\",\"password\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("VALIDATION_ERROR")));

        mvc.perform(post("/t/login").contentType(MediaType.APPLICATION_JSON).content("{broken"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("VALIDATION_ERROR")));
    }

    @Test
    @DisplayName("처리되지 않은 예외 → 500 INTERNAL_ERROR, 내부 메시지는 노출하지 않는다")
    void unhandled() throws Exception {
        mvc.perform(get("/t/bug"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code", is("INTERNAL_ERROR")))
                .andExpect(jsonPath("$.details", nullValue()));
    }

    @RestController
    static class ThrowingController {

        @GetMapping("/t/refresh-invalid")
        void refreshInvalid() {
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        @GetMapping("/t/db-timeout")
        void dbTimeout() {
            throw new QueryTimeoutException("lock wait timeout");
        }

        @GetMapping("/t/no-tx")
        void noTransaction() {
            throw new CannotCreateTransactionException("pool exhausted");
        }

        @GetMapping("/t/bug")
        void bug() {
            throw new IllegalStateException("secret internals");
        }

        @PostMapping("/t/login")
        void login(@Valid @RequestBody LoginRequest request) {
        }
    }
}
