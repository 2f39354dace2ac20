package com.effisio.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/*
  @ConfigurationProperties(prefix = "app.auth"):
  application.yml의 app.auth.* 값을 타입 안정성 있게 바인딩한다. 규칙 위반 시 부팅 실패.

  app:
    auth:
      jwt:
        issuer: effisio
        secret: ${APP_AUTH_JWT_SECRET}
        access-ttl-seconds: 900        # 15분
        refresh-ttl-seconds: 604800    # 7일

      refresh:
        rotation-enabled: true
        reuse-grace-seconds: 10
        cookie-name: EF_REFRESH
        cookie-path: /api/v1/auth
        cookie-same-site: Lax
        cookie-secure: false
        cleanup-cron: "0 0 * * * *"
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt,
                             @Valid @NotNull Refresh refresh) {

    /**
     * 토큰(JWT) 관련 설정
     * - issuer: 토큰 발급자 식별자 (검증 시 requireIssuer)
     * - secret: HS256 서명용 비밀키 (최소 32바이트)
     * - accessTtlSeconds / refreshTtlSeconds: 각 토큰 수명
     */
    public record Jwt(
        @NotBlank String issuer,
        @NotBlank @Size(min = 32) String secret,
        @Min(1) long accessTtlSeconds,
        @Min(1) long refreshTtlSeconds
    ) {}

    /**
     * Refresh 정책 + 쿠키 설정
     * - rotationEnabled: 매 refresh마다 새 refresh 발급 + 이전 것 폐기
     * - reuseGraceSeconds: ROTATED 직후 이 시간 안의 재제출은 중복 요청으로 보고 패밀리 폐기를 하지 않는다
     * - cleanupCron: 만료 토큰 정리 스케줄
     */
    public record Refresh(
            boolean rotationEnabled,

            @Min(0) long reuseGraceSeconds,

            @NotBlank String cookieName,

            // 최소 형식만 강제: "/"로 시작
            @NotBlank @Pattern(regexp = "^/.*", message = "cookiePath must start with '/'")
            String cookiePath,

            @NotNull SameSite cookieSameSite,

            boolean cookieSecure,

            @NotBlank String cleanupCron
    ) {}

    // SameSite는 오타가 치명적이라 enum으로 고정
    public enum SameSite {
        Lax, Strict, None
    }
}
