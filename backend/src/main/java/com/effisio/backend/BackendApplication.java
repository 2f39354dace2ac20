package com.effisio.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.effisio.backend.auth.config.AuthModuleConfig;

/**
 * 이 애플리케이션 클래스(엔트리포인트)의 역할
 * - @SpringBootApplication이 붙은 패키지(com.effisio.backend) 기준으로
 *   하위 패키지(auth, security, global)를 컴포넌트 스캔한다.
 *
 * ------------------------------------------------------------------------------------
 * 설정 값 주입 흐름:
 * ------------------------------------------------------------------------------------
 *    (OS 환경변수) -> application.yml ${ENV:default} -> @ConfigurationProperties
 *
 * - APP_AUTH_JWT_SECRET 등은 환경변수로 넣고, yml 기본값은 로컬 fallback 용도.
 * - app.auth.*, app.rbac.* 는 AuthProperties/RbacProperties에 타입 안전하게 들어간다.
 * - @Validated 규칙 위반(짧은 secret, 빈 roles 등)이면 부팅 실패(Fail-fast).
 *
 * ------------------------------------------------------------------------------------
 * 로컬 확인 (curl)
 * ------------------------------------------------------------------------------------
 * curl -i -X POST http://localhost:8080/api/v1/auth/login \
 *   -H "Content-Type: application/json" -c /tmp/ef_cookie.txt \
 *   -d '{"username":"admin","password":"..."}'
 * curl -i http://localhost:8080/api/v1/auth/me -H "Authorization: Bearer <accessToken>"
 * curl -i -X POST http://localhost:8080/api/v1/auth/refresh -b /tmp/ef_cookie.txt -c /tmp/ef_cookie.txt
 *
 * - UserDetailsServiceAutoConfiguration은 끈다. JWT 방식이라 기본 인메모리 유저가 필요 없다.
 *   (켜 두면 "Using generated security password" 경고가 뜬다)
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
