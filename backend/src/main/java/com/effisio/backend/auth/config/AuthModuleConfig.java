package com.effisio.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.effisio.backend.auth.rbac.RbacProperties;

/**
 * 인증 모듈 공통 빈.
 *
 * @EnableConfigurationProperties
 *  - { AuthProperties, RbacProperties } 바인딩 + 검증 활성화
 */
@Configuration
@EnableConfigurationProperties({
        AuthProperties.class,
        RbacProperties.class
})
public class AuthModuleConfig {

    private static final ZoneId KST = ZoneId.of("Asia/Seoul");

    /**
     * 서버 표준 타임존을 KST로 고정한다.
     * - 테스트 환경에서는 TestClockConfig가 별도의 Clock을 제공하므로 이 @Bean은 만들어지지 않는다.
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.system(KST);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    // 만료 refresh 정리 잡. test 프로필에서는 스케줄러를 띄우지 않는다.
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingConfig {
    }
}
