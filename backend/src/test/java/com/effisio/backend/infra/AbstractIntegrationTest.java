package com.effisio.backend.infra;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;

import lombok.extern.slf4j.Slf4j;

/**
 * =================================
 *  테스트 실행 커맨드 모음
 * =================================
 * - 단위 테스트(*Test):          mvn test
 * - 통합 테스트(*IT) 포함:        mvn verify   (Docker 필요)
 * - 특정 클래스만:               mvn -Dit.test=AuthRefreshRotationIT verify
 *
 * ============================
 *   테스트 실행 흐름(호출 순서)
 * ============================
 * 1) [JVM - 클래스 로드 단계]
 *    - static { startContainersOnce(); } 에서 MySQL 컨테이너를 한 번만 띄운다.
 *
 * 2) [Spring - ApplicationContext 생성 단계]
 *    - @DynamicPropertySource가 호출되어 datasource/flyway 값을 "등록(registry에 Supplier 걸기)"한다.
 *    - 그래서 "설정값 오버라이드" 로그가 컨테이너 로그보다 늦게 나오는 게 정상이다.
 *
 * 3) [Spring Boot 초기화 단계]
 *    - DataSource -> Flyway migration(V1~V3) -> JPA validate
 *
 * 4) [테스트 메서드 실행 직전 단계]
 *    - @BeforeEach resetTestClock(): 매 테스트마다 Clock을 TEST_START로 되돌린다.
 */
@Slf4j
@SpringBootTest                 // 실제 스프링 애플리케이션을 통째로 띄움
@AutoConfigureMockMvc           // 실제 톰캣 없이 HTTP 요청/응답을 흉내내는 MockMvc 주입
@ActiveProfiles("test")         // application.yml + application-test.yml
@Import(TestClockConfig.class)  // 테스트에서만 쓰는 Clock Bean
public abstract class AbstractIntegrationTest {

    private static final String MYSQL_IMAGE = "mysql:8.0.36";
    private static final String MYSQL_DB = "effisio_test";
    private static final String MYSQL_USER = "effisio";
    private static final String MYSQL_PASSWORD = "effisio";
    private static final int MYSQL_CONTAINER_PORT = 3306;

    private static final AtomicBoolean STARTED = new AtomicBoolean(false);

    static final MySQLContainer<?> MYSQL = new MySQLContainer<>(MYSQL_IMAGE)
            .withDatabaseName(MYSQL_DB)
            .withUsername(MYSQL_USER)
            .withPassword(MYSQL_PASSWORD)
            .withStartupAttempts(3)
            .withStartupTimeout(Duration.ofMinutes(2));

    static {
        startContainersOnce();
    }

    @BeforeEach
    void resetTestClock() {
        TestClockConfig.reset();
    }

    @DynamicPropertySource
    static void overrideProps(DynamicPropertyRegistry r) {
        startContainersOnce(); // 멱등
        TestDynamicProperties.overrideProps(r, MYSQL);
    }

    private static void startContainersOnce() {
        if (!STARTED.compareAndSet(false, true)) {
            return;
        }

        try {
            MYSQL.start();
            TestInfraLogger.logContainersStarted(MYSQL, MYSQL_CONTAINER_PORT);
        } catch (Exception e) {
            log.error("Testcontainer init failed", e);
            throw new IllegalStateException("Testcontainer init failed", e);
        }
    }
}
