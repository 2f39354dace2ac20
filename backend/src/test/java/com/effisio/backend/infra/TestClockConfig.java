package com.effisio.backend.infra;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * 인증 테스트용 시계.
 *
 * 토큰 수명 경계를 실제로 기다리지 않고 넘기기 위해 쓴다.
 * - access 만료 (jwt.access-ttl-seconds, 기본 900초)
 * - ROTATED 토큰 재제출 grace (refresh.reuse-grace-seconds, 기본 10초)
 * - refresh 만료 / 만료 row 정리
 *
 * 통합 테스트는 스프링 컨텍스트가 공유하는 TEST_CLOCK을 쓰고 매 테스트 전에 reset()으로 되돌린다.
 * 단위 테스트는 fresh()로 자기 시계를 따로 만든다.
 */
@TestConfiguration
public class TestClockConfig {

    public static final ZoneId TEST_ZONE = ZoneId.of("Asia/Seoul");

    // 월요일 업무 시작 시각. DB DATETIME 왕복에서 잘리는 초 미만 단위가 없도록 정각으로 둔다.
    public static final Instant TEST_START = LocalDateTime.of(2026, 3, 2, 9, 0).atZone(TEST_ZONE).toInstant();

    public static final MutableClock TEST_CLOCK = new MutableClock(TEST_START, TEST_ZONE);

    public static void reset() {
        TEST_CLOCK.set(TEST_START);
    }

    /** TEST_CLOCK 기준 현재 시각 (엔티티 컬럼과 같은 LocalDateTime) */
    public static LocalDateTime now() {
        return TEST_CLOCK.localNow();
    }

    /** 단위 테스트용. TEST_START에서 출발하는 독립 시계. */
    public static MutableClock fresh() {
        return new MutableClock(TEST_START, TEST_ZONE);
    }

    @Bean
    @Primary // 운영 Clock Bean보다 우선
    Clock clock() {
        return TEST_CLOCK;
    }

    public static final class MutableClock extends Clock {
        private final ZoneId zone;
        private final AtomicReference<Instant> now;

        public MutableClock(Instant initialInstant, ZoneId zone) {
            this(zone, new AtomicReference<>(initialInstant));
        }

        private MutableClock(ZoneId zone, AtomicReference<Instant> now) {
            this.zone = zone;
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        // 존만 바꾼 뷰. 시간을 움직이면 원래 시계와 함께 움직인다.
        @Override
        public Clock withZone(ZoneId zone) {
            return zone.equals(this.zone) ? this : new MutableClock(zone, now);
        }

        @Override
        public Instant instant() {
            return now.get();
        }

        public LocalDateTime localNow() {
            return LocalDateTime.ofInstant(now.get(), zone);
        }

        public void set(Instant instant) {
            now.set(instant);
        }

        public void advance(Duration d) {
            now.updateAndGet(i -> i.plus(d));
        }

        public void advanceSeconds(long seconds) {
            advance(Duration.ofSeconds(seconds));
        }
    }
}
