package com.effisio.backend.auth.token.job;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.effisio.backend.auth.token.store.RefreshTokenStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 만료된 refresh 레코드 정리
 *
 * - 만료 레코드는 rotate에서 어차피 거절되므로 지워도 동작은 같다. 테이블 크기만 관리한다.
 * - 폐기됐지만 아직 만료 전인 레코드는 남긴다. (재사용 탐지에 필요)
 * - 스케줄링은 test 프로필에서 꺼져 있다. (AuthModuleConfig.SchedulingConfig)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RefreshTokenCleanupJob {

    private final RefreshTokenStore store;
    private final Clock clock;

    @Scheduled(cron = "${app.auth.refresh.cleanup-cron}")
    public void purgeExpired() {
        int deleted = store.deleteExpired(LocalDateTime.now(clock));
        if (deleted > 0) {
            log.info("만료 refresh 정리: deleted={}", deleted);
        } else {
            log.debug("만료 refresh 정리: 대상 없음");
        }
    }
}
