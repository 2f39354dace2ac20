package com.effisio.backend.auth.audit.event;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.effisio.backend.auth.audit.domain.AuditLog;
import com.effisio.backend.auth.audit.repo.AuditLogRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class AuditLogEventListener {

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    /**
     * 발행한 트랜잭션이 끝난 뒤(커밋이든 롤백이든) 실행된다.
     * - 로그인 실패처럼 ApiException으로 롤백되는 흐름도 기록돼야 해서 AFTER_COMPLETION.
     * - 트랜잭션 밖에서 발행된 경우에도 실행(fallbackExecution).
     * - 감사 저장 실패는 로그만 남긴다. 이미 확정된 인증 결과를 바꾸지 않는다.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMPLETION, fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void on(AuthAuditEvent event) {
        try {
            auditLogRepository.save(AuditLog.of(
                    event.action(),
                    event.userId(),
                    event.username(),
                    event.detail(),
                    event.ipAddress(),
                    event.userAgent(),
                    LocalDateTime.now(clock)
            ));
        } catch (Exception e) {
            log.error("감사 로그 저장 실패. action={}, userId={}", event.action(), event.userId(), e);
        }
    }
}
