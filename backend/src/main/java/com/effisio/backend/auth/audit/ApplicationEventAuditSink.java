package com.effisio.backend.auth.audit;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import com.effisio.backend.auth.audit.event.AuthAuditEvent;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * AuditSink 기본 구현: 스프링 애플리케이션 이벤트로 발행한다.
 *
 * - 실제 저장은 AuditLogEventListener가 트랜잭션 종료 후(커밋/롤백 무관) 별도 트랜잭션으로 한다.
 * - 현재 요청이 있으면 ip/userAgent를 채운다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationEventAuditSink implements AuditSink {

    private final ApplicationEventPublisher publisher;

    @Override
    public void record(AuthAuditEvent event) {
        if (event == null) return;
        try {
            publisher.publishEvent(enrich(event));
        } catch (RuntimeException e) {
            log.error("감사 이벤트 발행 실패. action={}, userId={}", event.action(), event.userId(), e);
        }
    }

    private static AuthAuditEvent enrich(AuthAuditEvent event) {
        RequestAttributes attrs = RequestContextHolder.getRequestAttributes();
        if (!(attrs instanceof ServletRequestAttributes)) {
            return event;
        }
        HttpServletRequest request = ((ServletRequestAttributes) attrs).getRequest();
        return event.withClient(request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT));
    }
}
