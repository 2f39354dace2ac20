package com.effisio.backend.auth.audit;

import com.effisio.backend.auth.audit.event.AuthAuditEvent;

/**
 * fire-and-forget 감사 기록 창구.
 * 구현체는 어떤 실패도 호출자에게 던지지 않는다. (세션 서비스의 성공/실패 결과를 바꾸면 안 된다)
 */
public interface AuditSink {

    void record(AuthAuditEvent event);
}
