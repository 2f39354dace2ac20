package com.effisio.backend.auth.audit.repo;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.effisio.backend.auth.audit.domain.AuditAction;
import com.effisio.backend.auth.audit.domain.AuditLog;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    List<AuditLog> findByUserIdAndActionOrderByIdAsc(Long userId, AuditAction action);
}
