package com.agentguard.repository.jpa;

import com.agentguard.entity.AuditLogEntity;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the audit_logs table.
 * Supports querying the trail by agent and inclusive time range, oldest first.
 * Only inserts are issued against this table.
 */
@Repository
public interface AuditLogJpaRepository extends JpaRepository<AuditLogEntity, Long> {

    List<AuditLogEntity> findByTimestampBetweenOrderByTimestampAscIdAsc(LocalDateTime from, LocalDateTime to);

    List<AuditLogEntity> findByAgentIdAndTimestampBetweenOrderByTimestampAscIdAsc(
            String agentId, LocalDateTime from, LocalDateTime to);

    Optional<AuditLogEntity> findByPendingRequestId(String pendingRequestId);
}
