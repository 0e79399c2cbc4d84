package com.agentguard.audit;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.DecisionResult;
import com.agentguard.domain.model.AuditLogEntry;
import com.agentguard.domain.model.TraceEntry;
import com.agentguard.entity.AuditLogEntity;
import com.agentguard.exception.ValidationException;
import com.agentguard.mapper.AuditLogMapper;
import com.agentguard.repository.jpa.AuditLogJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only audit trail of terminal decisions.
 *
 * <p>Exactly one entry is written per completed decision: automatic approvals and denials
 * are recorded by the decision facade, human resolutions by the escalation manager inside
 * the same transaction as the status change. Escalated requests are not recorded until
 * they are resolved. There is no update or delete path.
 *
 * <p>Writes are synchronous. A failed insert propagates so the caller never sees a
 * verdict that was not recorded.
 */
@Service
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    /** Substituted for an open lower bound. */
    static final LocalDateTime EARLIEST = LocalDateTime.of(1970, 1, 1, 0, 0);

    /** Substituted for an open upper bound. */
    static final LocalDateTime LATEST = LocalDateTime.of(9999, 12, 31, 23, 59, 59);

    private final AuditLogJpaRepository auditLogJpaRepository;
    private final AuditLogMapper auditLogMapper;
    private final Clock clock;

    public AuditRecorder(AuditLogJpaRepository auditLogJpaRepository, AuditLogMapper auditLogMapper, Clock clock) {
        this.auditLogJpaRepository = auditLogJpaRepository;
        this.auditLogMapper = auditLogMapper;
        this.clock = clock;
    }

    /**
     * Records an automatic decision.
     */
    @Transactional
    public AuditLogEntry record(
            String agentId,
            String action,
            String resource,
            DecisionResult result,
            DecisionReason reason,
            List<TraceEntry> trace) {
        return save(AuditLogEntry.builder()
                .agentId(agentId)
                .action(action)
                .resource(resource)
                .result(result)
                .reason(reason)
                .decisionTrace(trace)
                .build());
    }

    /**
     * Records a human resolution of an escalated request. The unique pending request id
     * column rejects a second entry for the same request.
     */
    @Transactional
    public AuditLogEntry recordResolution(
            String pendingRequestId,
            String resolvedBy,
            String agentId,
            String action,
            String resource,
            DecisionResult result,
            List<TraceEntry> trace) {
        return save(AuditLogEntry.builder()
                .agentId(agentId)
                .action(action)
                .resource(resource)
                .result(result)
                .reason(DecisionReason.HUMAN_OVERRIDE)
                .decisionTrace(trace)
                .pendingRequestId(pendingRequestId)
                .resolvedBy(resolvedBy)
                .build());
    }

    /**
     * Entries matching the optional agent filter and inclusive time bounds, oldest first.
     */
    @Transactional(readOnly = true)
    public List<AuditLogEntry> query(String agentId, LocalDateTime start, LocalDateTime end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new ValidationException("start_time must not be after end_time");
        }
        LocalDateTime from = start != null ? start : EARLIEST;
        LocalDateTime to = end != null ? end : LATEST;

        List<AuditLogEntity> entities = agentId != null
                ? auditLogJpaRepository.findByAgentIdAndTimestampBetweenOrderByTimestampAscIdAsc(agentId, from, to)
                : auditLogJpaRepository.findByTimestampBetweenOrderByTimestampAscIdAsc(from, to);
        return auditLogMapper.toDomainList(entities);
    }

    private AuditLogEntry save(AuditLogEntry entry) {
        if (entry.getResult() != DecisionResult.APPROVED && entry.getResult() != DecisionResult.DENIED) {
            throw new IllegalArgumentException("Only terminal decisions are audited, got " + entry.getResult());
        }
        entry.setTimestamp(LocalDateTime.now(clock));
        AuditLogEntity saved = auditLogJpaRepository.save(auditLogMapper.toEntity(entry));
        log.debug(
                "Audit entry {} recorded: agent={}, action={}, resource={}, result={}",
                saved.getId(),
                entry.getAgentId(),
                entry.getAction(),
                entry.getResource(),
                entry.getResult());
        return auditLogMapper.toDomain(saved);
    }
}
