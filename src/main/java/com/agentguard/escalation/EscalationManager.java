package com.agentguard.escalation;

import com.agentguard.audit.AuditRecorder;
import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.HumanDecision;
import com.agentguard.domain.enums.PendingStatus;
import com.agentguard.domain.enums.RuleName;
import com.agentguard.domain.model.PendingRequest;
import com.agentguard.domain.model.TraceEntry;
import com.agentguard.entity.PendingRequestEntity;
import com.agentguard.exception.ConflictException;
import com.agentguard.exception.ResourceNotFoundException;
import com.agentguard.mapper.JsonHelper;
import com.agentguard.mapper.PendingRequestMapper;
import com.agentguard.repository.jpa.PendingRequestJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the lifecycle of escalated requests: PENDING, then exactly once APPROVED or DENIED.
 *
 * <p>Resolution is a compare-and-set on the status column ({@code UPDATE ... WHERE status =
 * 'PENDING'}) followed by the audit insert, both in one transaction. Of several concurrent
 * resolvers, across threads or instances, only one sees an update count of 1; the others
 * get a {@link ConflictException} describing the decision that won. No in-process locks
 * are used.
 */
@Service
public class EscalationManager {

    private static final Logger log = LoggerFactory.getLogger(EscalationManager.class);

    private final PendingRequestJpaRepository pendingRequestJpaRepository;
    private final PendingRequestMapper pendingRequestMapper;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    public EscalationManager(
            PendingRequestJpaRepository pendingRequestJpaRepository,
            PendingRequestMapper pendingRequestMapper,
            AuditRecorder auditRecorder,
            Clock clock) {
        this.pendingRequestJpaRepository = pendingRequestJpaRepository;
        this.pendingRequestMapper = pendingRequestMapper;
        this.auditRecorder = auditRecorder;
        this.clock = clock;
    }

    /**
     * Stores a new PENDING request carrying the trace computed so far.
     */
    @Transactional
    public PendingRequest escalate(
            String agentId, String action, String resource, DecisionReason reason, List<TraceEntry> trace) {
        PendingRequest pendingRequest = PendingRequest.builder()
                .requestId(UUID.randomUUID().toString())
                .agentId(agentId)
                .action(action)
                .resource(resource)
                .reason(reason)
                .decisionTrace(trace)
                .status(PendingStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();

        PendingRequestEntity saved = pendingRequestJpaRepository.save(pendingRequestMapper.toEntity(pendingRequest));
        log.info(
                "Escalated request {} for human review: agent={}, action={}, resource={}, reason={}",
                saved.getRequestId(),
                agentId,
                action,
                resource,
                reason.getValue());
        return pendingRequestMapper.toDomain(saved);
    }

    /** Requests still awaiting a verdict, oldest first. */
    @Transactional(readOnly = true)
    public List<PendingRequest> listPending() {
        return pendingRequestMapper.toDomainList(
                pendingRequestJpaRepository.findByStatusOrderByCreatedAtAsc(PendingStatus.PENDING));
    }

    @Transactional(readOnly = true)
    public PendingRequest getPending(String requestId) {
        return pendingRequestJpaRepository
                .findById(requestId)
                .map(pendingRequestMapper::toDomain)
                .orElseThrow(() -> ResourceNotFoundException.pendingRequest(requestId));
    }

    /**
     * Applies a human verdict to a PENDING request and writes its single audit entry.
     *
     * @return the request as resolved, with the human decision appended to its trace
     * @throws ResourceNotFoundException if no request has this id
     * @throws ConflictException if the request has already been resolved
     */
    @Transactional
    public PendingRequest resolve(String requestId, String humanId, HumanDecision decision, String notes) {
        PendingRequest current = getPending(requestId);
        if (!current.isPending()) {
            throw alreadyResolved(current);
        }

        List<TraceEntry> trace = new ArrayList<>(current.getDecisionTrace() != null ? current.getDecisionTrace() : List.of());
        trace.add(humanDecisionEntry(humanId, decision, notes));
        LocalDateTime resolvedAt = LocalDateTime.now(clock);

        int updated = pendingRequestJpaRepository.resolveIfPending(
                requestId,
                PendingStatus.PENDING,
                decision.toStatus(),
                humanId,
                notes,
                resolvedAt,
                JsonHelper.writeTrace(trace));
        if (updated == 0) {
            // Lost the race to a concurrent resolver
            throw alreadyResolved(getPending(requestId));
        }

        auditRecorder.recordResolution(
                requestId,
                humanId,
                current.getAgentId(),
                current.getAction(),
                current.getResource(),
                decision.toResult(),
                trace);

        current.setStatus(decision.toStatus());
        current.setResolvedBy(humanId);
        current.setResolutionNotes(notes);
        current.setResolvedAt(resolvedAt);
        current.setDecisionTrace(List.copyOf(trace));
        log.info("Request {} {} by human {}", requestId, decision.toStatus().getValue(), humanId);
        return current;
    }

    static TraceEntry humanDecisionEntry(String humanId, HumanDecision decision, String notes) {
        String text = (decision == HumanDecision.APPROVE ? "approved" : "denied") + " by human " + humanId;
        if (notes != null && !notes.isBlank()) {
            text = text + " (" + notes + ")";
        }
        return decision == HumanDecision.APPROVE
                ? TraceEntry.passed(RuleName.HUMAN_DECISION, text)
                : TraceEntry.failed(RuleName.HUMAN_DECISION, text);
    }

    private ConflictException alreadyResolved(PendingRequest existing) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("request_id", existing.getRequestId());
        details.put("status", existing.getStatus().getValue());
        details.put("resolved_by", existing.getResolvedBy());
        details.put("resolved_at", existing.getResolvedAt() != null ? existing.getResolvedAt().toString() : null);
        return new ConflictException(
                "Request " + existing.getRequestId() + " was already " + existing.getStatus().getValue()
                        + " by " + existing.getResolvedBy(),
                details);
    }
}
