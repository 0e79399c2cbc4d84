package com.agentguard.service;

import com.agentguard.audit.AuditRecorder;
import com.agentguard.domain.enums.AgentStatus;
import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.DecisionResult;
import com.agentguard.domain.enums.HumanDecision;
import com.agentguard.domain.enums.KillSwitchState;
import com.agentguard.domain.enums.Verdict;
import com.agentguard.domain.model.Agent;
import com.agentguard.domain.model.AgentStatusChange;
import com.agentguard.domain.model.AuditLogEntry;
import com.agentguard.domain.model.Decision;
import com.agentguard.domain.model.KillSwitchStatus;
import com.agentguard.domain.model.PendingRequest;
import com.agentguard.escalation.EscalationManager;
import com.agentguard.event.EventPublisherHelper;
import com.agentguard.exception.ForbiddenException;
import com.agentguard.exception.ResourceNotFoundException;
import com.agentguard.exception.ValidationException;
import com.agentguard.mapper.AgentMapper;
import com.agentguard.pipeline.PipelineResult;
import com.agentguard.pipeline.RulePipeline;
import com.agentguard.repository.jpa.AgentJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point for everything callers can do with the engine.
 *
 * <p>{@link #checkRequest} runs the rule pipeline and then either records the verdict in
 * the audit trail (approved/denied) or opens a pending request (escalated). The two are
 * exclusive: an escalated request is audited only when a human resolves it.
 *
 * <p>Events are published after the persistence step returns, so listeners only see
 * committed state.
 */
@Service
public class DecisionFacade {

    private static final Logger log = LoggerFactory.getLogger(DecisionFacade.class);

    private final RulePipeline rulePipeline;
    private final EscalationManager escalationManager;
    private final AuditRecorder auditRecorder;
    private final SystemStateService systemStateService;
    private final AgentJpaRepository agentJpaRepository;
    private final AgentMapper agentMapper;
    private final EventPublisherHelper eventPublisherHelper;

    public DecisionFacade(
            RulePipeline rulePipeline,
            EscalationManager escalationManager,
            AuditRecorder auditRecorder,
            SystemStateService systemStateService,
            AgentJpaRepository agentJpaRepository,
            AgentMapper agentMapper,
            EventPublisherHelper eventPublisherHelper) {
        this.rulePipeline = rulePipeline;
        this.escalationManager = escalationManager;
        this.auditRecorder = auditRecorder;
        this.systemStateService = systemStateService;
        this.agentJpaRepository = agentJpaRepository;
        this.agentMapper = agentMapper;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public Decision checkRequest(String agentId, String action, String resource) {
        agentId = ValidationException.requireText(agentId, "agent_id");
        action = ValidationException.requireText(action, "action");
        resource = ValidationException.requireText(resource, "resource");

        PipelineResult result = rulePipeline.evaluate(agentId, action, resource);

        if (result.isEscalated()) {
            PendingRequest pending =
                    escalationManager.escalate(agentId, action, resource, result.getReason(), result.getTrace());
            log.warn(
                    "Request escalated: agent={}, action={}, resource={}, reason={}, requestId={}",
                    agentId,
                    action,
                    resource,
                    result.getReason().getValue(),
                    pending.getRequestId());
            eventPublisherHelper.publishEscalationCreated(this, agentId, result.getReason(), pending.getRequestId());
            return Decision.builder()
                    .result(DecisionResult.PENDING)
                    .message(result.getMessage())
                    .reason(result.getReason())
                    .decisionTrace(result.getTrace())
                    .actionRequired(Decision.HUMAN_INTERVENTION)
                    .requestId(pending.getRequestId())
                    .build();
        }

        DecisionResult decisionResult =
                result.getVerdict() == Verdict.APPROVED ? DecisionResult.APPROVED : DecisionResult.DENIED;
        auditRecorder.record(agentId, action, resource, decisionResult, result.getReason(), result.getTrace());

        if (decisionResult == DecisionResult.APPROVED) {
            log.info("Request approved: agent={}, action={}, resource={}", agentId, action, resource);
        } else {
            log.warn(
                    "Request denied: agent={}, action={}, resource={}, reason={}",
                    agentId,
                    action,
                    resource,
                    result.getReason().getValue());
        }
        eventPublisherHelper.publishDecisionRecorded(this, agentId, decisionResult, result.getReason());

        return Decision.builder()
                .result(decisionResult)
                .message(result.getMessage())
                .reason(result.getReason())
                .decisionTrace(result.getTrace())
                .build();
    }

    /**
     * Enables or disables an agent on behalf of its owner. Only the recorded owner may do
     * this.
     */
    public AgentStatusChange setAgentEnabled(String agentId, String ownerId, boolean enabled) {
        String id = ValidationException.requireText(agentId, "agent_id");
        String owner = ValidationException.requireText(ownerId, "owner");

        Agent agent = agentJpaRepository
                .findById(id)
                .map(agentMapper::toDomain)
                .orElseThrow(() -> ResourceNotFoundException.agent(id));
        if (!agent.getOwner().equals(owner)) {
            log.warn("Owner mismatch on agent {}: requested by {}", id, owner);
            throw new ForbiddenException("Only the owner of agent " + id + " can enable or disable it");
        }

        AgentStatus newStatus = enabled ? AgentStatus.ACTIVE : AgentStatus.DISABLED;
        if (agentJpaRepository.updateStatusForOwner(id, owner, newStatus) == 0) {
            // Owner changed between read and update
            throw new ForbiddenException("Only the owner of agent " + id + " can enable or disable it");
        }

        String verb = enabled ? "enabled" : "disabled";
        log.warn("Agent {} {} by owner {}", id, verb, owner);
        eventPublisherHelper.publishAgentStatusChanged(this, id, owner, newStatus);
        return AgentStatusChange.builder()
                .agentId(id)
                .owner(owner)
                .previousStatus(agent.getStatus())
                .status(newStatus)
                .message("Agent " + id + " has been " + verb + " by owner " + owner)
                .build();
    }

    public KillSwitchStatus setSystemKillSwitch(boolean enabled) {
        KillSwitchStatus status = systemStateService.setState(KillSwitchState.of(enabled));
        eventPublisherHelper.publishKillSwitchChanged(this, status.getState());
        return status;
    }

    public KillSwitchStatus getSystemKillSwitch() {
        return systemStateService.getStatus();
    }

    public List<PendingRequest> listPendingRequests() {
        return escalationManager.listPending();
    }

    public PendingRequest getPendingRequest(String requestId) {
        return escalationManager.getPending(ValidationException.requireText(requestId, "request_id"));
    }

    /**
     * Finalizes an escalated request with a human verdict.
     *
     * @throws ResourceNotFoundException for an unknown request id
     * @throws com.agentguard.exception.ConflictException if it was already resolved
     */
    public Decision resolvePending(String requestId, String humanId, HumanDecision decision, String notes) {
        requestId = ValidationException.requireText(requestId, "request_id");
        humanId = ValidationException.requireText(humanId, "human_id");
        if (decision == null) {
            throw new ValidationException("decision must not be empty");
        }
        String trimmedNotes = notes != null && !notes.isBlank() ? notes.trim() : null;

        PendingRequest resolved = escalationManager.resolve(requestId, humanId, decision, trimmedNotes);
        DecisionResult result = decision.toResult();
        eventPublisherHelper.publishEscalationResolved(this, resolved.getAgentId(), result, requestId, humanId);

        return Decision.builder()
                .result(result)
                .message("Request " + requestId + " " + result.getValue() + " by human " + humanId)
                .reason(DecisionReason.HUMAN_OVERRIDE)
                .decisionTrace(resolved.getDecisionTrace())
                .requestId(requestId)
                .build();
    }

    public List<AuditLogEntry> queryLogs(String agentId, LocalDateTime startTime, LocalDateTime endTime) {
        String filter = agentId != null && !agentId.isBlank() ? agentId.trim() : null;
        return auditRecorder.query(filter, startTime, endTime);
    }
}
