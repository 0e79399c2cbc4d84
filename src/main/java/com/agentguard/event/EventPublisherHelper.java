package com.agentguard.event;

import com.agentguard.domain.enums.AgentStatus;
import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.DecisionResult;
import com.agentguard.domain.enums.KillSwitchState;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods around Spring's {@link ApplicationEventPublisher} for
 * {@link DecisionEvent}. Delivery is synchronous to plain {@code @EventListener}s.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishDecisionRecorded(Object source, String agentId, DecisionResult result, DecisionReason reason) {
        applicationEventPublisher.publishEvent(
                new DecisionEvent(source, DecisionEventType.DECISION_RECORDED, agentId, result, reason, null));
    }

    public void publishEscalationCreated(Object source, String agentId, DecisionReason reason, String requestId) {
        applicationEventPublisher.publishEvent(new DecisionEvent(
                source, DecisionEventType.ESCALATION_CREATED, agentId, DecisionResult.PENDING, reason, requestId));
    }

    public void publishEscalationResolved(
            Object source, String agentId, DecisionResult result, String requestId, String humanId) {
        applicationEventPublisher.publishEvent(new DecisionEvent(
                source,
                DecisionEventType.ESCALATION_RESOLVED,
                agentId,
                result,
                DecisionReason.HUMAN_OVERRIDE,
                requestId,
                Map.of("resolvedBy", humanId)));
    }

    public void publishKillSwitchChanged(Object source, KillSwitchState state) {
        applicationEventPublisher.publishEvent(new DecisionEvent(
                source,
                DecisionEventType.KILL_SWITCH_CHANGED,
                null,
                null,
                null,
                null,
                Map.of("state", state.getValue())));
    }

    public void publishAgentStatusChanged(Object source, String agentId, String owner, AgentStatus status) {
        applicationEventPublisher.publishEvent(new DecisionEvent(
                source,
                DecisionEventType.AGENT_STATUS_CHANGED,
                agentId,
                null,
                null,
                null,
                Map.of("owner", owner, "status", status.getValue())));
    }
}
