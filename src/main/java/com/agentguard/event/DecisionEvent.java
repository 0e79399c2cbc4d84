package com.agentguard.event;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.DecisionResult;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the decision facade after a state change has been committed: a recorded
 * decision, a new or resolved escalation, a kill switch flip, or an agent being enabled or
 * disabled.
 *
 * <p>Listeners: {@code DecisionMetricsService}. Fields not relevant to an event type are
 * null, e.g. {@code result} on a kill switch change.
 */
public class DecisionEvent extends ApplicationEvent {

    private final DecisionEventType eventType;
    private final String agentId;
    private final DecisionResult result;
    private final DecisionReason reason;
    private final String requestId;
    private final Map<String, Object> details;

    public DecisionEvent(
            Object source,
            DecisionEventType eventType,
            String agentId,
            DecisionResult result,
            DecisionReason reason,
            String requestId) {
        this(source, eventType, agentId, result, reason, requestId, null);
    }

    public DecisionEvent(
            Object source,
            DecisionEventType eventType,
            String agentId,
            DecisionResult result,
            DecisionReason reason,
            String requestId,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.agentId = agentId;
        this.result = result;
        this.reason = reason;
        this.requestId = requestId;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public DecisionEventType getEventType() {
        return eventType;
    }

    public String getAgentId() {
        return agentId;
    }

    public DecisionResult getResult() {
        return result;
    }

    public DecisionReason getReason() {
        return reason;
    }

    public String getRequestId() {
        return requestId;
    }

    /**
     * Event-specific values, e.g. {"state": "enabled"} for a kill switch change or
     * {"status": "disabled", "owner": "alice"} for an agent status change.
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
