package com.agentguard.event;

/**
 * Classifies a {@link DecisionEvent}.
 */
public enum DecisionEventType {
    /** An automatic approved/denied verdict was recorded. */
    DECISION_RECORDED,
    /** A request was escalated and a pending record created. */
    ESCALATION_CREATED,
    /** A human resolved a pending request. */
    ESCALATION_RESOLVED,
    /** The system-wide kill switch was flipped. */
    KILL_SWITCH_CHANGED,
    /** An owner enabled or disabled an agent. */
    AGENT_STATUS_CHANGED
}
