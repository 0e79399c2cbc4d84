package com.agentguard.domain.enums;

/**
 * Verdict a human reviewer hands down on an escalated request.
 */
public enum HumanDecision {
    APPROVE,
    DENY;

    public PendingStatus toStatus() {
        return this == APPROVE ? PendingStatus.APPROVED : PendingStatus.DENIED;
    }

    public DecisionResult toResult() {
        return this == APPROVE ? DecisionResult.APPROVED : DecisionResult.DENIED;
    }
}
