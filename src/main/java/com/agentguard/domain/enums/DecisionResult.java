package com.agentguard.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Caller-facing result of a decision. PENDING is only ever returned for escalated
 * requests and is never written to the audit log.
 */
public enum DecisionResult {
    APPROVED("approved"),
    DENIED("denied"),
    PENDING("pending");

    private final String value;

    DecisionResult(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
