package com.agentguard.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of an escalated request. PENDING transitions exactly once to APPROVED or
 * DENIED; terminal statuses are never re-opened.
 */
public enum PendingStatus {
    PENDING("pending"),
    APPROVED("approved"),
    DENIED("denied");

    private final String value;

    PendingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
