package com.agentguard.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an agent.
 *
 * <p>Agents are never deleted while logs reference them; they are retired by flipping
 * to DISABLED. A disabled agent can never receive an approved verdict.
 */
public enum AgentStatus {
    ACTIVE("active"),
    DISABLED("disabled");

    private final String value;

    AgentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
