package com.agentguard.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable reason attached to every decision and audit entry.
 */
public enum DecisionReason {
    ALL_CHECKS_PASSED("all_checks_passed"),
    PERMISSION_RULE_FAILED("permission_rule_failed"),
    AGENT_DISABLED("agent_disabled"),
    AGENT_NOT_FOUND("agent_not_found"),
    SYSTEM_KILL_SWITCH_ENABLED("system_kill_switch_enabled"),
    HUMAN_OVERRIDE("human_override");

    private final String value;

    DecisionReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
