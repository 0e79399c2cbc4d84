package com.agentguard.domain.enums;

/**
 * Names written into the {@code rule_checked} field of a decision trace.
 */
public enum RuleName {
    KILL_SWITCH("kill_switch"),
    AGENT_STATUS("agent_status"),
    PERMISSION_RULE("permission_rule"),
    HUMAN_DECISION("human_decision");

    private final String value;

    RuleName(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
