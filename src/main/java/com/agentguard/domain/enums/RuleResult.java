package com.agentguard.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RuleResult {
    PASSED("passed"),
    FAILED("failed");

    private final String value;

    RuleResult(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
