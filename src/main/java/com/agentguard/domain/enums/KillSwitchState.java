package com.agentguard.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Value of the system-wide kill switch row.
 */
public enum KillSwitchState {
    ENABLED("enabled"),
    DISABLED("disabled");

    private final String value;

    KillSwitchState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isEnabled() {
        return this == ENABLED;
    }

    public static KillSwitchState of(boolean enabled) {
        return enabled ? ENABLED : DISABLED;
    }

    /** Parses a configured value ("enabled"/"disabled", case-insensitive). */
    public static KillSwitchState fromValue(String value) {
        for (KillSwitchState state : values()) {
            if (state.value.equalsIgnoreCase(value.trim())) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown kill switch state: " + value);
    }
}
