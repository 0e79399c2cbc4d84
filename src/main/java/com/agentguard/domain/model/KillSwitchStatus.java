package com.agentguard.domain.model;

import com.agentguard.domain.enums.KillSwitchState;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;

/**
 * Current system kill switch flag plus a human-readable description.
 */
@Getter
@Builder
public class KillSwitchStatus {

    private final KillSwitchState state;

    private final String message;

    private final LocalDateTime updatedAt;

    public static KillSwitchStatus of(SystemState systemState) {
        KillSwitchState state = systemState.getState();
        return KillSwitchStatus.builder()
                .state(state)
                .message("System kill switch is " + state.getValue() + ". Agent requests are "
                        + (state.isEnabled() ? "escalated for human review" : "processed normally") + ".")
                .updatedAt(systemState.getUpdatedAt())
                .build();
    }
}
