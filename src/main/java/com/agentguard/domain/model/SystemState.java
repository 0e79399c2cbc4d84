package com.agentguard.domain.model;

import com.agentguard.domain.enums.KillSwitchState;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * The singleton system-wide kill switch row.
 */
@Data
@Builder
public class SystemState {

    public static final String KILL_SWITCH_KEY = "system_kill_switch";

    private String key;

    private KillSwitchState state;

    private LocalDateTime updatedAt;
}
