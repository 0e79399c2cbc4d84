package com.agentguard.domain.model;

import com.agentguard.domain.enums.AgentStatus;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * An autonomous agent whose actions are evaluated by the decision engine.
 *
 * <p>Only the recorded {@code owner} may enable or disable the agent. Agents are
 * created and removed by administrative tooling outside the engine.
 */
@Data
@Builder
public class Agent {

    private String id;

    private String name;

    /** Owner identity; the only caller allowed to flip the agent's status. */
    private String owner;

    private AgentStatus status;

    private LocalDateTime createdAt;

    public boolean isDisabled() {
        return status == AgentStatus.DISABLED;
    }
}
