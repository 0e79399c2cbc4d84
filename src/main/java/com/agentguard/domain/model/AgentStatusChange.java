package com.agentguard.domain.model;

import com.agentguard.domain.enums.AgentStatus;
import lombok.Builder;
import lombok.Getter;

/**
 * Result of an owner enabling or disabling one of their agents.
 */
@Getter
@Builder
public class AgentStatusChange {

    private final String agentId;

    private final String owner;

    private final AgentStatus previousStatus;

    private final AgentStatus status;

    private final String message;
}
