package com.agentguard.api.dto.response;

import com.agentguard.domain.enums.AgentStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentKillResponse {

    private String agentId;
    private String owner;
    private boolean enabled;
    private AgentStatus status;
    private AgentStatus previousStatus;
    private String message;
}
