package com.agentguard.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Owner-scoped enable/disable of a single agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentKillRequest {

    @NotBlank(message = "agent_id is required")
    @Size(max = 255, message = "agent_id must be 255 characters or less")
    private String agentId;

    @NotBlank(message = "owner is required")
    @Size(max = 255, message = "owner must be 255 characters or less")
    private String owner;

    @NotNull(message = "enabled is required")
    private Boolean enabled;
}
