package com.agentguard.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An agent asking whether it may perform {@code action} on {@code resource}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentRequest {

    @NotBlank(message = "agent_id is required")
    @Size(max = 255, message = "agent_id must be 255 characters or less")
    private String agentId;

    @NotBlank(message = "action is required")
    @Size(max = 100, message = "action must be 100 characters or less")
    private String action;

    @NotBlank(message = "resource is required")
    @Size(max = 255, message = "resource must be 255 characters or less")
    private String resource;
}
