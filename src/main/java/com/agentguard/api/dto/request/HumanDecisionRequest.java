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
 * A reviewer's verdict on an escalated request. The verdict itself is given by the
 * endpoint (approve or deny).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HumanDecisionRequest {

    @NotBlank(message = "request_id is required")
    @Size(max = 255, message = "request_id must be 255 characters or less")
    private String requestId;

    @NotBlank(message = "human_id is required")
    @Size(max = 255, message = "human_id must be 255 characters or less")
    private String humanId;

    @Size(max = 500, message = "notes must be 500 characters or less")
    private String notes;
}
