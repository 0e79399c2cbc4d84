package com.agentguard.api.dto.response;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.DecisionResult;
import com.agentguard.domain.model.TraceEntry;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Outcome of a permission check or a human resolution.
 *
 * <p>{@code action_required} is always present (null unless the request was escalated);
 * {@code request_id} is only present when a pending request is involved.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DecisionResponse {

    private DecisionResult result;
    private String message;
    private DecisionReason reason;
    private List<TraceEntry> decisionTrace;
    private String actionRequired;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String requestId;
}
