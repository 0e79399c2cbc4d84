package com.agentguard.api.dto.response;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.PendingStatus;
import com.agentguard.domain.model.TraceEntry;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An escalated request as seen by reviewers and by agents polling for the outcome.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PendingApprovalResponse {

    private String requestId;
    private String agentId;
    private String action;
    private String resource;
    private DecisionReason reason;
    private List<TraceEntry> decisionTrace;
    private PendingStatus status;

    /** {@code human_intervention} while pending, null once resolved. */
    private String actionRequired;

    private Instant createdAt;
    private String resolvedBy;
    private String resolutionNotes;
    private Instant resolvedAt;
}
