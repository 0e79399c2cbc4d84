package com.agentguard.api.dto.response;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.DecisionResult;
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

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LogResponse {

    private Long id;
    private String agentId;
    private String action;
    private String resource;
    private DecisionResult result;
    private DecisionReason reason;
    private List<TraceEntry> decisionTrace;
    private String pendingRequestId;
    private String resolvedBy;
    private Instant timestamp;
}
