package com.agentguard.domain.model;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.DecisionResult;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Immutable record of one completed decision, automatic or human-resolved.
 *
 * <p>{@code result} is always APPROVED or DENIED. {@code pendingRequestId} and
 * {@code resolvedBy} are set only for human resolutions and tie the entry back to the
 * escalated request.
 */
@Data
@Builder
public class AuditLogEntry {

    private Long id;

    private String agentId;

    private String action;

    private String resource;

    private DecisionResult result;

    private DecisionReason reason;

    private List<TraceEntry> decisionTrace;

    private String pendingRequestId;

    private String resolvedBy;

    private LocalDateTime timestamp;
}
