package com.agentguard.domain.model;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.PendingStatus;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * An escalated decision awaiting (or having received) a human verdict.
 *
 * <p>Created only by the escalation manager when the rule pipeline escalates.
 * While {@code status} is PENDING there is no audit entry for it; resolution flips the
 * status exactly once and writes exactly one audit entry.
 */
@Data
@Builder
public class PendingRequest {

    private String requestId;

    private String agentId;

    private String action;

    private String resource;

    /** Why the pipeline escalated, e.g. SYSTEM_KILL_SWITCH_ENABLED. */
    private DecisionReason reason;

    /**
     * Trace up to the escalation point while pending; after resolution, the same trace
     * extended with the human decision entry.
     */
    private List<TraceEntry> decisionTrace;

    private PendingStatus status;

    private LocalDateTime createdAt;

    private String resolvedBy;

    private String resolutionNotes;

    private LocalDateTime resolvedAt;

    public boolean isPending() {
        return status == PendingStatus.PENDING;
    }
}
