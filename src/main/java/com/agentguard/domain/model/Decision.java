package com.agentguard.domain.model;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.DecisionResult;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Caller-facing outcome of {@code checkRequest} or {@code resolvePending}.
 *
 * <p>{@code actionRequired} is {@value #HUMAN_INTERVENTION} only for escalated
 * requests, in which case {@code requestId} names the pending record to poll.
 */
@Getter
@Builder
public class Decision {

    public static final String HUMAN_INTERVENTION = "human_intervention";

    private final DecisionResult result;

    private final String message;

    private final DecisionReason reason;

    private final List<TraceEntry> decisionTrace;

    private final String actionRequired;

    private final String requestId;

    public boolean isPending() {
        return result == DecisionResult.PENDING;
    }
}
