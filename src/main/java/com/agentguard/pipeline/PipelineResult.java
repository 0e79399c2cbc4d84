package com.agentguard.pipeline;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.Verdict;
import com.agentguard.domain.model.TraceEntry;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Verdict of a full pipeline run. The trace lists only the rules that actually ran, in
 * the order they ran.
 */
@Getter
@Builder
public class PipelineResult {

    private final Verdict verdict;
    private final DecisionReason reason;
    private final String message;
    private final List<TraceEntry> trace;

    public boolean isEscalated() {
        return verdict == Verdict.ESCALATED;
    }
}
