package com.agentguard.pipeline;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.Verdict;
import com.agentguard.domain.model.TraceEntry;
import lombok.Getter;

/**
 * What a single rule decided. A passing outcome lets the pipeline continue; a denying or
 * escalating outcome is terminal.
 */
@Getter
public class RuleOutcome {

    /** Null for a pass: the pipeline has not reached a verdict yet. */
    private final Verdict verdict;

    private final DecisionReason reason;
    private final String message;
    private final TraceEntry traceEntry;

    private RuleOutcome(Verdict verdict, DecisionReason reason, String message, TraceEntry traceEntry) {
        this.verdict = verdict;
        this.reason = reason;
        this.message = message;
        this.traceEntry = traceEntry;
    }

    public static RuleOutcome pass(TraceEntry traceEntry) {
        return new RuleOutcome(null, null, null, traceEntry);
    }

    public static RuleOutcome pass(TraceEntry traceEntry, String message) {
        return new RuleOutcome(null, null, message, traceEntry);
    }

    public static RuleOutcome deny(DecisionReason reason, String message, TraceEntry traceEntry) {
        return new RuleOutcome(Verdict.DENIED, reason, message, traceEntry);
    }

    public static RuleOutcome escalate(DecisionReason reason, String message, TraceEntry traceEntry) {
        return new RuleOutcome(Verdict.ESCALATED, reason, message, traceEntry);
    }

    public boolean isTerminal() {
        return verdict != null;
    }
}
