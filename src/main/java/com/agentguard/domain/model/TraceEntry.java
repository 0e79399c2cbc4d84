package com.agentguard.domain.model;

import com.agentguard.domain.enums.RuleName;
import com.agentguard.domain.enums.RuleResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One step of a decision trace: which rule ran, whether it passed, and why.
 *
 * <p>Serialized with snake_case names because the trace is part of the external
 * response contract and is also stored verbatim as JSON on pending requests and
 * audit entries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraceEntry {

    @JsonProperty("rule_checked")
    private String ruleChecked;

    @JsonProperty("rule_result")
    private RuleResult ruleResult;

    private String notes;

    public static TraceEntry passed(RuleName rule, String notes) {
        return new TraceEntry(rule.getValue(), RuleResult.PASSED, notes);
    }

    public static TraceEntry failed(RuleName rule, String notes) {
        return new TraceEntry(rule.getValue(), RuleResult.FAILED, notes);
    }
}
