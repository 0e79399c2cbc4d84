package com.agentguard.pipeline;

import com.agentguard.domain.enums.RuleName;

/**
 * One step of the decision pipeline. Implementations read whatever state they need,
 * report exactly one trace entry, and never write anything.
 */
public interface DecisionRule {

    RuleName name();

    RuleOutcome evaluate(RuleContext context);
}
