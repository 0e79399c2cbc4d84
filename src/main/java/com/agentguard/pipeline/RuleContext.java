package com.agentguard.pipeline;

import com.agentguard.condition.EvaluationContext;
import lombok.Builder;
import lombok.Getter;

/**
 * The request under evaluation plus the evaluation instant shared by every rule of one
 * pipeline run.
 */
@Getter
@Builder
public class RuleContext {

    private final String agentId;
    private final String action;
    private final String resource;
    private final EvaluationContext evaluation;
}
