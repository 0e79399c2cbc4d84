package com.agentguard.pipeline;

import com.agentguard.condition.EvaluationContext;
import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.Verdict;
import com.agentguard.domain.model.TraceEntry;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs the decision rules in a fixed order: kill switch, agent status, permission.
 *
 * <p>Evaluation is strictly sequential and stops at the first denying or escalating
 * rule, so the trace holds one entry per rule that actually ran. Rules only read state;
 * recording the outcome is the caller's job.
 */
@Component
public class RulePipeline {

    private static final Logger log = LoggerFactory.getLogger(RulePipeline.class);

    private final List<DecisionRule> rules;
    private final Clock clock;
    private final ZoneId conditionZone;

    public RulePipeline(
            KillSwitchRule killSwitchRule,
            AgentStatusRule agentStatusRule,
            PermissionRule permissionRule,
            Clock clock,
            @Qualifier("conditionZone") ZoneId conditionZone) {
        this.rules = List.of(killSwitchRule, agentStatusRule, permissionRule);
        this.clock = clock;
        this.conditionZone = conditionZone;
    }

    public PipelineResult evaluate(String agentId, String action, String resource) {
        RuleContext context = RuleContext.builder()
                .agentId(agentId)
                .action(action)
                .resource(resource)
                .evaluation(new EvaluationContext(clock.instant(), conditionZone))
                .build();

        List<TraceEntry> trace = new ArrayList<>(rules.size());
        String message = null;
        for (DecisionRule rule : rules) {
            RuleOutcome outcome = rule.evaluate(context);
            trace.add(outcome.getTraceEntry());
            if (outcome.isTerminal()) {
                log.debug(
                        "Rule {} ended evaluation with {}",
                        outcome.getTraceEntry().getRuleChecked(),
                        outcome.getVerdict());
                return PipelineResult.builder()
                        .verdict(outcome.getVerdict())
                        .reason(outcome.getReason())
                        .message(outcome.getMessage())
                        .trace(List.copyOf(trace))
                        .build();
            }
            if (outcome.getMessage() != null) {
                message = outcome.getMessage();
            }
        }

        return PipelineResult.builder()
                .verdict(Verdict.APPROVED)
                .reason(DecisionReason.ALL_CHECKS_PASSED)
                .message(message != null ? message : "All checks passed")
                .trace(List.copyOf(trace))
                .build();
    }
}
