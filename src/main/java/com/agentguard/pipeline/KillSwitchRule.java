package com.agentguard.pipeline;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.RuleName;
import com.agentguard.domain.model.TraceEntry;
import com.agentguard.service.SystemStateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * First rule: while the system kill switch is enabled every request is routed to a human
 * reviewer. It never hard-denies.
 */
@Component
public class KillSwitchRule implements DecisionRule {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchRule.class);

    private final SystemStateService systemStateService;

    public KillSwitchRule(SystemStateService systemStateService) {
        this.systemStateService = systemStateService;
    }

    @Override
    public RuleName name() {
        return RuleName.KILL_SWITCH;
    }

    @Override
    public RuleOutcome evaluate(RuleContext context) {
        if (systemStateService.currentState().isEnabled()) {
            log.warn(
                    "Kill switch enabled, escalating: agent={}, action={}, resource={}",
                    context.getAgentId(),
                    context.getAction(),
                    context.getResource());
            return RuleOutcome.escalate(
                    DecisionReason.SYSTEM_KILL_SWITCH_ENABLED,
                    "System-wide kill switch is enabled. The request is awaiting human review.",
                    TraceEntry.failed(name(), "system kill switch enabled"));
        }
        return RuleOutcome.pass(TraceEntry.passed(name(), "kill switch off"));
    }
}
