package com.agentguard.pipeline;

import com.agentguard.condition.ConditionCheck;
import com.agentguard.condition.ConditionEvaluator;
import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.RuleName;
import com.agentguard.domain.model.Permission;
import com.agentguard.domain.model.TraceEntry;
import com.agentguard.mapper.PermissionMapper;
import com.agentguard.repository.jpa.PermissionJpaRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Last rule: default-deny permission match.
 *
 * <p>Candidates for (agent, action, resource) are tried in creation order and the first
 * one whose condition holds grants the request. A malformed condition never grants, and
 * shows up in the trace note so bad permission data is visible to operators.
 */
@Component
public class PermissionRule implements DecisionRule {

    private static final Logger log = LoggerFactory.getLogger(PermissionRule.class);

    private final PermissionJpaRepository permissionJpaRepository;
    private final PermissionMapper permissionMapper;
    private final ConditionEvaluator conditionEvaluator;

    public PermissionRule(
            PermissionJpaRepository permissionJpaRepository,
            PermissionMapper permissionMapper,
            ConditionEvaluator conditionEvaluator) {
        this.permissionJpaRepository = permissionJpaRepository;
        this.permissionMapper = permissionMapper;
        this.conditionEvaluator = conditionEvaluator;
    }

    @Override
    public RuleName name() {
        return RuleName.PERMISSION_RULE;
    }

    @Override
    public RuleOutcome evaluate(RuleContext context) {
        String action = context.getAction();
        String resource = context.getResource();
        List<Permission> candidates = permissionMapper.toDomainList(
                permissionJpaRepository.findByAgentIdAndActionAndResourceOrderByIdAsc(
                        context.getAgentId(), action, resource));

        if (candidates.isEmpty()) {
            return RuleOutcome.deny(
                    DecisionReason.PERMISSION_RULE_FAILED,
                    "No permission for " + action + " on " + resource,
                    TraceEntry.failed(name(), "no permission for " + action + " on " + resource));
        }

        Permission unmet = null;
        Permission malformed = null;
        for (Permission candidate : candidates) {
            ConditionCheck check = conditionEvaluator.check(candidate.getCondition(), context.getEvaluation());
            if (check.isHolds()) {
                return RuleOutcome.pass(
                        TraceEntry.passed(name(), "permission granted for " + action + " on " + resource),
                        "Permission granted for " + action + " on " + resource);
            }
            if (check.isMalformed()) {
                log.warn(
                        "Malformed condition on permission {}: '{}' ({})",
                        candidate.getId(),
                        candidate.getCondition(),
                        check.getDetail());
                malformed = candidate;
            } else {
                unmet = candidate;
            }
        }

        String notes = malformed != null
                ? "malformed condition on permission " + malformed.getId() + ": " + malformed.getCondition()
                : "condition not met for " + action + " on " + resource + ": " + unmet.getCondition();
        return RuleOutcome.deny(
                DecisionReason.PERMISSION_RULE_FAILED,
                "Permission conditions not satisfied for " + action + " on " + resource,
                TraceEntry.failed(name(), notes));
    }
}
