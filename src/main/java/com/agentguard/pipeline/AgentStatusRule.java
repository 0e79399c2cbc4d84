package com.agentguard.pipeline;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.RuleName;
import com.agentguard.domain.model.Agent;
import com.agentguard.domain.model.TraceEntry;
import com.agentguard.mapper.AgentMapper;
import com.agentguard.repository.jpa.AgentJpaRepository;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Second rule: unknown and disabled agents are denied. An unknown agent is a verdict here,
 * not an error, so the caller still receives a decision and a trace.
 */
@Component
public class AgentStatusRule implements DecisionRule {

    private final AgentJpaRepository agentJpaRepository;
    private final AgentMapper agentMapper;

    public AgentStatusRule(AgentJpaRepository agentJpaRepository, AgentMapper agentMapper) {
        this.agentJpaRepository = agentJpaRepository;
        this.agentMapper = agentMapper;
    }

    @Override
    public RuleName name() {
        return RuleName.AGENT_STATUS;
    }

    @Override
    public RuleOutcome evaluate(RuleContext context) {
        Optional<Agent> agent = agentJpaRepository.findById(context.getAgentId()).map(agentMapper::toDomain);

        if (agent.isEmpty()) {
            return RuleOutcome.deny(
                    DecisionReason.AGENT_NOT_FOUND,
                    "Agent " + context.getAgentId() + " not found",
                    TraceEntry.failed(name(), "agent not found"));
        }
        if (agent.get().isDisabled()) {
            return RuleOutcome.deny(
                    DecisionReason.AGENT_DISABLED,
                    "Agent " + context.getAgentId() + " is disabled",
                    TraceEntry.failed(name(), "agent disabled"));
        }
        return RuleOutcome.pass(TraceEntry.passed(name(), "agent active"));
    }
}
