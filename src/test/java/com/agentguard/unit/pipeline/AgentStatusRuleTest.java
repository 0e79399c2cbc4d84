package com.agentguard.unit.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.agentguard.domain.enums.AgentStatus;
import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.RuleResult;
import com.agentguard.domain.enums.Verdict;
import com.agentguard.entity.AgentEntity;
import com.agentguard.mapper.AgentMapper;
import com.agentguard.pipeline.AgentStatusRule;
import com.agentguard.pipeline.RuleContext;
import com.agentguard.pipeline.RuleOutcome;
import com.agentguard.repository.jpa.AgentJpaRepository;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AgentStatusRuleTest {

    @Mock
    private AgentJpaRepository agentJpaRepository;

    private AgentStatusRule agentStatusRule;

    @BeforeEach
    void setUp() {
        agentStatusRule = new AgentStatusRule(agentJpaRepository, Mappers.getMapper(AgentMapper.class));
    }

    @Test
    @DisplayName("unknown agent is a denial with a trace, not an error")
    void unknownAgentDenied() {
        when(agentJpaRepository.findById("ghost")).thenReturn(Optional.empty());

        RuleOutcome outcome = agentStatusRule.evaluate(context("ghost"));

        assertThat(outcome.getVerdict()).isEqualTo(Verdict.DENIED);
        assertThat(outcome.getReason()).isEqualTo(DecisionReason.AGENT_NOT_FOUND);
        assertThat(outcome.getMessage()).isEqualTo("Agent ghost not found");
        assertThat(outcome.getTraceEntry().getNotes()).isEqualTo("agent not found");
    }

    @Test
    @DisplayName("disabled agent is denied")
    void disabledAgentDenied() {
        when(agentJpaRepository.findById("a2")).thenReturn(Optional.of(agent("a2", AgentStatus.DISABLED)));

        RuleOutcome outcome = agentStatusRule.evaluate(context("a2"));

        assertThat(outcome.getVerdict()).isEqualTo(Verdict.DENIED);
        assertThat(outcome.getReason()).isEqualTo(DecisionReason.AGENT_DISABLED);
        assertThat(outcome.getTraceEntry().getRuleResult()).isEqualTo(RuleResult.FAILED);
        assertThat(outcome.getTraceEntry().getNotes()).isEqualTo("agent disabled");
    }

    @Test
    @DisplayName("active agent passes")
    void activeAgentPasses() {
        when(agentJpaRepository.findById("a1")).thenReturn(Optional.of(agent("a1", AgentStatus.ACTIVE)));

        RuleOutcome outcome = agentStatusRule.evaluate(context("a1"));

        assertThat(outcome.isTerminal()).isFalse();
        assertThat(outcome.getTraceEntry().getRuleChecked()).isEqualTo("agent_status");
        assertThat(outcome.getTraceEntry().getNotes()).isEqualTo("agent active");
    }

    private static RuleContext context(String agentId) {
        return RuleContext.builder().agentId(agentId).action("read").resource("db").build();
    }

    private static AgentEntity agent(String id, AgentStatus status) {
        return AgentEntity.builder().id(id).name(id).owner("alice").status(status).build();
    }
}
