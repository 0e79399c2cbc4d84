package com.agentguard.unit.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.RuleName;
import com.agentguard.domain.enums.RuleResult;
import com.agentguard.domain.enums.Verdict;
import com.agentguard.domain.model.TraceEntry;
import com.agentguard.pipeline.AgentStatusRule;
import com.agentguard.pipeline.KillSwitchRule;
import com.agentguard.pipeline.PermissionRule;
import com.agentguard.pipeline.PipelineResult;
import com.agentguard.pipeline.RuleContext;
import com.agentguard.pipeline.RuleOutcome;
import com.agentguard.pipeline.RulePipeline;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Verifies rule ordering, short-circuiting and trace accumulation of {@link RulePipeline}.
 */
@ExtendWith(MockitoExtension.class)
class RulePipelineTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:30:00Z");

    @Mock
    private KillSwitchRule killSwitchRule;

    @Mock
    private AgentStatusRule agentStatusRule;

    @Mock
    private PermissionRule permissionRule;

    private RulePipeline rulePipeline;

    @BeforeEach
    void setUp() {
        rulePipeline = new RulePipeline(
                killSwitchRule, agentStatusRule, permissionRule, Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.UTC);
    }

    @Test
    @DisplayName("all rules pass: approved with three trace entries in order")
    void allPass() {
        when(killSwitchRule.evaluate(any())).thenReturn(pass(RuleName.KILL_SWITCH, "kill switch off"));
        when(agentStatusRule.evaluate(any())).thenReturn(pass(RuleName.AGENT_STATUS, "agent active"));
        when(permissionRule.evaluate(any()))
                .thenReturn(RuleOutcome.pass(
                        TraceEntry.passed(RuleName.PERMISSION_RULE, "permission granted for read on db"),
                        "Permission granted for read on db"));

        PipelineResult result = rulePipeline.evaluate("a1", "read", "db");

        assertThat(result.getVerdict()).isEqualTo(Verdict.APPROVED);
        assertThat(result.getReason()).isEqualTo(DecisionReason.ALL_CHECKS_PASSED);
        assertThat(result.getMessage()).isEqualTo("Permission granted for read on db");
        assertThat(result.getTrace())
                .extracting(TraceEntry::getRuleChecked)
                .containsExactly("kill_switch", "agent_status", "permission_rule");
        assertThat(result.getTrace()).allMatch(entry -> entry.getRuleResult() == RuleResult.PASSED);
    }

    @Test
    @DisplayName("escalating kill switch stops evaluation after one entry")
    void killSwitchShortCircuits() {
        when(killSwitchRule.evaluate(any()))
                .thenReturn(RuleOutcome.escalate(
                        DecisionReason.SYSTEM_KILL_SWITCH_ENABLED,
                        "escalated",
                        TraceEntry.failed(RuleName.KILL_SWITCH, "system kill switch enabled")));

        PipelineResult result = rulePipeline.evaluate("a1", "read", "db");

        assertThat(result.getVerdict()).isEqualTo(Verdict.ESCALATED);
        assertThat(result.isEscalated()).isTrue();
        assertThat(result.getReason()).isEqualTo(DecisionReason.SYSTEM_KILL_SWITCH_ENABLED);
        assertThat(result.getTrace()).hasSize(1);
        verify(agentStatusRule, never()).evaluate(any());
        verify(permissionRule, never()).evaluate(any());
    }

    @Test
    @DisplayName("denying agent status stops before the permission rule")
    void agentStatusShortCircuits() {
        when(killSwitchRule.evaluate(any())).thenReturn(pass(RuleName.KILL_SWITCH, "kill switch off"));
        when(agentStatusRule.evaluate(any()))
                .thenReturn(RuleOutcome.deny(
                        DecisionReason.AGENT_DISABLED,
                        "Agent a2 is disabled",
                        TraceEntry.failed(RuleName.AGENT_STATUS, "agent disabled")));

        PipelineResult result = rulePipeline.evaluate("a2", "read", "db");

        assertThat(result.getVerdict()).isEqualTo(Verdict.DENIED);
        assertThat(result.getReason()).isEqualTo(DecisionReason.AGENT_DISABLED);
        assertThat(result.getMessage()).isEqualTo("Agent a2 is disabled");
        assertThat(result.getTrace())
                .extracting(TraceEntry::getRuleChecked)
                .containsExactly("kill_switch", "agent_status");
        verify(permissionRule, never()).evaluate(any());
    }

    @Test
    @DisplayName("every rule sees the same request and evaluation instant")
    void sharedContext() {
        when(killSwitchRule.evaluate(any())).thenReturn(pass(RuleName.KILL_SWITCH, "kill switch off"));
        when(agentStatusRule.evaluate(any())).thenReturn(pass(RuleName.AGENT_STATUS, "agent active"));
        when(permissionRule.evaluate(any())).thenReturn(pass(RuleName.PERMISSION_RULE, "granted"));

        rulePipeline.evaluate("a1", "read", "db");

        ArgumentCaptor<RuleContext> captor = ArgumentCaptor.forClass(RuleContext.class);
        verify(permissionRule).evaluate(captor.capture());
        RuleContext context = captor.getValue();
        assertThat(context.getAgentId()).isEqualTo("a1");
        assertThat(context.getAction()).isEqualTo("read");
        assertThat(context.getResource()).isEqualTo("db");
        assertThat(context.getEvaluation().getEvaluatedAt()).isEqualTo(NOW);
    }

    private static RuleOutcome pass(RuleName rule, String notes) {
        return RuleOutcome.pass(TraceEntry.passed(rule, notes));
    }
}
