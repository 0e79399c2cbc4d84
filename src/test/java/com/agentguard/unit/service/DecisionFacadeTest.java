package com.agentguard.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.agentguard.audit.AuditRecorder;
import com.agentguard.domain.enums.AgentStatus;
import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.DecisionResult;
import com.agentguard.domain.enums.HumanDecision;
import com.agentguard.domain.enums.KillSwitchState;
import com.agentguard.domain.enums.PendingStatus;
import com.agentguard.domain.enums.RuleName;
import com.agentguard.domain.enums.Verdict;
import com.agentguard.domain.model.AgentStatusChange;
import com.agentguard.domain.model.Decision;
import com.agentguard.domain.model.KillSwitchStatus;
import com.agentguard.domain.model.PendingRequest;
import com.agentguard.domain.model.TraceEntry;
import com.agentguard.entity.AgentEntity;
import com.agentguard.escalation.EscalationManager;
import com.agentguard.event.EventPublisherHelper;
import com.agentguard.exception.ForbiddenException;
import com.agentguard.exception.ResourceNotFoundException;
import com.agentguard.exception.ValidationException;
import com.agentguard.mapper.AgentMapper;
import com.agentguard.pipeline.PipelineResult;
import com.agentguard.pipeline.RulePipeline;
import com.agentguard.repository.jpa.AgentJpaRepository;
import com.agentguard.service.DecisionFacade;
import com.agentguard.service.SystemStateService;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DecisionFacadeTest {

    @Mock
    private RulePipeline rulePipeline;

    @Mock
    private EscalationManager escalationManager;

    @Mock
    private AuditRecorder auditRecorder;

    @Mock
    private SystemStateService systemStateService;

    @Mock
    private AgentJpaRepository agentJpaRepository;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private DecisionFacade decisionFacade;

    @BeforeEach
    void setUp() {
        decisionFacade = new DecisionFacade(
                rulePipeline,
                escalationManager,
                auditRecorder,
                systemStateService,
                agentJpaRepository,
                Mappers.getMapper(AgentMapper.class),
                eventPublisherHelper);
    }

    @Nested
    @DisplayName("checkRequest")
    class CheckRequest {

        @Test
        @DisplayName("approved verdict is audited immediately and needs no action")
        void approvedIsAudited() {
            List<TraceEntry> trace = List.of(
                    TraceEntry.passed(RuleName.KILL_SWITCH, "kill switch off"),
                    TraceEntry.passed(RuleName.AGENT_STATUS, "agent active"),
                    TraceEntry.passed(RuleName.PERMISSION_RULE, "permission granted for read on db"));
            when(rulePipeline.evaluate("a1", "read", "db"))
                    .thenReturn(result(Verdict.APPROVED, DecisionReason.ALL_CHECKS_PASSED, trace));

            Decision decision = decisionFacade.checkRequest("a1", "read", "db");

            assertThat(decision.getResult()).isEqualTo(DecisionResult.APPROVED);
            assertThat(decision.getReason()).isEqualTo(DecisionReason.ALL_CHECKS_PASSED);
            assertThat(decision.getActionRequired()).isNull();
            assertThat(decision.getRequestId()).isNull();
            verify(auditRecorder)
                    .record("a1", "read", "db", DecisionResult.APPROVED, DecisionReason.ALL_CHECKS_PASSED, trace);
            verifyNoInteractions(escalationManager);
            verify(eventPublisherHelper)
                    .publishDecisionRecorded(
                            decisionFacade, "a1", DecisionResult.APPROVED, DecisionReason.ALL_CHECKS_PASSED);
        }

        @Test
        @DisplayName("denied verdict is audited as denied")
        void deniedIsAudited() {
            List<TraceEntry> trace = List.of(
                    TraceEntry.passed(RuleName.KILL_SWITCH, "kill switch off"),
                    TraceEntry.failed(RuleName.AGENT_STATUS, "agent disabled"));
            when(rulePipeline.evaluate("a2", "read", "db"))
                    .thenReturn(result(Verdict.DENIED, DecisionReason.AGENT_DISABLED, trace));

            Decision decision = decisionFacade.checkRequest("a2", "read", "db");

            assertThat(decision.getResult()).isEqualTo(DecisionResult.DENIED);
            verify(auditRecorder)
                    .record("a2", "read", "db", DecisionResult.DENIED, DecisionReason.AGENT_DISABLED, trace);
        }

        @Test
        @DisplayName("escalated verdict opens a pending request and is not audited yet")
        void escalatedIsPending() {
            List<TraceEntry> trace = List.of(TraceEntry.failed(RuleName.KILL_SWITCH, "system kill switch enabled"));
            when(rulePipeline.evaluate("a1", "read", "db"))
                    .thenReturn(result(Verdict.ESCALATED, DecisionReason.SYSTEM_KILL_SWITCH_ENABLED, trace));
            when(escalationManager.escalate("a1", "read", "db", DecisionReason.SYSTEM_KILL_SWITCH_ENABLED, trace))
                    .thenReturn(PendingRequest.builder()
                            .requestId("r1")
                            .status(PendingStatus.PENDING)
                            .build());

            Decision decision = decisionFacade.checkRequest("a1", "read", "db");

            assertThat(decision.getResult()).isEqualTo(DecisionResult.PENDING);
            assertThat(decision.isPending()).isTrue();
            assertThat(decision.getActionRequired()).isEqualTo("human_intervention");
            assertThat(decision.getRequestId()).isEqualTo("r1");
            assertThat(decision.getDecisionTrace()).hasSize(1);
            verify(auditRecorder, never()).record(any(), any(), any(), any(), any(), anyList());
            verify(eventPublisherHelper)
                    .publishEscalationCreated(decisionFacade, "a1", DecisionReason.SYSTEM_KILL_SWITCH_ENABLED, "r1");
        }

        @Test
        @DisplayName("blank input is rejected before any rule runs")
        void blankInputRejected() {
            assertThatThrownBy(() -> decisionFacade.checkRequest(" ", "read", "db"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("agent_id");
            assertThatThrownBy(() -> decisionFacade.checkRequest("a1", null, "db"))
                    .isInstanceOf(ValidationException.class);

            verifyNoInteractions(rulePipeline, auditRecorder, escalationManager);
        }

        @Test
        @DisplayName("input is trimmed before evaluation")
        void inputTrimmed() {
            when(rulePipeline.evaluate("a1", "read", "db"))
                    .thenReturn(result(Verdict.DENIED, DecisionReason.PERMISSION_RULE_FAILED, List.of()));

            decisionFacade.checkRequest("  a1 ", "read ", " db");

            verify(rulePipeline).evaluate("a1", "read", "db");
        }
    }

    @Nested
    @DisplayName("setAgentEnabled")
    class SetAgentEnabled {

        @Test
        @DisplayName("owner can disable their agent")
        void ownerDisables() {
            when(agentJpaRepository.findById("a1")).thenReturn(Optional.of(agent("a1", "alice")));
            when(agentJpaRepository.updateStatusForOwner("a1", "alice", AgentStatus.DISABLED))
                    .thenReturn(1);

            AgentStatusChange change = decisionFacade.setAgentEnabled("a1", "alice", false);

            assertThat(change.getStatus()).isEqualTo(AgentStatus.DISABLED);
            assertThat(change.getPreviousStatus()).isEqualTo(AgentStatus.ACTIVE);
            assertThat(change.getMessage()).isEqualTo("Agent a1 has been disabled by owner alice");
            verify(eventPublisherHelper).publishAgentStatusChanged(decisionFacade, "a1", "alice", AgentStatus.DISABLED);
        }

        @Test
        @DisplayName("non-owner is forbidden and nothing changes")
        void nonOwnerForbidden() {
            when(agentJpaRepository.findById("a1")).thenReturn(Optional.of(agent("a1", "alice")));

            assertThatThrownBy(() -> decisionFacade.setAgentEnabled("a1", "mallory", false))
                    .isInstanceOf(ForbiddenException.class);
            verify(agentJpaRepository, never()).updateStatusForOwner(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("unknown agent is not found")
        void unknownAgent() {
            when(agentJpaRepository.findById("ghost")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> decisionFacade.setAgentEnabled("ghost", "alice", true))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("setSystemKillSwitch flips the row and publishes the change")
    void setSystemKillSwitch() {
        KillSwitchStatus status = KillSwitchStatus.builder()
                .state(KillSwitchState.ENABLED)
                .message("System kill switch is enabled.")
                .build();
        when(systemStateService.setState(KillSwitchState.ENABLED)).thenReturn(status);

        assertThat(decisionFacade.setSystemKillSwitch(true)).isSameAs(status);
        verify(eventPublisherHelper).publishKillSwitchChanged(decisionFacade, KillSwitchState.ENABLED);
    }

    @Test
    @DisplayName("resolvePending returns a human_override decision with the final trace")
    void resolvePending() {
        List<TraceEntry> finalTrace = List.of(
                TraceEntry.failed(RuleName.KILL_SWITCH, "system kill switch enabled"),
                TraceEntry.passed(RuleName.HUMAN_DECISION, "approved by human alice (looks fine)"));
        when(escalationManager.resolve("r1", "alice", HumanDecision.APPROVE, "looks fine"))
                .thenReturn(PendingRequest.builder()
                        .requestId("r1")
                        .agentId("a1")
                        .status(PendingStatus.APPROVED)
                        .decisionTrace(finalTrace)
                        .build());

        Decision decision = decisionFacade.resolvePending("r1", "alice", HumanDecision.APPROVE, "  looks fine ");

        assertThat(decision.getResult()).isEqualTo(DecisionResult.APPROVED);
        assertThat(decision.getReason()).isEqualTo(DecisionReason.HUMAN_OVERRIDE);
        assertThat(decision.getActionRequired()).isNull();
        assertThat(decision.getDecisionTrace()).isEqualTo(finalTrace);
        verify(eventPublisherHelper)
                .publishEscalationResolved(decisionFacade, "a1", DecisionResult.APPROVED, "r1", "alice");
    }

    @Test
    @DisplayName("queryLogs treats a blank agent filter as absent")
    void queryLogsBlankAgent() {
        when(auditRecorder.query(null, null, null)).thenReturn(List.of());

        assertThat(decisionFacade.queryLogs(" ", null, null)).isEmpty();
        verify(auditRecorder).query(eq(null), eq(null), eq(null));
    }

    private static PipelineResult result(Verdict verdict, DecisionReason reason, List<TraceEntry> trace) {
        return PipelineResult.builder()
                .verdict(verdict)
                .reason(reason)
                .message("message")
                .trace(trace)
                .build();
    }

    private static AgentEntity agent(String id, String owner) {
        return AgentEntity.builder()
                .id(id)
                .name(id)
                .owner(owner)
                .status(AgentStatus.ACTIVE)
                .build();
    }
}
