package com.agentguard.api.controller;

import com.agentguard.api.dto.request.AgentKillRequest;
import com.agentguard.api.dto.request.AgentRequest;
import com.agentguard.api.dto.request.HumanDecisionRequest;
import com.agentguard.api.dto.request.SystemKillSwitchRequest;
import com.agentguard.api.dto.response.AgentKillResponse;
import com.agentguard.api.dto.response.DecisionResponse;
import com.agentguard.api.dto.response.KillSwitchResponse;
import com.agentguard.api.dto.response.PendingApprovalResponse;
import com.agentguard.domain.enums.HumanDecision;
import com.agentguard.mapper.GuardDtoMapper;
import com.agentguard.service.DecisionFacade;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints used by agents and their human reviewers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/agent/request -- permission check for one action</li>
 *   <li>POST /api/agent/kill -- owner enables or disables an agent</li>
 *   <li>GET/POST /api/agent/system-kill-switch -- read or flip the system kill switch</li>
 *   <li>GET /api/agent/pending-approvals -- review queue, oldest first</li>
 *   <li>GET /api/agent/pending-approvals/{requestId} -- poll one escalated request</li>
 *   <li>POST /api/agent/approve, /api/agent/deny -- resolve an escalated request</li>
 * </ul>
 *
 * <p>A denied permission check is a normal 200 response; only malformed input, unknown
 * ids, ownership and conflict failures map to error statuses.
 */
@RestController
@RequestMapping("/api/agent")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final DecisionFacade decisionFacade;
    private final GuardDtoMapper guardDtoMapper;

    public AgentController(DecisionFacade decisionFacade, GuardDtoMapper guardDtoMapper) {
        this.decisionFacade = decisionFacade;
        this.guardDtoMapper = guardDtoMapper;
    }

    @PostMapping("/request")
    public ResponseEntity<DecisionResponse> checkRequest(@Valid @RequestBody AgentRequest request) {
        return ResponseEntity.ok(guardDtoMapper.toResponse(
                decisionFacade.checkRequest(request.getAgentId(), request.getAction(), request.getResource())));
    }

    @PostMapping("/kill")
    public ResponseEntity<AgentKillResponse> setAgentEnabled(@Valid @RequestBody AgentKillRequest request) {
        return ResponseEntity.ok(guardDtoMapper.toResponse(
                decisionFacade.setAgentEnabled(request.getAgentId(), request.getOwner(), request.getEnabled())));
    }

    @GetMapping("/system-kill-switch")
    public ResponseEntity<KillSwitchResponse> getSystemKillSwitch() {
        return ResponseEntity.ok(guardDtoMapper.toResponse(decisionFacade.getSystemKillSwitch()));
    }

    @PostMapping("/system-kill-switch")
    public ResponseEntity<KillSwitchResponse> setSystemKillSwitch(
            @Valid @RequestBody SystemKillSwitchRequest request) {
        log.warn("System kill switch change requested: enabled={}", request.getEnabled());
        return ResponseEntity.ok(guardDtoMapper.toResponse(decisionFacade.setSystemKillSwitch(request.getEnabled())));
    }

    @GetMapping("/pending-approvals")
    public ResponseEntity<List<PendingApprovalResponse>> listPendingApprovals() {
        return ResponseEntity.ok(guardDtoMapper.toPendingResponseList(decisionFacade.listPendingRequests()));
    }

    @GetMapping("/pending-approvals/{requestId}")
    public ResponseEntity<PendingApprovalResponse> getPendingApproval(@PathVariable String requestId) {
        return ResponseEntity.ok(guardDtoMapper.toResponse(decisionFacade.getPendingRequest(requestId)));
    }

    @PostMapping("/approve")
    public ResponseEntity<DecisionResponse> approve(@Valid @RequestBody HumanDecisionRequest request) {
        return ResponseEntity.ok(resolve(request, HumanDecision.APPROVE));
    }

    @PostMapping("/deny")
    public ResponseEntity<DecisionResponse> deny(@Valid @RequestBody HumanDecisionRequest request) {
        return ResponseEntity.ok(resolve(request, HumanDecision.DENY));
    }

    private DecisionResponse resolve(HumanDecisionRequest request, HumanDecision decision) {
        return guardDtoMapper.toResponse(decisionFacade.resolvePending(
                request.getRequestId(), request.getHumanId(), decision, request.getNotes()));
    }
}
