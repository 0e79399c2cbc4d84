package com.agentguard.service;

import com.agentguard.domain.model.Permission;
import com.agentguard.exception.ResourceNotFoundException;
import com.agentguard.exception.ValidationException;
import com.agentguard.mapper.PermissionMapper;
import com.agentguard.repository.jpa.AgentJpaRepository;
import com.agentguard.repository.jpa.PermissionJpaRepository;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only view of the permissions granted to an agent.
 */
@Service
public class PermissionService {

    private final PermissionJpaRepository permissionJpaRepository;
    private final AgentJpaRepository agentJpaRepository;
    private final PermissionMapper permissionMapper;

    public PermissionService(
            PermissionJpaRepository permissionJpaRepository,
            AgentJpaRepository agentJpaRepository,
            PermissionMapper permissionMapper) {
        this.permissionJpaRepository = permissionJpaRepository;
        this.agentJpaRepository = agentJpaRepository;
        this.permissionMapper = permissionMapper;
    }

    @Transactional(readOnly = true)
    public List<Permission> listForAgent(String agentId) {
        String id = ValidationException.requireText(agentId, "agent_id");
        if (!agentJpaRepository.existsById(id)) {
            throw ResourceNotFoundException.agent(id);
        }
        return permissionMapper.toDomainList(permissionJpaRepository.findByAgentIdOrderByIdAsc(id));
    }
}
