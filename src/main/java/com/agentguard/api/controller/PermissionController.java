package com.agentguard.api.controller;

import com.agentguard.api.dto.response.PermissionResponse;
import com.agentguard.mapper.GuardDtoMapper;
import com.agentguard.service.PermissionService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/permissions")
public class PermissionController {

    private final PermissionService permissionService;
    private final GuardDtoMapper guardDtoMapper;

    public PermissionController(PermissionService permissionService, GuardDtoMapper guardDtoMapper) {
        this.permissionService = permissionService;
        this.guardDtoMapper = guardDtoMapper;
    }

    @GetMapping
    public ResponseEntity<List<PermissionResponse>> getPermissions(@RequestParam("agentId") String agentId) {
        return ResponseEntity.ok(guardDtoMapper.toPermissionResponseList(permissionService.listForAgent(agentId)));
    }
}
