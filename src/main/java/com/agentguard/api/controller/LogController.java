package com.agentguard.api.controller;

import com.agentguard.api.TimestampParser;
import com.agentguard.api.dto.response.LogResponse;
import com.agentguard.mapper.GuardDtoMapper;
import com.agentguard.service.DecisionFacade;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to the audit trail: GET /api/logs with optional {@code agent_id},
 * {@code start_time} and {@code end_time} (inclusive) filters.
 */
@RestController
@RequestMapping("/api/logs")
public class LogController {

    private final DecisionFacade decisionFacade;
    private final GuardDtoMapper guardDtoMapper;

    public LogController(DecisionFacade decisionFacade, GuardDtoMapper guardDtoMapper) {
        this.decisionFacade = decisionFacade;
        this.guardDtoMapper = guardDtoMapper;
    }

    @GetMapping
    public ResponseEntity<List<LogResponse>> getLogs(
            @RequestParam(name = "agent_id", required = false) String agentId,
            @RequestParam(name = "start_time", required = false) String startTime,
            @RequestParam(name = "end_time", required = false) String endTime) {
        return ResponseEntity.ok(guardDtoMapper.toLogResponseList(decisionFacade.queryLogs(
                agentId,
                TimestampParser.parseUtc(startTime, "start_time"),
                TimestampParser.parseUtc(endTime, "end_time"))));
    }
}
