package com.agentguard.mapper;

import com.agentguard.api.dto.response.AgentKillResponse;
import com.agentguard.api.dto.response.DecisionResponse;
import com.agentguard.api.dto.response.KillSwitchResponse;
import com.agentguard.api.dto.response.LogResponse;
import com.agentguard.api.dto.response.PendingApprovalResponse;
import com.agentguard.api.dto.response.PermissionResponse;
import com.agentguard.domain.enums.AgentStatus;
import com.agentguard.domain.enums.PendingStatus;
import com.agentguard.domain.model.AgentStatusChange;
import com.agentguard.domain.model.AuditLogEntry;
import com.agentguard.domain.model.Decision;
import com.agentguard.domain.model.KillSwitchStatus;
import com.agentguard.domain.model.PendingRequest;
import com.agentguard.domain.model.Permission;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from domain models to REST response DTOs.
 *
 * <p>Stored timestamps are UTC local date-times; responses carry them as instants so the
 * wire format always has an explicit offset.
 */
@Mapper(imports = {AgentStatus.class, PendingStatus.class, PendingRequest.class, Decision.class})
public interface GuardDtoMapper {

    DecisionResponse toResponse(Decision decision);

    @Mapping(target = "enabled", expression = "java(change.getStatus() == AgentStatus.ACTIVE)")
    AgentKillResponse toResponse(AgentStatusChange change);

    @Mapping(target = "enabled", expression = "java(status.getState().isEnabled())")
    KillSwitchResponse toResponse(KillSwitchStatus status);

    @Mapping(
            target = "actionRequired",
            expression = "java(pendingRequest.isPending() ? Decision.HUMAN_INTERVENTION : null)")
    PendingApprovalResponse toResponse(PendingRequest pendingRequest);

    List<PendingApprovalResponse> toPendingResponseList(List<PendingRequest> pendingRequests);

    LogResponse toResponse(AuditLogEntry entry);

    List<LogResponse> toLogResponseList(List<AuditLogEntry> entries);

    PermissionResponse toResponse(Permission permission);

    List<PermissionResponse> toPermissionResponseList(List<Permission> permissions);

    default Instant toInstant(LocalDateTime utc) {
        return utc != null ? utc.toInstant(ZoneOffset.UTC) : null;
    }
}
