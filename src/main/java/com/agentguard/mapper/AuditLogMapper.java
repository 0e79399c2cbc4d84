package com.agentguard.mapper;

import com.agentguard.domain.model.AuditLogEntry;
import com.agentguard.domain.model.TraceEntry;
import com.agentguard.entity.AuditLogEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between AuditLogEntry domain model and AuditLogEntity.
 * The trace column is JSON, handled by {@link JsonHelper}.
 */
@Mapper
public interface AuditLogMapper {

    @Mapping(source = "decisionTrace", target = "decisionTrace", qualifiedByName = "traceToJson")
    AuditLogEntity toEntity(AuditLogEntry entry);

    @Mapping(source = "decisionTrace", target = "decisionTrace", qualifiedByName = "jsonToTrace")
    AuditLogEntry toDomain(AuditLogEntity entity);

    List<AuditLogEntry> toDomainList(List<AuditLogEntity> entities);

    @Named("traceToJson")
    default String traceToJson(List<TraceEntry> trace) {
        return JsonHelper.writeTrace(trace);
    }

    @Named("jsonToTrace")
    default List<TraceEntry> jsonToTrace(String json) {
        return JsonHelper.readTrace(json);
    }
}
