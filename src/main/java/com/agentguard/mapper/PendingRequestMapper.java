package com.agentguard.mapper;

import com.agentguard.domain.model.PendingRequest;
import com.agentguard.domain.model.TraceEntry;
import com.agentguard.entity.PendingRequestEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between PendingRequest domain model and PendingRequestEntity.
 *
 * <p>The decision trace is a list in the domain model and a JSON string in the entity;
 * conversion goes through {@link JsonHelper}.
 */
@Mapper
public interface PendingRequestMapper {

    @Mapping(source = "decisionTrace", target = "decisionTrace", qualifiedByName = "traceToJson")
    PendingRequestEntity toEntity(PendingRequest pendingRequest);

    @Mapping(source = "decisionTrace", target = "decisionTrace", qualifiedByName = "jsonToTrace")
    PendingRequest toDomain(PendingRequestEntity entity);

    List<PendingRequest> toDomainList(List<PendingRequestEntity> entities);

    @Named("traceToJson")
    default String traceToJson(List<TraceEntry> trace) {
        return JsonHelper.writeTrace(trace);
    }

    @Named("jsonToTrace")
    default List<TraceEntry> jsonToTrace(String json) {
        return JsonHelper.readTrace(json);
    }
}
