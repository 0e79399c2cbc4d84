package com.agentguard.mapper;

import com.agentguard.domain.model.Agent;
import com.agentguard.entity.AgentEntity;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between Agent domain model and AgentEntity.
 */
@Mapper
public interface AgentMapper {

    Agent toDomain(AgentEntity entity);

    AgentEntity toEntity(Agent agent);
}
