package com.agentguard.mapper;

import com.agentguard.domain.model.SystemState;
import com.agentguard.entity.SystemStateEntity;
import org.mapstruct.Mapper;

@Mapper
public interface SystemStateMapper {

    SystemState toDomain(SystemStateEntity entity);
}
