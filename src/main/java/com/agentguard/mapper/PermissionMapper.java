package com.agentguard.mapper;

import com.agentguard.domain.model.Permission;
import com.agentguard.entity.PermissionEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between Permission domain model and PermissionEntity.
 * Straightforward 1:1 field mapping.
 */
@Mapper
public interface PermissionMapper {

    Permission toDomain(PermissionEntity entity);

    PermissionEntity toEntity(Permission permission);

    List<Permission> toDomainList(List<PermissionEntity> entities);
}
