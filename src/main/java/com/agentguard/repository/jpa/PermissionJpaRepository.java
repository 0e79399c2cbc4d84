package com.agentguard.repository.jpa;

import com.agentguard.entity.PermissionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the permissions table. Read-only from the engine's perspective.
 */
@Repository
public interface PermissionJpaRepository extends JpaRepository<PermissionEntity, Long> {

    /** Candidate grants for a request, in creation order. */
    List<PermissionEntity> findByAgentIdAndActionAndResourceOrderByIdAsc(
            String agentId, String action, String resource);

    List<PermissionEntity> findByAgentIdOrderByIdAsc(String agentId);
}
