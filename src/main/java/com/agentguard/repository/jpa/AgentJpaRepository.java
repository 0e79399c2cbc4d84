package com.agentguard.repository.jpa;

import com.agentguard.domain.enums.AgentStatus;
import com.agentguard.entity.AgentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the agents table.
 * Read by the agent-status rule on every decision; written only by owner-scoped
 * enable/disable.
 */
@Repository
public interface AgentJpaRepository extends JpaRepository<AgentEntity, String> {

    /** Update only the status column, scoped to the recorded owner. Returns rows updated. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE AgentEntity a SET a.status = :status WHERE a.id = :id AND a.owner = :owner")
    int updateStatusForOwner(
            @Param("id") String id, @Param("owner") String owner, @Param("status") AgentStatus status);
}
