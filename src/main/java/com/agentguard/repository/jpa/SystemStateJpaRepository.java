package com.agentguard.repository.jpa;

import com.agentguard.entity.SystemStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the single-row system_state table.
 */
@Repository
public interface SystemStateJpaRepository extends JpaRepository<SystemStateEntity, String> {}
