package com.agentguard.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the permissions table.
 * The identity column doubles as creation order, which is the order candidates are
 * evaluated in when several grants match the same (agent, action, resource).
 */
@Entity
@Table(
        name = "permissions",
        indexes = @Index(name = "idx_permissions_lookup", columnList = "agent_id, action, resource"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PermissionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agent_id", nullable = false)
    private String agentId;

    @Column(nullable = false, length = 100)
    private String action;

    @Column(nullable = false)
    private String resource;

    /** Optional qualifier, e.g. "time >= 09:00 and time < 18:00". */
    @Column(name = "condition_expression", length = 500)
    private String condition;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
