package com.agentguard.entity;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.DecisionResult;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
import org.hibernate.annotations.Immutable;

/**
 * JPA entity for the audit_logs table.
 * Append-only trail with one row per completed decision. Hibernate treats the entity as
 * immutable so no update statement is ever issued for it.
 *
 * <p>pending_request_id is unique: a human resolution can produce at most one row.
 */
@Entity
@Immutable
@Table(
        name = "audit_logs",
        indexes = {
            @Index(name = "idx_audit_agent_time", columnList = "agent_id, recorded_at"),
            @Index(name = "idx_audit_time", columnList = "recorded_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agent_id", nullable = false, updatable = false)
    private String agentId;

    @Column(nullable = false, length = 100, updatable = false)
    private String action;

    @Column(nullable = false, updatable = false)
    private String resource;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, columnDefinition = "varchar(20)")
    private DecisionResult result;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, columnDefinition = "varchar(50)")
    private DecisionReason reason;

    @Column(name = "decision_trace", columnDefinition = "TEXT", updatable = false)
    private String decisionTrace;

    @Column(name = "pending_request_id", length = 36, unique = true, updatable = false)
    private String pendingRequestId;

    @Column(name = "resolved_by", updatable = false)
    private String resolvedBy;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private LocalDateTime timestamp;
}
