package com.agentguard.entity;

import com.agentguard.domain.enums.DecisionReason;
import com.agentguard.domain.enums.PendingStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the pending_requests table.
 *
 * <p>The status column is only ever moved out of PENDING through the conditional update
 * in {@code PendingRequestJpaRepository#resolveIfPending}, never through a plain save.
 */
@Entity
@Table(
        name = "pending_requests",
        indexes = @Index(name = "idx_pending_status_created", columnList = "status, created_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PendingRequestEntity {

    @Id
    @Column(name = "request_id", length = 36)
    private String requestId;

    @Column(name = "agent_id", nullable = false)
    private String agentId;

    @Column(nullable = false, length = 100)
    private String action;

    @Column(nullable = false)
    private String resource;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, columnDefinition = "varchar(50)")
    private DecisionReason reason;

    /** JSON array of trace entries. */
    @Column(name = "decision_trace", columnDefinition = "TEXT")
    private String decisionTrace;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, columnDefinition = "varchar(20)")
    private PendingStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "resolution_notes", length = 500)
    private String resolutionNotes;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
