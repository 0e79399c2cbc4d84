package com.agentguard.repository.jpa;

import com.agentguard.domain.enums.PendingStatus;
import com.agentguard.entity.PendingRequestEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the pending_requests table.
 *
 * <p>{@link #resolveIfPending} is the only way a request leaves PENDING. It is a
 * conditional update, so concurrent resolvers (in this instance or another) race on the
 * database row and at most one of them sees an update count of 1.
 */
@Repository
public interface PendingRequestJpaRepository extends JpaRepository<PendingRequestEntity, String> {

    List<PendingRequestEntity> findByStatusOrderByCreatedAtAsc(PendingStatus status);

    long countByStatus(PendingStatus status);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PendingRequestEntity p SET p.status = :newStatus, p.resolvedBy = :resolvedBy,"
            + " p.resolutionNotes = :notes, p.resolvedAt = :resolvedAt, p.decisionTrace = :decisionTrace"
            + " WHERE p.requestId = :requestId AND p.status = :expectedStatus")
    int resolveIfPending(
            @Param("requestId") String requestId,
            @Param("expectedStatus") PendingStatus expectedStatus,
            @Param("newStatus") PendingStatus newStatus,
            @Param("resolvedBy") String resolvedBy,
            @Param("notes") String notes,
            @Param("resolvedAt") LocalDateTime resolvedAt,
            @Param("decisionTrace") String decisionTrace);
}
