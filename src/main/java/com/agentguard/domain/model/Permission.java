package com.agentguard.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A standing grant allowing an agent to perform an action on a resource.
 *
 * <p>The optional {@code condition} narrows when the grant applies, e.g.
 * {@code time < 18:00}. Candidates are evaluated in creation order (ascending id).
 */
@Data
@Builder
public class Permission {

    private Long id;

    private String agentId;

    private String action;

    private String resource;

    /** Qualifier expression. Null or blank means unconditional. */
    private String condition;

    private LocalDateTime createdAt;

    public boolean isConditional() {
        return condition != null && !condition.isBlank();
    }
}
