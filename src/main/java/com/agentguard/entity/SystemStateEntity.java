package com.agentguard.entity;

import com.agentguard.domain.enums.KillSwitchState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the system_state table. Holds at most one row, keyed by
 * {@code system_kill_switch}.
 */
@Entity
@Table(name = "system_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SystemStateEntity {

    @Id
    @Column(name = "state_key", length = 50)
    private String key;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, columnDefinition = "varchar(20)")
    private KillSwitchState state;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
