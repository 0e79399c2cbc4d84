package com.agentguard.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.agentguard.domain.enums.KillSwitchState;
import com.agentguard.domain.model.KillSwitchStatus;
import com.agentguard.domain.model.SystemState;
import com.agentguard.entity.SystemStateEntity;
import com.agentguard.exception.SystemStateException;
import com.agentguard.mapper.SystemStateMapper;
import com.agentguard.repository.jpa.SystemStateJpaRepository;
import com.agentguard.service.SystemStateService;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SystemStateServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:30:00Z");

    @Mock
    private SystemStateJpaRepository systemStateJpaRepository;

    private SystemStateService systemStateService;

    @BeforeEach
    void setUp() {
        systemStateService = new SystemStateService(
                systemStateJpaRepository, Mappers.getMapper(SystemStateMapper.class), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("missing row is a system error, not a default")
    void missingRowFailsClosed() {
        when(systemStateJpaRepository.findById(SystemState.KILL_SWITCH_KEY)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> systemStateService.currentState()).isInstanceOf(SystemStateException.class);
    }

    @Test
    @DisplayName("status message describes the current behaviour")
    void statusMessage() {
        when(systemStateJpaRepository.findById(SystemState.KILL_SWITCH_KEY))
                .thenReturn(Optional.of(row(KillSwitchState.ENABLED)));

        KillSwitchStatus status = systemStateService.getStatus();

        assertThat(status.getState()).isEqualTo(KillSwitchState.ENABLED);
        assertThat(status.getMessage()).contains("enabled").contains("escalated for human review");
    }

    @Test
    @DisplayName("setState updates the existing row")
    void setStateUpdates() {
        when(systemStateJpaRepository.findById(SystemState.KILL_SWITCH_KEY))
                .thenReturn(Optional.of(row(KillSwitchState.DISABLED)));
        when(systemStateJpaRepository.save(any(SystemStateEntity.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        KillSwitchStatus status = systemStateService.setState(KillSwitchState.ENABLED);

        assertThat(status.getState()).isEqualTo(KillSwitchState.ENABLED);
        assertThat(status.getUpdatedAt()).isEqualTo(LocalDateTime.of(2025, 1, 15, 10, 30));
    }

    @Test
    @DisplayName("setState creates the row when absent")
    void setStateUpserts() {
        when(systemStateJpaRepository.findById(SystemState.KILL_SWITCH_KEY)).thenReturn(Optional.empty());
        when(systemStateJpaRepository.save(any(SystemStateEntity.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        systemStateService.setState(KillSwitchState.DISABLED);

        ArgumentCaptor<SystemStateEntity> captor = ArgumentCaptor.forClass(SystemStateEntity.class);
        verify(systemStateJpaRepository).save(captor.capture());
        assertThat(captor.getValue().getKey()).isEqualTo(SystemState.KILL_SWITCH_KEY);
        assertThat(captor.getValue().getState()).isEqualTo(KillSwitchState.DISABLED);
    }

    @Test
    @DisplayName("initializeIfAbsent never overwrites an existing row")
    void initializeKeepsExisting() {
        when(systemStateJpaRepository.existsById(SystemState.KILL_SWITCH_KEY)).thenReturn(true);

        assertThat(systemStateService.initializeIfAbsent(KillSwitchState.ENABLED)).isFalse();
        verify(systemStateJpaRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("initializeIfAbsent inserts the configured state")
    void initializeInserts() {
        when(systemStateJpaRepository.existsById(SystemState.KILL_SWITCH_KEY)).thenReturn(false);

        assertThat(systemStateService.initializeIfAbsent(KillSwitchState.ENABLED)).isTrue();

        ArgumentCaptor<SystemStateEntity> captor = ArgumentCaptor.forClass(SystemStateEntity.class);
        verify(systemStateJpaRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getState()).isEqualTo(KillSwitchState.ENABLED);
    }

    private static SystemStateEntity row(KillSwitchState state) {
        return SystemStateEntity.builder()
                .key(SystemState.KILL_SWITCH_KEY)
                .state(state)
                .updatedAt(LocalDateTime.of(2025, 1, 1, 0, 0))
                .build();
    }
}
