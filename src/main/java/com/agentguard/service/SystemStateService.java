package com.agentguard.service;

import com.agentguard.domain.enums.KillSwitchState;
import com.agentguard.domain.model.KillSwitchStatus;
import com.agentguard.domain.model.SystemState;
import com.agentguard.entity.SystemStateEntity;
import com.agentguard.exception.SystemStateException;
import com.agentguard.mapper.SystemStateMapper;
import com.agentguard.repository.jpa.SystemStateJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and writes the system-wide kill switch.
 *
 * <p>The flag lives in a single persisted row rather than in memory, so every instance
 * and every restart sees the same value. The row is created at startup by
 * {@link SystemStateInitializer}; if it is missing afterwards, reads fail with a
 * {@link SystemStateException} instead of guessing a default.
 */
@Service
public class SystemStateService {

    private static final Logger log = LoggerFactory.getLogger(SystemStateService.class);

    private final SystemStateJpaRepository systemStateJpaRepository;
    private final SystemStateMapper systemStateMapper;
    private final Clock clock;

    public SystemStateService(
            SystemStateJpaRepository systemStateJpaRepository, SystemStateMapper systemStateMapper, Clock clock) {
        this.systemStateJpaRepository = systemStateJpaRepository;
        this.systemStateMapper = systemStateMapper;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public SystemState get() {
        return systemStateJpaRepository
                .findById(SystemState.KILL_SWITCH_KEY)
                .map(systemStateMapper::toDomain)
                .orElseThrow(() -> new SystemStateException("System kill switch state is missing"));
    }

    public KillSwitchState currentState() {
        return get().getState();
    }

    public KillSwitchStatus getStatus() {
        return KillSwitchStatus.of(get());
    }

    /**
     * Upserts the kill switch row. Affects only evaluations that start afterwards.
     */
    @Transactional
    public KillSwitchStatus setState(KillSwitchState state) {
        SystemStateEntity entity = systemStateJpaRepository
                .findById(SystemState.KILL_SWITCH_KEY)
                .orElseGet(() -> SystemStateEntity.builder().key(SystemState.KILL_SWITCH_KEY).build());
        entity.setState(state);
        entity.setUpdatedAt(LocalDateTime.now(clock));
        SystemStateEntity saved = systemStateJpaRepository.save(entity);
        log.warn("System kill switch set to {}", state.getValue());
        return KillSwitchStatus.of(systemStateMapper.toDomain(saved));
    }

    /**
     * Creates the row with {@code initialState} unless it already exists.
     *
     * @return true if the row was created
     */
    @Transactional
    public boolean initializeIfAbsent(KillSwitchState initialState) {
        if (systemStateJpaRepository.existsById(SystemState.KILL_SWITCH_KEY)) {
            return false;
        }
        systemStateJpaRepository.saveAndFlush(SystemStateEntity.builder()
                .key(SystemState.KILL_SWITCH_KEY)
                .state(initialState)
                .updatedAt(LocalDateTime.now(clock))
                .build());
        return true;
    }
}
